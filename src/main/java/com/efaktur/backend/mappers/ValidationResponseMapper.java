package com.efaktur.backend.mappers;

import java.util.List;
import java.util.stream.Collectors;

import com.efaktur.backend.dto.DeviationDTO;
import com.efaktur.backend.dto.ValidationResponseDTO;
import com.efaktur.backend.dto.ValidationResultsDTO;
import com.efaktur.backend.enums.ValidationStatus;
import com.efaktur.backend.model.Deviation;
import com.efaktur.backend.model.ValidationOutcome;
import com.efaktur.backend.util.FieldValueFormatter;

public class ValidationResponseMapper {
    private ValidationResponseMapper() {}

    public static ValidationResponseDTO toResponseDTO(ValidationOutcome outcome, boolean includeDiagnostics) {
        if (outcome == null) return null;

        if (outcome.isError()) {
            return error(outcome.getMessage());
        }

        List<DeviationDTO> deviations = outcome.getDeviations() == null
                ? List.of()
                : outcome.getDeviations().stream()
                        .map(ValidationResponseMapper::toDeviationDTO)
                        .collect(Collectors.toList());

        ValidationResultsDTO.ValidationResultsDTOBuilder results = ValidationResultsDTO.builder()
                .deviations(deviations)
                .validatedData(FieldValueFormatter.toDisplayMap(outcome.getValidatedData()));

        if (includeDiagnostics) {
            results.extractedData(FieldValueFormatter.toDisplayMap(outcome.getExtractedData()))
                    .qrUrl(outcome.getQrUrl())
                    .rawOcrText(outcome.getRawText() == null ? "" : outcome.getRawText());
        }

        return ValidationResponseDTO.builder()
                .status(outcome.getStatus().getCode())
                .message(outcome.getMessage())
                .validationResults(results.build())
                .build();
    }

    public static DeviationDTO toDeviationDTO(Deviation deviation) {
        if (deviation == null) return null;

        return DeviationDTO.builder()
                .field(deviation.field().getKey())
                .pdfValue(deviation.documentValue().map(FieldValueFormatter::format).orElse(null))
                .djpApiValue(deviation.authoritativeValue().map(FieldValueFormatter::format).orElse(null))
                .deviationType(deviation.type().getCode())
                .build();
    }

    public static ValidationResponseDTO error(String message) {
        return ValidationResponseDTO.builder()
                .status(ValidationStatus.ERROR.getCode())
                .message(message)
                .build();
    }
}
