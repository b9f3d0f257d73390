package com.efaktur.backend.model;

import java.util.List;

import com.efaktur.backend.enums.ErrorKind;
import com.efaktur.backend.enums.ValidationStatus;

import lombok.Builder;
import lombok.Value;

/**
 * Result of one validation request. {@code errorKind} is set only when {@code status} is ERROR;
 * {@code qrUrl}, {@code extractedData} and {@code rawText} are diagnostics attached by the pipeline.
 */
@Value
@Builder(toBuilder = true)
public class ValidationOutcome {

    ValidationStatus status;
    String message;
    List<Deviation> deviations;
    InvoiceFieldSet validatedData;

    ErrorKind errorKind;

    InvoiceFieldSet extractedData;
    String qrUrl;
    String rawText;

    public boolean isError() {
        return status == ValidationStatus.ERROR;
    }

    public static ValidationOutcome error(ErrorKind kind, String message) {
        return ValidationOutcome.builder()
                .status(ValidationStatus.ERROR)
                .errorKind(kind)
                .message(message)
                .deviations(List.of())
                .validatedData(InvoiceFieldSet.empty())
                .build();
    }
}
