package com.efaktur.backend.services.validation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.efaktur.backend.enums.InvoiceField;
import com.efaktur.backend.enums.ValidationStatus;
import com.efaktur.backend.model.Deviation;
import com.efaktur.backend.model.InvoiceFieldSet;
import com.efaktur.backend.model.ValidationOutcome;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Compares the fields read from the document with the DJP record, field by field in report order.
 *
 * A field absent on both sides produces nothing. Present on one side only gives MISSING_IN_DOCUMENT or
 * MISSING_IN_API; present on both and unequal gives MISMATCH. Validated data is the DJP record as returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviationEngine {

    static final String MATCH_MESSAGE = "E-Faktur data matches DJP records";

    private final NameNormalizer nameNormalizer;
    private final ComparisonProperties comparisonProperties;

    public ValidationOutcome compare(InvoiceFieldSet extracted, InvoiceFieldSet authoritative) {
        InvoiceFieldSet document = extracted == null ? InvoiceFieldSet.empty() : extracted;
        InvoiceFieldSet record = authoritative == null ? InvoiceFieldSet.empty() : authoritative;

        List<Deviation> deviations = new ArrayList<>();
        for (InvoiceField field : InvoiceField.values()) {
            Optional<Object> docValue = document.get(field);
            Optional<Object> apiValue = record.get(field);

            if (docValue.isEmpty() && apiValue.isEmpty()) {
                continue;
            }
            if (docValue.isEmpty()) {
                deviations.add(Deviation.missingInDocument(field, apiValue.get()));
            } else if (apiValue.isEmpty()) {
                deviations.add(Deviation.missingInApi(field, docValue.get()));
            } else if (!sameValue(field, docValue.get(), apiValue.get())) {
                deviations.add(Deviation.mismatch(field, docValue.get(), apiValue.get()));
            }
        }

        log.info("[Deviation] {} deviation(s) across {} field(s)", deviations.size(), InvoiceField.values().length);

        return ValidationOutcome.builder()
                .status(deviations.isEmpty() ? ValidationStatus.SUCCESS : ValidationStatus.SUCCESS_WITH_DEVIATIONS)
                .message(deviations.isEmpty() ? MATCH_MESSAGE : "Found " + deviations.size() + " deviation(s) in e-Faktur data")
                .deviations(List.copyOf(deviations))
                .validatedData(record)
                .build();
    }

    boolean sameValue(InvoiceField field, Object documentValue, Object authoritativeValue) {
        switch (field.getKind()) {
            case NAME:
                return nameNormalizer.sameName((String) documentValue, (String) authoritativeValue);
            case AMOUNT:
                BigDecimal diff = ((BigDecimal) documentValue).subtract((BigDecimal) authoritativeValue).abs();
                return diff.compareTo(tolerance()) <= 0;
            default:
                return documentValue.equals(authoritativeValue);
        }
    }

    private BigDecimal tolerance() {
        BigDecimal configured = comparisonProperties.getAmountTolerance();
        return configured == null || configured.signum() < 0 ? BigDecimal.ZERO : configured;
    }
}
