package com.efaktur.backend.model;

import java.util.Objects;
import java.util.Optional;

import com.efaktur.backend.enums.DeviationType;
import com.efaktur.backend.enums.InvoiceField;

/**
 * A single discrepancy for one field between the document and the DJP record.
 */
public record Deviation(
        InvoiceField field,
        Optional<Object> documentValue,
        Optional<Object> authoritativeValue,
        DeviationType type
) {
    public Deviation {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(type, "type");
        documentValue = documentValue == null ? Optional.empty() : documentValue;
        authoritativeValue = authoritativeValue == null ? Optional.empty() : authoritativeValue;
    }

    public static Deviation mismatch(InvoiceField field, Object documentValue, Object authoritativeValue) {
        return new Deviation(field, Optional.of(documentValue), Optional.of(authoritativeValue), DeviationType.MISMATCH);
    }

    public static Deviation missingInDocument(InvoiceField field, Object authoritativeValue) {
        return new Deviation(field, Optional.empty(), Optional.of(authoritativeValue), DeviationType.MISSING_IN_DOCUMENT);
    }

    public static Deviation missingInApi(InvoiceField field, Object documentValue) {
        return new Deviation(field, Optional.of(documentValue), Optional.empty(), DeviationType.MISSING_IN_API);
    }
}
