package com.efaktur.backend.enums;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Value shape of an invoice field. Decides the Java type of the stored value and how two values are compared.
 */
public enum FieldKind {
    TAX_ID(String.class),
    NAME(String.class),
    DOCUMENT_NUMBER(String.class),
    DATE(LocalDate.class),
    AMOUNT(BigDecimal.class);

    private final Class<?> valueType;

    FieldKind(Class<?> valueType) {
        this.valueType = valueType;
    }

    public Class<?> getValueType() {
        return valueType;
    }
}
