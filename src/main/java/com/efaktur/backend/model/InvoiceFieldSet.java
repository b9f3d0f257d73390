package com.efaktur.backend.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import com.efaktur.backend.enums.InvoiceField;

/**
 * Immutable set of e-Faktur field values. A field is either present with a value of its kind's type
 * or absent; blank strings are never stored.
 */
public final class InvoiceFieldSet {

    private static final InvoiceFieldSet EMPTY = new InvoiceFieldSet(new EnumMap<>(InvoiceField.class));

    private final Map<InvoiceField, Object> values;

    private InvoiceFieldSet(EnumMap<InvoiceField, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static InvoiceFieldSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Object> get(InvoiceField field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean isPresent(InvoiceField field) {
        return values.containsKey(field);
    }

    public Optional<String> text(InvoiceField field) {
        return get(field).filter(String.class::isInstance).map(String.class::cast);
    }

    public Optional<LocalDate> date(InvoiceField field) {
        return get(field).filter(LocalDate.class::isInstance).map(LocalDate.class::cast);
    }

    public Optional<BigDecimal> amount(InvoiceField field) {
        return get(field).filter(BigDecimal.class::isInstance).map(BigDecimal.class::cast);
    }

    public int presentCount() {
        return values.size();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InvoiceFieldSet)) return false;
        return values.equals(((InvoiceFieldSet) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "InvoiceFieldSet" + values;
    }

    public static final class Builder {

        private final EnumMap<InvoiceField, Object> values = new EnumMap<>(InvoiceField.class);

        private Builder() {
        }

        /**
         * Sets a field. {@code null} and blank strings mark the field absent.
         *
         * @throws IllegalArgumentException if the value type does not match the field kind
         */
        public Builder put(InvoiceField field, Object value) {
            if (value == null || (value instanceof String && ((String) value).isBlank())) {
                values.remove(field);
                return this;
            }
            Class<?> expected = field.getKind().getValueType();
            if (!expected.isInstance(value)) {
                throw new IllegalArgumentException("Field " + field.getKey() + " expects " + expected.getSimpleName()
                        + " but got " + value.getClass().getSimpleName());
            }
            values.put(field, value instanceof String ? ((String) value).trim() : value);
            return this;
        }

        public Builder sellerTaxId(String value) {
            return put(InvoiceField.SELLER_TAX_ID, value);
        }

        public Builder sellerName(String value) {
            return put(InvoiceField.SELLER_NAME, value);
        }

        public Builder buyerTaxId(String value) {
            return put(InvoiceField.BUYER_TAX_ID, value);
        }

        public Builder buyerName(String value) {
            return put(InvoiceField.BUYER_NAME, value);
        }

        public Builder invoiceNumber(String value) {
            return put(InvoiceField.INVOICE_NUMBER, value);
        }

        public Builder invoiceDate(LocalDate value) {
            return put(InvoiceField.INVOICE_DATE, value);
        }

        public Builder taxBaseAmount(BigDecimal value) {
            return put(InvoiceField.TAX_BASE_AMOUNT, value);
        }

        public Builder vatAmount(BigDecimal value) {
            return put(InvoiceField.VAT_AMOUNT, value);
        }

        public InvoiceFieldSet build() {
            if (values.isEmpty()) return EMPTY;
            return new InvoiceFieldSet(new EnumMap<>(values));
        }
    }
}
