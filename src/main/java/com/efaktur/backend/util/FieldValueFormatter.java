package com.efaktur.backend.util;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import com.efaktur.backend.enums.InvoiceField;
import com.efaktur.backend.model.InvoiceFieldSet;

/**
 * Renders field values the way DJP prints them: dates as DD/MM/YYYY, amounts as plain digits.
 */
public final class FieldValueFormatter {

    private FieldValueFormatter() {
    }

    public static String format(Object value) {
        if (value == null) return null;
        if (value instanceof LocalDate) return InvoiceDateParser.format((LocalDate) value);
        if (value instanceof BigDecimal) return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        return value.toString();
    }

    /**
     * One entry per field in report order; absent fields map to {@code null}.
     */
    public static Map<String, String> toDisplayMap(InvoiceFieldSet fields) {
        Map<String, String> out = new LinkedHashMap<>();
        for (InvoiceField field : InvoiceField.values()) {
            out.put(field.getKey(), fields == null ? null : fields.get(field).map(FieldValueFormatter::format).orElse(null));
        }
        return out;
    }
}
