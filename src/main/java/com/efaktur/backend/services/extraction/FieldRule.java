package com.efaktur.backend.services.extraction;

import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.efaktur.backend.enums.InvoiceField;

/**
 * One label-anchored extraction rule: the pattern finds the label and captures the raw value, {@code shape}
 * validates and converts the capture. A capture that fails shape validation yields no value.
 *
 * @param scope where the rule looks first, and which occurrence to take when it falls back to the whole text
 */
record FieldRule(InvoiceField field, Scope scope, Pattern pattern, Function<Matcher, Optional<?>> shape) {

    enum Scope {
        /** Seller block ("Pengusaha Kena Pajak"); fallback takes the first labelled occurrence. */
        SELLER(0),
        /** Buyer block ("Pembeli Barang Kena Pajak"); fallback takes the second labelled occurrence. */
        BUYER(1),
        /** Whole document, first occurrence. */
        DOCUMENT(0);

        private final int fallbackOccurrence;

        Scope(int fallbackOccurrence) {
            this.fallbackOccurrence = fallbackOccurrence;
        }
    }

    Optional<?> apply(String text, InvoiceSections sections) {
        String section = sections.textFor(scope);
        if (section != null) {
            Matcher m = pattern.matcher(section);
            if (m.find()) {
                Optional<?> value = shape.apply(m);
                if (value.isPresent()) return value;
            }
        }

        Matcher m = pattern.matcher(text);
        int seen = 0;
        while (m.find()) {
            if (seen++ == scope.fallbackOccurrence) {
                return shape.apply(m);
            }
        }
        return Optional.empty();
    }
}
