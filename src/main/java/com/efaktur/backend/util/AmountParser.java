package com.efaktur.backend.util;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses printed rupiah amounts into a currency-neutral magnitude.
 *
 * Example: "Rp 15.000.000,00" => 15000000.00, "1.234.567" => 1234567, "1,650,000.00" => 1650000.00
 */
public final class AmountParser {

    private static final Pattern CURRENCY_PREFIX = Pattern.compile("(?i)^(?:idr|rp)\\.?");
    private static final Pattern AMOUNT_SHAPE = Pattern.compile("\\d[\\d.,]*");

    private AmountParser() {
    }

    public static Optional<BigDecimal> parse(String raw) {
        if (raw == null) return Optional.empty();

        String s = raw.replaceAll("[\\s\\u00A0]+", "");
        s = CURRENCY_PREFIX.matcher(s).replaceFirst("");
        s = s.replaceAll("[.,]+$", "");
        if (s.isEmpty() || !AMOUNT_SHAPE.matcher(s).matches()) return Optional.empty();

        // The last separator is decimal only when followed by one or two digits; everything else groups thousands.
        int lastSep = Math.max(s.lastIndexOf('.'), s.lastIndexOf(','));
        String integerPart = s;
        String fraction = "";
        if (lastSep >= 0) {
            int digitsAfter = s.length() - lastSep - 1;
            if (digitsAfter >= 1 && digitsAfter <= 2) {
                integerPart = s.substring(0, lastSep);
                fraction = s.substring(lastSep + 1);
            }
        }

        integerPart = integerPart.replaceAll("[.,]", "");
        if (integerPart.isEmpty()) return Optional.empty();

        try {
            return Optional.of(new BigDecimal(fraction.isEmpty() ? integerPart : integerPart + "." + fraction));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
