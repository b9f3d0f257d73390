package com.efaktur.backend.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Date parsing for e-Faktur documents and DJP records. Slash dates are always day first (DD/MM/YYYY).
 */
public final class InvoiceDateParser {

    private static final DateTimeFormatter SLASH_DATE = DateTimeFormatter.ofPattern("d/M/uuuu")
            .withResolverStyle(ResolverStyle.STRICT);

    public static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("dd/MM/uuuu")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Map<String, Integer> INDONESIAN_MONTHS = Map.ofEntries(
            Map.entry("januari", 1),
            Map.entry("februari", 2),
            Map.entry("maret", 3),
            Map.entry("april", 4),
            Map.entry("mei", 5),
            Map.entry("juni", 6),
            Map.entry("juli", 7),
            Map.entry("agustus", 8),
            Map.entry("september", 9),
            Map.entry("oktober", 10),
            Map.entry("november", 11),
            Map.entry("desember", 12)
    );

    private InvoiceDateParser() {
    }

    public static Optional<LocalDate> parseSlashDate(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(raw.trim(), SLASH_DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Accepts DD/MM/YYYY first, then ISO (YYYY-MM-DD).
     */
    public static Optional<LocalDate> parseLenient(String raw) {
        Optional<LocalDate> slash = parseSlashDate(raw);
        if (slash.isPresent() || raw == null) return slash;
        try {
            return Optional.of(LocalDate.parse(raw.trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Builds a date from an Indonesian long form, e.g. ("01", "April", "2022").
     */
    public static Optional<LocalDate> fromIndonesianMonth(String day, String monthName, String year) {
        if (day == null || monthName == null || year == null) return Optional.empty();
        Integer month = INDONESIAN_MONTHS.get(monthName.trim().toLowerCase(Locale.ROOT));
        if (month == null) return Optional.empty();
        try {
            return Optional.of(LocalDate.of(Integer.parseInt(year.trim()), month, Integer.parseInt(day.trim())));
        } catch (NumberFormatException | DateTimeException e) {
            return Optional.empty();
        }
    }

    public static String format(LocalDate date) {
        return date == null ? null : DISPLAY_FORMAT.format(date);
    }
}
