package com.efaktur.backend.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;

class InvoiceDateParserTest {

    @Test
    void parseSlashDate_isDayFirst() {
        assertEquals(LocalDate.of(2022, 4, 1), InvoiceDateParser.parseSlashDate("01/04/2022").orElseThrow());
        assertEquals(LocalDate.of(2022, 4, 1), InvoiceDateParser.parseSlashDate("1/4/2022").orElseThrow());
    }

    @Test
    void parseSlashDate_dayAndMonthAreNotInterchangeable() {
        LocalDate first = InvoiceDateParser.parseSlashDate("01/02/2024").orElseThrow();
        LocalDate second = InvoiceDateParser.parseSlashDate("02/01/2024").orElseThrow();

        assertEquals(LocalDate.of(2024, 2, 1), first);
        assertEquals(LocalDate.of(2024, 1, 2), second);
        assertNotEquals(first, second);
    }

    @Test
    void parseSlashDate_rejectsImpossibleDates() {
        assertTrue(InvoiceDateParser.parseSlashDate("31/02/2022").isEmpty());
        assertTrue(InvoiceDateParser.parseSlashDate("01/13/2022").isEmpty());
        assertTrue(InvoiceDateParser.parseSlashDate("2022-04-01").isEmpty());
    }

    @Test
    void parseLenient_acceptsIsoAsFallback() {
        assertEquals(LocalDate.of(2022, 4, 1), InvoiceDateParser.parseLenient("2022-04-01").orElseThrow());
        assertEquals(LocalDate.of(2022, 4, 1), InvoiceDateParser.parseLenient(" 01/04/2022 ").orElseThrow());
        assertTrue(InvoiceDateParser.parseLenient("April 2022").isEmpty());
        assertTrue(InvoiceDateParser.parseLenient(null).isEmpty());
    }

    @Test
    void fromIndonesianMonth_mapsMonthNames() {
        assertEquals(LocalDate.of(2022, 4, 1), InvoiceDateParser.fromIndonesianMonth("01", "April", "2022").orElseThrow());
        assertEquals(LocalDate.of(2021, 8, 17), InvoiceDateParser.fromIndonesianMonth("17", "AGUSTUS", "2021").orElseThrow());
        assertEquals(LocalDate.of(2023, 12, 5), InvoiceDateParser.fromIndonesianMonth("5", "desember", "2023").orElseThrow());
    }

    @Test
    void fromIndonesianMonth_rejectsUnknownMonthOrDay() {
        assertTrue(InvoiceDateParser.fromIndonesianMonth("01", "August", "2022").isEmpty());
        assertTrue(InvoiceDateParser.fromIndonesianMonth("30", "Februari", "2022").isEmpty());
    }

    @Test
    void format_usesDjpDisplayForm() {
        assertEquals("01/04/2022", InvoiceDateParser.format(LocalDate.of(2022, 4, 1)));
    }
}
