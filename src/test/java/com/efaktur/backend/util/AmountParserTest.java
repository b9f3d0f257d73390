package com.efaktur.backend.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class AmountParserTest {

    @Test
    void parse_indonesianFormatWithDecimals() {
        assertEquals(0, new BigDecimal("15000000").compareTo(AmountParser.parse("15.000.000,00").orElseThrow()));
    }

    @Test
    void parse_stripsCurrencyPrefix() {
        assertEquals(0, new BigDecimal("1650000").compareTo(AmountParser.parse("Rp 1.650.000,00").orElseThrow()));
        assertEquals(0, new BigDecimal("1650000").compareTo(AmountParser.parse("IDR1.650.000").orElseThrow()));
    }

    @Test
    void parse_thousandsOnlyGrouping() {
        assertEquals(new BigDecimal("1234567"), AmountParser.parse("1.234.567").orElseThrow());
        assertEquals(new BigDecimal("1234"), AmountParser.parse("1,234").orElseThrow());
    }

    @Test
    void parse_englishFormat() {
        assertEquals(new BigDecimal("1650000.50"), AmountParser.parse("1,650,000.50").orElseThrow());
    }

    @Test
    void parse_plainDigits() {
        assertEquals(new BigDecimal("15000000"), AmountParser.parse("15000000").orElseThrow());
    }

    @Test
    void parse_rejectsNonNumeric() {
        assertTrue(AmountParser.parse(null).isEmpty());
        assertTrue(AmountParser.parse("").isEmpty());
        assertTrue(AmountParser.parse("Rp").isEmpty());
        assertTrue(AmountParser.parse("abc").isEmpty());
        assertTrue(AmountParser.parse("12a00").isEmpty());
    }
}
