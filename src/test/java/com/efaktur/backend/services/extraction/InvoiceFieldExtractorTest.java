package com.efaktur.backend.services.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;

import com.efaktur.backend.enums.InvoiceField;
import com.efaktur.backend.model.InvoiceFieldSet;
import com.efaktur.backend.support.EfakturFixtures;

class InvoiceFieldExtractorTest {

    private final InvoiceFieldExtractor extractor = new InvoiceFieldExtractor(new OcrTextCleaner());

    @Test
    void extract_fullSampleInvoice() {
        InvoiceFieldSet fields = extractor.extract(EfakturFixtures.SAMPLE_INVOICE_TEXT);

        assertEquals("012345678012000", fields.text(InvoiceField.SELLER_TAX_ID).orElseThrow());
        assertEquals("PT ABC", fields.text(InvoiceField.SELLER_NAME).orElseThrow());
        assertEquals("023456789217000", fields.text(InvoiceField.BUYER_TAX_ID).orElseThrow());
        assertEquals("PT XYZ", fields.text(InvoiceField.BUYER_NAME).orElseThrow());
        assertEquals("0700002212345678", fields.text(InvoiceField.INVOICE_NUMBER).orElseThrow());
        assertEquals(LocalDate.of(2022, 4, 1), fields.date(InvoiceField.INVOICE_DATE).orElseThrow());
        assertEquals(0, new BigDecimal("15000000").compareTo(fields.amount(InvoiceField.TAX_BASE_AMOUNT).orElseThrow()));
        assertEquals(0, new BigDecimal("1650000").compareTo(fields.amount(InvoiceField.VAT_AMOUNT).orElseThrow()));
        assertEquals(8, fields.presentCount());
    }

    @Test
    void extract_missingBuyerName_leavesOnlyThatFieldAbsent() {
        String text = EfakturFixtures.SAMPLE_INVOICE_TEXT.replace("Nama : PT XYZ\n", "");

        InvoiceFieldSet fields = extractor.extract(text);

        assertFalse(fields.isPresent(InvoiceField.BUYER_NAME));
        assertEquals("PT ABC", fields.text(InvoiceField.SELLER_NAME).orElseThrow());
        assertEquals("023456789217000", fields.text(InvoiceField.BUYER_TAX_ID).orElseThrow());
        assertEquals(7, fields.presentCount());
    }

    @Test
    void extract_slashDateTakesPriorityOverLongDate() {
        String text = EfakturFixtures.SAMPLE_INVOICE_TEXT + "\nTanggal Faktur : 02/04/2022";

        InvoiceFieldSet fields = extractor.extract(text);

        assertEquals(LocalDate.of(2022, 4, 2), fields.date(InvoiceField.INVOICE_DATE).orElseThrow());
    }

    @Test
    void extract_wrongShapeCapture_isAbsent() {
        String text = EfakturFixtures.SAMPLE_INVOICE_TEXT
                .replace("01.234.567.8-012.000", "01.234.567.8-012.00")
                .replace("070.000-22.12345678", "070.000-22.1234");

        InvoiceFieldSet fields = extractor.extract(text);

        assertFalse(fields.isPresent(InvoiceField.SELLER_TAX_ID));
        assertFalse(fields.isPresent(InvoiceField.INVOICE_NUMBER));
        assertTrue(fields.isPresent(InvoiceField.BUYER_TAX_ID));
    }

    @Test
    void extract_withoutSectionHeaders_usesOccurrenceOrder() {
        String text = String.join("\n",
                "Nama : PT ABC",
                "NPWP : 01.234.567.8-012.000",
                "Nama : PT XYZ",
                "NPWP : 02.345.678.9-217.000");

        InvoiceFieldSet fields = extractor.extract(text);

        assertEquals("PT ABC", fields.text(InvoiceField.SELLER_NAME).orElseThrow());
        assertEquals("012345678012000", fields.text(InvoiceField.SELLER_TAX_ID).orElseThrow());
        assertEquals("PT XYZ", fields.text(InvoiceField.BUYER_NAME).orElseThrow());
        assertEquals("023456789217000", fields.text(InvoiceField.BUYER_TAX_ID).orElseThrow());
    }

    @Test
    void extract_repairsOcrNoiseBeforeMatching() {
        String text = "Kode dan Nomor Sen Faktur Palak : 070.000-22.12345678\nNPWP | 01.234.567.8-012.000";

        InvoiceFieldSet fields = extractor.extract(text);

        assertEquals("0700002212345678", fields.text(InvoiceField.INVOICE_NUMBER).orElseThrow());
        assertEquals("012345678012000", fields.text(InvoiceField.SELLER_TAX_ID).orElseThrow());
    }

    @Test
    void extract_emptyOrNoiseText_yieldsNoFields() {
        assertEquals(0, extractor.extract("").presentCount());
        assertEquals(0, extractor.extract(null).presentCount());
        assertEquals(0, extractor.extract("@@@ ### lorem ipsum 123").presentCount());
    }
}
