package com.efaktur.backend.services.djp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;

import com.efaktur.backend.enums.ErrorKind;
import com.efaktur.backend.enums.InvoiceField;
import com.efaktur.backend.exceptions.MalformedResponseException;
import com.efaktur.backend.model.InvoiceFieldSet;
import com.efaktur.backend.support.EfakturFixtures;

class DjpResponseParserTest {

    private final DjpResponseParser parser = new DjpResponseParser();

    @Test
    void parse_fullRecord() {
        InvoiceFieldSet record = parser.parse(EfakturFixtures.djpXmlBytes());

        assertEquals(EfakturFixtures.sampleRecord(), record);
    }

    @Test
    void parse_ignoresNestedTransactionDetail() {
        String xml = "<resValidateFakturPm>"
                + "<detailTransaksi><jumlahDpp>999</jumlahDpp></detailTransaksi>"
                + "<jumlahDpp>15000000</jumlahDpp>"
                + "</resValidateFakturPm>";

        InvoiceFieldSet record = parser.parse(bytes(xml));

        assertEquals(new BigDecimal("15000000"), record.amount(InvoiceField.TAX_BASE_AMOUNT).orElseThrow());
    }

    @Test
    void parse_missingAndEmptyElements_areAbsent() {
        String xml = "<resValidateFakturPm>"
                + "<nomorFaktur>0700002212345678</nomorFaktur>"
                + "<namaLawanTransaksi>   </namaLawanTransaksi>"
                + "</resValidateFakturPm>";

        InvoiceFieldSet record = parser.parse(bytes(xml));

        assertEquals("0700002212345678", record.text(InvoiceField.INVOICE_NUMBER).orElseThrow());
        assertFalse(record.isPresent(InvoiceField.BUYER_NAME));
        assertFalse(record.isPresent(InvoiceField.SELLER_TAX_ID));
        assertEquals(1, record.presentCount());
    }

    @Test
    void parse_unreadableValues_areAbsent() {
        String xml = "<resValidateFakturPm>"
                + "<tanggalFaktur>kemarin</tanggalFaktur>"
                + "<jumlahPpn>n/a</jumlahPpn>"
                + "<jumlahDpp>15000000</jumlahDpp>"
                + "</resValidateFakturPm>";

        InvoiceFieldSet record = parser.parse(bytes(xml));

        assertFalse(record.isPresent(InvoiceField.INVOICE_DATE));
        assertFalse(record.isPresent(InvoiceField.VAT_AMOUNT));
        assertEquals(1, record.presentCount());
    }

    @Test
    void parse_normalizesFormattedValues() {
        String xml = "<resValidateFakturPm>"
                + "<npwpPenjual>01.234.567.8-012.000</npwpPenjual>"
                + "<namaPenjual>  PT   ABC </namaPenjual>"
                + "<tanggalFaktur>2022-04-01</tanggalFaktur>"
                + "</resValidateFakturPm>";

        InvoiceFieldSet record = parser.parse(bytes(xml));

        assertEquals("012345678012000", record.text(InvoiceField.SELLER_TAX_ID).orElseThrow());
        assertEquals("PT ABC", record.text(InvoiceField.SELLER_NAME).orElseThrow());
        assertEquals(LocalDate.of(2022, 4, 1), record.date(InvoiceField.INVOICE_DATE).orElseThrow());
    }

    @Test
    void parse_malformedXml_throws() {
        MalformedResponseException ex = assertThrows(MalformedResponseException.class,
                () -> parser.parse(bytes("<resValidateFakturPm><nomorFaktur>07</resValidateFakturPm>")));

        assertEquals(ErrorKind.MALFORMED_RESPONSE, ex.getKind());
    }

    @Test
    void parse_emptyBodyOrHtml_throws() {
        assertThrows(MalformedResponseException.class, () -> parser.parse(new byte[0]));
        assertThrows(MalformedResponseException.class, () -> parser.parse(bytes("Service Unavailable")));
    }

    @Test
    void parse_rejectsDoctype() {
        String xml = "<?xml version=\"1.0\"?>"
                + "<!DOCTYPE r [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
                + "<resValidateFakturPm><namaPenjual>&x;</namaPenjual></resValidateFakturPm>";

        assertThrows(MalformedResponseException.class, () -> parser.parse(bytes(xml)));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
