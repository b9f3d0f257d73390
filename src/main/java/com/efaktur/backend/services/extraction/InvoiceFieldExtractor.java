package com.efaktur.backend.services.extraction;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.efaktur.backend.enums.InvoiceField;
import com.efaktur.backend.model.InvoiceFieldSet;
import com.efaktur.backend.services.extraction.FieldRule.Scope;
import com.efaktur.backend.util.AmountParser;
import com.efaktur.backend.util.InvoiceDateParser;
import com.efaktur.backend.util.NormalizeUtil;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pulls the eight e-Faktur fields out of the normalized document text.
 *
 * Rules run in a fixed order; for each field the first rule that yields a valid value wins. A missing label or a
 * capture with the wrong shape leaves the field absent. This class never throws on document content.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceFieldExtractor {

    static final int TAX_ID_DIGITS = 15;
    static final int INVOICE_NUMBER_DIGITS = 16;

    // Ex.: NPWP: 01.234.567.8-012.000
    private static final Pattern NPWP = Pattern.compile("NPWP[\\s:|\\-]*([0-9.\\-]+)");

    // Ex.: Nama : PT ABC  (names are printed in capitals)
    private static final Pattern NAMA = Pattern.compile("Nama[\\s:|\\-]*([A-Z0-9 .,&-]+)");

    // Ex.: Kode dan Nomor Seri Faktur Pajak : 070.000-22.12345678
    private static final Pattern NOMOR_FAKTUR = Pattern.compile(
            "(?:Kode dan Nomor Seri Faktur Pajak|Nomor[\\s:|\\-]*Faktur)[\\s:|\\-]*([0-9.\\-]+[ ]*[0-9]+)",
            Pattern.CASE_INSENSITIVE);

    // Ex.: Tanggal Faktur: 01/04/2022  |  JAKARTA, 01/04/2022
    private static final Pattern TANGGAL_SLASH = Pattern.compile(
            "(?:Tanggal[\\s:|\\-]*Faktur[\\s:|\\-]*|,\\s*)(\\d{1,2}/\\d{1,2}/\\d{4})",
            Pattern.CASE_INSENSITIVE);

    // Ex.: JAKARTA, 01 April 2022
    private static final Pattern TANGGAL_LONG = Pattern.compile(
            ",\\s*(\\d{1,2})\\s+([A-Z]+)\\s+(\\d{4})",
            Pattern.CASE_INSENSITIVE);

    // Ex.: Dasar Pengenaan Pajak 15.000.000,00
    private static final Pattern DPP = Pattern.compile(
            "Dasar Pengenaan Pajak[\\s:|\\-]*(?:Rp\\.?\\s*)?(\\d[\\d.,]*)",
            Pattern.CASE_INSENSITIVE);

    // Ex.: Total PPN 1.650.000,00
    private static final Pattern PPN = Pattern.compile(
            "(?:Total|Jumlah) PPN[\\s:|\\-]*(?:Rp\\.?\\s*)?(\\d[\\d.,]*)",
            Pattern.CASE_INSENSITIVE);

    private static final List<FieldRule> RULES = List.of(
            new FieldRule(InvoiceField.SELLER_TAX_ID, Scope.SELLER, NPWP, InvoiceFieldExtractor::taxId),
            new FieldRule(InvoiceField.SELLER_NAME, Scope.SELLER, NAMA, InvoiceFieldExtractor::name),
            new FieldRule(InvoiceField.BUYER_TAX_ID, Scope.BUYER, NPWP, InvoiceFieldExtractor::taxId),
            new FieldRule(InvoiceField.BUYER_NAME, Scope.BUYER, NAMA, InvoiceFieldExtractor::name),
            new FieldRule(InvoiceField.INVOICE_NUMBER, Scope.DOCUMENT, NOMOR_FAKTUR, InvoiceFieldExtractor::invoiceNumber),
            new FieldRule(InvoiceField.INVOICE_DATE, Scope.DOCUMENT, TANGGAL_SLASH, InvoiceFieldExtractor::slashDate),
            new FieldRule(InvoiceField.INVOICE_DATE, Scope.DOCUMENT, TANGGAL_LONG, InvoiceFieldExtractor::longDate),
            new FieldRule(InvoiceField.TAX_BASE_AMOUNT, Scope.DOCUMENT, DPP, InvoiceFieldExtractor::amount),
            new FieldRule(InvoiceField.VAT_AMOUNT, Scope.DOCUMENT, PPN, InvoiceFieldExtractor::amount)
    );

    private final OcrTextCleaner ocrTextCleaner;

    public InvoiceFieldSet extract(String plainText) {
        String text = ocrTextCleaner.clean(plainText);
        if (text.isBlank()) {
            log.info("[Extractor] Empty document text; no fields extracted");
            return InvoiceFieldSet.empty();
        }

        InvoiceSections sections = InvoiceSections.split(text);
        InvoiceFieldSet.Builder builder = InvoiceFieldSet.builder();
        Set<InvoiceField> resolved = EnumSet.noneOf(InvoiceField.class);

        for (FieldRule rule : RULES) {
            if (resolved.contains(rule.field())) continue;
            Optional<?> value = rule.apply(text, sections);
            if (value.isPresent()) {
                builder.put(rule.field(), value.get());
                resolved.add(rule.field());
            }
        }

        InvoiceFieldSet fields = builder.build();
        log.info("[Extractor] Extracted {}/{} fields", fields.presentCount(), InvoiceField.values().length);
        log.debug("[Extractor] Fields: {}", fields);
        return fields;
    }

    private static Optional<?> taxId(Matcher m) {
        String digits = NormalizeUtil.digitsOnly(m.group(1));
        return digits.length() == TAX_ID_DIGITS ? Optional.of(digits) : Optional.empty();
    }

    private static Optional<?> invoiceNumber(Matcher m) {
        String digits = NormalizeUtil.digitsOnly(m.group(1));
        return digits.length() == INVOICE_NUMBER_DIGITS ? Optional.of(digits) : Optional.empty();
    }

    private static Optional<?> name(Matcher m) {
        String value = NormalizeUtil.collapseWhitespace(m.group(1)).replaceAll("[\\s,.-]+$", "");
        long letters = value.chars().filter(Character::isLetter).count();
        return letters >= 2 ? Optional.of(value) : Optional.empty();
    }

    private static Optional<?> slashDate(Matcher m) {
        return InvoiceDateParser.parseSlashDate(m.group(1));
    }

    private static Optional<?> longDate(Matcher m) {
        return InvoiceDateParser.fromIndonesianMonth(m.group(1), m.group(2), m.group(3));
    }

    private static Optional<?> amount(Matcher m) {
        return AmountParser.parse(m.group(1));
    }
}
