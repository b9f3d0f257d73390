package com.efaktur.backend.enums;

/**
 * The eight e-Faktur fields shared by the document and the DJP record, in report order.
 * The key is the JSON name used in responses.
 */
public enum InvoiceField {
    SELLER_TAX_ID("npwpPenjual", FieldKind.TAX_ID),
    SELLER_NAME("namaPenjual", FieldKind.NAME),
    BUYER_TAX_ID("npwpPembeli", FieldKind.TAX_ID),
    BUYER_NAME("namaPembeli", FieldKind.NAME),
    INVOICE_NUMBER("nomorFaktur", FieldKind.DOCUMENT_NUMBER),
    INVOICE_DATE("tanggalFaktur", FieldKind.DATE),
    TAX_BASE_AMOUNT("jumlahDpp", FieldKind.AMOUNT),
    VAT_AMOUNT("jumlahPpn", FieldKind.AMOUNT);

    private final String key;
    private final FieldKind kind;

    InvoiceField(String key, FieldKind kind) {
        this.key = key;
        this.kind = kind;
    }

    public String getKey() {
        return key;
    }

    public FieldKind getKind() {
        return kind;
    }
}
