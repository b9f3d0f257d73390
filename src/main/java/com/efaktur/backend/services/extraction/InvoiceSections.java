package com.efaktur.backend.services.extraction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Seller and buyer blocks of an e-Faktur. The seller block runs from "Pengusaha Kena Pajak" to
 * "Pembeli Barang Kena Pajak"; the buyer block runs from there to the end. Either may be missing.
 */
final class InvoiceSections {

    private static final Pattern SELLER_HEADER = Pattern.compile("Pengusaha Kena Pajak", Pattern.CASE_INSENSITIVE);
    private static final Pattern BUYER_HEADER = Pattern.compile("Pembeli Barang Kena Pajak", Pattern.CASE_INSENSITIVE);

    private final String seller;
    private final String buyer;

    private InvoiceSections(String seller, String buyer) {
        this.seller = seller;
        this.buyer = buyer;
    }

    static InvoiceSections split(String text) {
        Matcher sellerStart = SELLER_HEADER.matcher(text);
        Matcher buyerStart = BUYER_HEADER.matcher(text);
        boolean hasSeller = sellerStart.find();
        boolean hasBuyer = buyerStart.find();

        String seller = null;
        String buyer = null;
        if (hasSeller && hasBuyer && sellerStart.start() < buyerStart.start()) {
            seller = text.substring(sellerStart.start(), buyerStart.start());
            buyer = text.substring(buyerStart.start());
        } else if (hasSeller && hasBuyer) {
            seller = text.substring(sellerStart.start());
            buyer = text.substring(buyerStart.start(), sellerStart.start());
        } else if (hasSeller) {
            seller = text.substring(sellerStart.start());
        } else if (hasBuyer) {
            buyer = text.substring(buyerStart.start());
        }
        return new InvoiceSections(seller, buyer);
    }

    String textFor(FieldRule.Scope scope) {
        switch (scope) {
            case SELLER:
                return seller;
            case BUYER:
                return buyer;
            default:
                return null;
        }
    }
}
