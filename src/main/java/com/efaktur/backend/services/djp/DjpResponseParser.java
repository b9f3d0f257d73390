package com.efaktur.backend.services.djp;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import com.efaktur.backend.enums.InvoiceField;
import com.efaktur.backend.exceptions.MalformedResponseException;
import com.efaktur.backend.model.InvoiceFieldSet;
import com.efaktur.backend.util.AmountParser;
import com.efaktur.backend.util.InvoiceDateParser;
import com.efaktur.backend.util.NormalizeUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Parses the DJP {@code resValidateFakturPm} response into the invoice field schema.
 *
 * Each field is read from a direct child of the root element. A missing or empty element, or a value that cannot
 * be read as the field's type, leaves the field absent. Only a payload that is not well-formed XML is an error.
 */
@Component
@Slf4j
public class DjpResponseParser {

    static final String ROOT_ELEMENT = "resValidateFakturPm";

    private static final Map<InvoiceField, String> ELEMENTS = buildElementMap();

    public InvoiceFieldSet parse(byte[] xml) {
        Element root = parseDocument(xml).getDocumentElement();
        if (!ROOT_ELEMENT.equals(root.getNodeName())) {
            log.warn("[DJP] Unexpected root element <{}> (expected <{}>)", root.getNodeName(), ROOT_ELEMENT);
        }

        InvoiceFieldSet.Builder builder = InvoiceFieldSet.builder();
        for (Map.Entry<InvoiceField, String> entry : ELEMENTS.entrySet()) {
            InvoiceField field = entry.getKey();
            childText(root, entry.getValue())
                    .flatMap(raw -> convert(field, raw))
                    .ifPresent(value -> builder.put(field, value));
        }

        InvoiceFieldSet fields = builder.build();
        log.info("[DJP] Parsed {}/{} fields from response", fields.presentCount(), InvoiceField.values().length);
        return fields;
    }

    private Document parseDocument(byte[] xml) {
        if (xml == null || xml.length == 0) {
            throw new MalformedResponseException("Empty DJP response");
        }
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            return builder.parse(new ByteArrayInputStream(xml));
        } catch (SAXException | IOException e) {
            log.warn("[DJP] Response is not well-formed XML: {}", e.getMessage());
            throw new MalformedResponseException("Failed to parse DJP response", e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration failed", e);
        }
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory;
    }

    private static Optional<String> childText(Element root, String name) {
        NodeList children = root.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) {
                String text = node.getTextContent();
                return text == null || text.isBlank() ? Optional.empty() : Optional.of(text.trim());
            }
        }
        return Optional.empty();
    }

    private static Optional<?> convert(InvoiceField field, String raw) {
        Optional<?> value;
        switch (field.getKind()) {
            case TAX_ID:
            case DOCUMENT_NUMBER:
                String digits = NormalizeUtil.digitsOnly(raw);
                value = digits.isEmpty() ? Optional.empty() : Optional.of(digits);
                break;
            case NAME:
                value = Optional.of(NormalizeUtil.collapseWhitespace(raw));
                break;
            case DATE:
                value = InvoiceDateParser.parseLenient(raw);
                break;
            case AMOUNT:
                value = AmountParser.parse(raw);
                break;
            default:
                value = Optional.empty();
        }
        if (value.isEmpty()) {
            log.warn("[DJP] Unreadable value for {}: '{}'", field.getKey(), raw);
        }
        return value;
    }

    private static Map<InvoiceField, String> buildElementMap() {
        Map<InvoiceField, String> map = new EnumMap<>(InvoiceField.class);
        map.put(InvoiceField.SELLER_TAX_ID, "npwpPenjual");
        map.put(InvoiceField.SELLER_NAME, "namaPenjual");
        map.put(InvoiceField.BUYER_TAX_ID, "npwpLawanTransaksi");
        map.put(InvoiceField.BUYER_NAME, "namaLawanTransaksi");
        map.put(InvoiceField.INVOICE_NUMBER, "nomorFaktur");
        map.put(InvoiceField.INVOICE_DATE, "tanggalFaktur");
        map.put(InvoiceField.TAX_BASE_AMOUNT, "jumlahDpp");
        map.put(InvoiceField.VAT_AMOUNT, "jumlahPpn");
        return map;
    }
}
