package com.efaktur.backend.services.extraction;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

/**
 * Normalizes whitespace and repairs OCR confusions seen on e-Faktur labels before field rules run.
 */
@Component
public class OcrTextCleaner {

    private static final Map<String, String> KNOWN_CONFUSIONS = buildConfusions();

    public String clean(String text) {
        if (text == null || text.isEmpty()) return "";

        String result = text.replaceAll("[\\r\\n]+", "\n");
        result = result.replaceAll("[ \\t\\u00A0]+", " ");

        for (Map.Entry<String, String> entry : KNOWN_CONFUSIONS.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }

        // Label patterns are ASCII-only.
        result = result.replaceAll("[^\\x00-\\x7F]+", "");
        result = result.replaceAll(" +", " ");
        return result;
    }

    private static Map<String, String> buildConfusions() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("Sen Faktur", "Seri Faktur");
        map.put("NPWP |", "NPWP :");
        map.put("NPWP :", "NPWP:");
        map.put("NIKPaspor", "NIK/Paspor");
        map.put("Palak", "Pajak");
        return map;
    }
}
