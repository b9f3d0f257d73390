package com.efaktur.backend.util;

import java.text.Normalizer;
import java.util.Locale;

public final class NormalizeUtil {

    private NormalizeUtil() {
    }

    /**
     * Removes combining marks: "Citra Karya Sejahterá" => "Citra Karya Sejahtera"
     */
    public static String stripDiacritics(String text) {
        if (text == null) return "";
        return Normalizer.normalize(text, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    }

    /**
     * Replaces NBSP and other Unicode separators with a plain space, then collapses runs of whitespace.
     * PDFBox frequently emits NBSP, which does not match \s.
     */
    public static String collapseWhitespace(String text) {
        if (text == null) return "";
        return text.replace('\u00A0', ' ')
                .replaceAll("\\p{Z}+", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    public static String removePunctuation(String text) {
        if (text == null) return "";
        return text.replaceAll("\\p{Punct}", " ");
    }

    public static String lowercase(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT);
    }

    public static String digitsOnly(String text) {
        if (text == null) return "";
        return text.replaceAll("\\D", "");
    }
}
