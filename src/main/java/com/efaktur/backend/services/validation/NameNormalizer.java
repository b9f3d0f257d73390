package com.efaktur.backend.services.validation;

import org.springframework.stereotype.Component;

import com.efaktur.backend.util.NormalizeUtil;

import lombok.RequiredArgsConstructor;

/**
 * Reduces a party name to its comparison form according to {@link ComparisonProperties.Names}.
 */
@Component
@RequiredArgsConstructor
public class NameNormalizer {

    private final ComparisonProperties comparisonProperties;

    public String normalize(String name) {
        if (name == null) return "";
        ComparisonProperties.Names rules = comparisonProperties.getNames();

        String out = name;
        if (rules.isStripDiacritics()) {
            out = NormalizeUtil.stripDiacritics(out);
        }
        if (rules.isIgnorePunctuation()) {
            out = NormalizeUtil.removePunctuation(out);
        }
        if (rules.isCollapseWhitespace() || rules.isIgnorePunctuation()) {
            out = NormalizeUtil.collapseWhitespace(out);
        }
        if (rules.isIgnoreCase()) {
            out = NormalizeUtil.lowercase(out);
        }
        return out;
    }

    public boolean sameName(String a, String b) {
        return normalize(a).equals(normalize(b));
    }
}
