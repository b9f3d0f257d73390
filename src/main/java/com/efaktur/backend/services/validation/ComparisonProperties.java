package com.efaktur.backend.services.validation;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Equality rules used when comparing document fields with the DJP record.
 *
 * Example:
 * efaktur.comparison.amount-tolerance=0.01
 * efaktur.comparison.names.ignore-punctuation=true
 */
@Data
@Component
@ConfigurationProperties(prefix = "efaktur.comparison")
public class ComparisonProperties {

    /**
     * Largest absolute difference at which two amounts still count as equal.
     */
    private BigDecimal amountTolerance = new BigDecimal("0.01");

    private Names names = new Names();

    @Data
    public static class Names {
        private boolean ignoreCase = true;
        private boolean collapseWhitespace = true;
        private boolean stripDiacritics = true;
        private boolean ignorePunctuation = false;
    }
}
