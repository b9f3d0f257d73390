package com.efaktur.backend.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Request-level settings for the validation endpoint.
 *
 * Example:
 * efaktur.validation.request-timeout=120s
 * efaktur.validation.include-diagnostics=true
 * efaktur.validation.executor.max-pool-size=4
 */
@Data
@Component
@ConfigurationProperties(prefix = "efaktur.validation")
public class ValidationProperties {

    /**
     * Upper bound for one validation request. On expiry the worker is interrupted.
     */
    private Duration requestTimeout = Duration.ofSeconds(120);

    /**
     * Adds extracted_data, qr_url and raw_ocr_text to validation_results.
     */
    private boolean includeDiagnostics = true;

    private Executor executor = new Executor();

    @Data
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;
    }
}
