package com.efaktur.backend.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * HTTP settings for the DJP (tax authority) record lookup.
 *
 * Example:
 * efaktur.djp.connect-timeout=10s
 * efaktur.djp.read-timeout=30s
 */
@Data
@Component
@ConfigurationProperties(prefix = "efaktur.djp")
public class DjpClientProperties {

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Connect timeout for the lookup URL. Must be finite; non-positive values fall back to the default.
     */
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

    /**
     * Read timeout for the lookup URL. Must be finite; non-positive values fall back to the default.
     */
    private Duration readTimeout = DEFAULT_READ_TIMEOUT;

    /**
     * User-Agent sent with each lookup.
     */
    private String userAgent = "efaktur-validator/1.0";

    public Duration effectiveConnectTimeout() {
        return positiveOr(connectTimeout, DEFAULT_CONNECT_TIMEOUT);
    }

    public Duration effectiveReadTimeout() {
        return positiveOr(readTimeout, DEFAULT_READ_TIMEOUT);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        if (value == null || value.isZero() || value.isNegative()) return fallback;
        return value;
    }
}
