package com.efaktur.backend.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

import lombok.extern.slf4j.Slf4j;

/**
 * RestTemplate used for the DJP record lookup. Both timeouts are always finite.
 */
@Configuration
@Slf4j
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, DjpClientProperties djpClientProperties) {
        log.info("[DJP] HTTP client: connectTimeout={} readTimeout={}",
                djpClientProperties.effectiveConnectTimeout(),
                djpClientProperties.effectiveReadTimeout());

        return builder
                .setConnectTimeout(djpClientProperties.effectiveConnectTimeout())
                .setReadTimeout(djpClientProperties.effectiveReadTimeout())
                .defaultHeader(HttpHeaders.USER_AGENT, djpClientProperties.getUserAgent())
                .build();
    }
}
