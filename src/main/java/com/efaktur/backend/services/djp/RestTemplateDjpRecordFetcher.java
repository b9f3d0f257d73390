package com.efaktur.backend.services.djp;

import java.net.URI;
import java.util.List;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.efaktur.backend.exceptions.DjpHttpException;
import com.efaktur.backend.exceptions.DjpNetworkException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Single GET to the lookup URL decoded from the QR code. No retries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RestTemplateDjpRecordFetcher implements DjpRecordFetcher {

    private final RestTemplate restTemplate;

    @Override
    public byte[] fetch(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new DjpNetworkException("Invalid DJP lookup URL", e);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_XML, MediaType.TEXT_XML, MediaType.ALL));

        long startMs = System.currentTimeMillis();
        ResponseEntity<byte[]> response;
        try {
            log.info("[DJP] GET {}", uri);
            response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), byte[].class);
        } catch (HttpStatusCodeException e) {
            log.warn("[DJP] HTTP {} from {} after {}ms", e.getStatusCode().value(), uri.getHost(), System.currentTimeMillis() - startMs);
            throw new DjpHttpException(e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            log.warn("[DJP] Unreachable {} after {}ms: {}", uri.getHost(), System.currentTimeMillis() - startMs, e.getMessage());
            throw new DjpNetworkException("Failed to reach DJP service: " + rootMessage(e), e);
        } catch (RestClientException e) {
            log.warn("[DJP] Request to {} failed: {}", uri.getHost(), e.getMessage());
            throw new DjpNetworkException("DJP request failed: " + rootMessage(e), e);
        }

        int status = response.getStatusCode().value();
        if (!response.getStatusCode().is2xxSuccessful()) {
            log.warn("[DJP] HTTP {} from {}", status, uri.getHost());
            throw new DjpHttpException(status);
        }

        byte[] body = response.getBody() == null ? new byte[0] : response.getBody();
        log.info("[DJP] HTTP {} bytes={} elapsedMs={}", status, body.length, System.currentTimeMillis() - startMs);
        return body;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
