package com.efaktur.backend.services.qr;

import java.awt.image.BufferedImage;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.efaktur.backend.model.RasterRegion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds the DJP lookup URL encoded in the document's QR code.
 *
 * Regions are scanned in document order; each region is tried with every configured {@link QrImageVariant}
 * in priority order. The first payload that is an absolute URL with an allowed scheme wins. Payloads that are
 * not lookup URLs are skipped. No match is an ordinary result ({@link Optional#empty()}).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QrLocator {

    private final QrCodeDecoder qrCodeDecoder;
    private final QrProperties qrProperties;

    public Optional<String> locate(List<RasterRegion> regions) {
        if (regions == null || regions.isEmpty()) {
            log.info("[QR] No raster regions to scan");
            return Optional.empty();
        }

        int limit = Math.min(regions.size(), Math.max(1, qrProperties.getMaxRegions()));
        List<QrImageVariant> variants = qrProperties.getVariants() == null || qrProperties.getVariants().isEmpty()
                ? List.of(QrImageVariant.values())
                : qrProperties.getVariants();

        for (int i = 0; i < limit; i++) {
            RasterRegion region = regions.get(i);
            for (QrImageVariant variant : variants) {
                Optional<String> url = tryDecode(region, variant);
                if (url.isPresent()) {
                    log.info("[QR] Lookup URL found in {} via {}", region.describe(), variant);
                    return url;
                }
            }
        }

        log.info("[QR] No lookup URL in {} region(s) x {} variant(s)", limit, variants.size());
        return Optional.empty();
    }

    private Optional<String> tryDecode(RasterRegion region, QrImageVariant variant) {
        List<String> payloads;
        try {
            BufferedImage candidate = variant.apply(region.image(), qrProperties);
            payloads = qrCodeDecoder.decode(candidate);
        } catch (RuntimeException e) {
            log.debug("[QR] Decode failed for {} via {}: {}", region.describe(), variant, e.toString());
            return Optional.empty();
        }

        for (String payload : payloads) {
            if (isLookupUrl(payload)) {
                return Optional.of(payload.trim());
            }
            log.debug("[QR] Ignoring non-URL payload in {} via {}", region.describe(), variant);
        }
        return Optional.empty();
    }

    boolean isLookupUrl(String payload) {
        if (payload == null || payload.isBlank()) return false;
        try {
            URI uri = new URI(payload.trim());
            String scheme = uri.getScheme();
            return scheme != null
                    && uri.getHost() != null
                    && qrProperties.getAllowedSchemes().contains(scheme.toLowerCase(Locale.ROOT));
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
