package com.efaktur.backend.services.qr;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Example:
 * efaktur.qr.variants=AS_IS,UPSCALED,GRAYSCALE_CONTRAST
 * efaktur.qr.upscale-factor=2
 */
@Data
@Component
@ConfigurationProperties(prefix = "efaktur.qr")
public class QrProperties {

    /**
     * Pre-processing variants tried on each region, in priority order.
     */
    private List<QrImageVariant> variants = new ArrayList<>(List.of(QrImageVariant.values()));

    private int upscaleFactor = 2;

    /**
     * Regions whose upscaled size would exceed this pixel count are not upscaled.
     */
    private long maxUpscaledPixels = 16_000_000L;

    /**
     * Upper bound on raster regions scanned per document.
     */
    private int maxRegions = 32;

    /**
     * URL schemes accepted as DJP lookup URLs.
     */
    private List<String> allowedSchemes = new ArrayList<>(List.of("http", "https"));
}
