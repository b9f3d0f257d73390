package com.efaktur.backend.model;

import java.util.List;

import com.efaktur.backend.enums.DocumentType;

/**
 * Single plain-text rendering of an upload plus the raster regions to scan for the QR code.
 */
public record NormalizedDocument(
        DocumentType type,
        String plainText,
        List<RasterRegion> rasterRegions,
        int pageCount,
        int ocrPages
) {
    public NormalizedDocument {
        plainText = plainText == null ? "" : plainText;
        rasterRegions = rasterRegions == null ? List.of() : List.copyOf(rasterRegions);
    }
}
