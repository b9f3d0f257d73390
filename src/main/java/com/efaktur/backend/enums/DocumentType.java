package com.efaktur.backend.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported upload encodings. PDF is the structured-document modality, JPEG/PNG the raster modality.
 */
public enum DocumentType {
    PDF("application/pdf", false, ".pdf"),
    JPEG("image/jpeg", true, ".jpg", ".jpeg"),
    PNG("image/png", true, ".png");

    private final String mediaType;
    private final boolean raster;
    private final String[] extensions;

    DocumentType(String mediaType, boolean raster, String... extensions) {
        this.mediaType = mediaType;
        this.raster = raster;
        this.extensions = extensions;
    }

    public boolean isRaster() {
        return raster;
    }

    /**
     * Resolves the declared media type first; the file name extension is only consulted when the media type is
     * missing or generic (application/octet-stream).
     */
    public static Optional<DocumentType> resolve(String mediaType, String filename) {
        String mt = mediaType == null ? "" : mediaType.toLowerCase(Locale.ROOT).trim();
        int paramIdx = mt.indexOf(';');
        if (paramIdx >= 0) mt = mt.substring(0, paramIdx).trim();

        if (!mt.isEmpty() && !"application/octet-stream".equals(mt)) {
            return fromMediaType(mt);
        }
        return fromFilename(filename);
    }

    private static Optional<DocumentType> fromMediaType(String mt) {
        if ("image/jpg".equals(mt) || "image/pjpeg".equals(mt)) return Optional.of(JPEG);
        for (DocumentType type : values()) {
            if (type.mediaType.equals(mt)) return Optional.of(type);
        }
        return Optional.empty();
    }

    private static Optional<DocumentType> fromFilename(String filename) {
        if (filename == null || filename.isBlank()) return Optional.empty();
        String lower = filename.toLowerCase(Locale.ROOT).trim();
        for (DocumentType type : values()) {
            for (String ext : type.extensions) {
                if (lower.endsWith(ext)) return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
