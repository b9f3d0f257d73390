package com.efaktur.backend.model;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * An image that may carry the QR code: an image embedded in a PDF page, or the uploaded image itself.
 * Lives only for the duration of one request.
 *
 * @param pageIndex zero-based PDF page, or -1 for a standalone image
 * @param ordinal   position of the image in document order
 */
public record RasterRegion(BufferedImage image, Origin origin, int pageIndex, int ordinal) {

    public enum Origin {
        PDF_EMBEDDED_IMAGE,
        STANDALONE_IMAGE
    }

    public RasterRegion {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(origin, "origin");
    }

    public static RasterRegion standalone(BufferedImage image) {
        return new RasterRegion(image, Origin.STANDALONE_IMAGE, -1, 0);
    }

    public static RasterRegion embedded(BufferedImage image, int pageIndex, int ordinal) {
        return new RasterRegion(image, Origin.PDF_EMBEDDED_IMAGE, pageIndex, ordinal);
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    public String describe() {
        if (origin == Origin.STANDALONE_IMAGE) {
            return "image " + width() + "x" + height();
        }
        return "page " + (pageIndex + 1) + " image #" + ordinal + " " + width() + "x" + height();
    }
}
