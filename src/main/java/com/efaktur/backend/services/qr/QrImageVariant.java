package com.efaktur.backend.services.qr;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

/**
 * Image pre-processing variants for QR decoding. Order of declaration is the default priority order.
 */
public enum QrImageVariant {

    AS_IS {
        @Override
        public BufferedImage apply(BufferedImage source, QrProperties properties) {
            return source;
        }
    },

    /**
     * Low-resolution embedded QR images often decode only after upscaling.
     */
    UPSCALED {
        @Override
        public BufferedImage apply(BufferedImage source, QrProperties properties) {
            int factor = Math.max(2, properties.getUpscaleFactor());
            int width = source.getWidth() * factor;
            int height = source.getHeight() * factor;
            if ((long) width * height > properties.getMaxUpscaledPixels()) {
                return source;
            }

            BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            Graphics2D g = scaled.createGraphics();
            try {
                // Nearest neighbour keeps module edges sharp.
                g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
                g.drawImage(source, 0, 0, width, height, Color.WHITE, null);
            } finally {
                g.dispose();
            }
            return scaled;
        }
    },

    /**
     * Grayscale, then stretch the luminance range to the full 0-255 scale.
     */
    GRAYSCALE_CONTRAST {
        @Override
        public BufferedImage apply(BufferedImage source, QrProperties properties) {
            BufferedImage gray = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
            Graphics2D g = gray.createGraphics();
            try {
                g.drawImage(source, 0, 0, Color.WHITE, null);
            } finally {
                g.dispose();
            }

            WritableRaster raster = gray.getRaster();
            int w = raster.getWidth();
            int h = raster.getHeight();
            int min = 255;
            int max = 0;
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    int v = raster.getSample(x, y, 0);
                    if (v < min) min = v;
                    if (v > max) max = v;
                }
            }
            if (max <= min) return gray;

            double scale = 255.0 / (max - min);
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    int v = raster.getSample(x, y, 0);
                    raster.setSample(x, y, 0, (int) Math.round((v - min) * scale));
                }
            }
            return gray;
        }
    };

    public abstract BufferedImage apply(BufferedImage source, QrProperties properties);
}
