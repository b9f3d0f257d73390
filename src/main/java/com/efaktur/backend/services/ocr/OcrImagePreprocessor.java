package com.efaktur.backend.services.ocr;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;

import org.springframework.stereotype.Component;

/**
 * Grayscale + sharpen before OCR, without thresholding.
 */
@Component
public class OcrImagePreprocessor {

    private static final float[] SHARPEN = {
            0f, -1f, 0f,
            -1f, 5f, -1f,
            0f, -1f, 0f
    };

    public BufferedImage prepare(BufferedImage source) {
        if (source == null) return null;

        BufferedImage gray = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = gray.createGraphics();
        try {
            g.drawImage(source, 0, 0, Color.WHITE, null);
        } finally {
            g.dispose();
        }

        ConvolveOp sharpen = new ConvolveOp(new Kernel(3, 3, SHARPEN), ConvolveOp.EDGE_NO_OP, null);
        return sharpen.filter(gray, null);
    }
}
