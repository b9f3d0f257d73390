package com.efaktur.backend.services.ocr;

import java.awt.image.BufferedImage;

public interface OcrService {

    /**
     * Returns the text recognized in the image, or an empty string when nothing is recognized.
     *
     * @throws OcrException when the recognition engine fails
     */
    String extractText(BufferedImage image);
}
