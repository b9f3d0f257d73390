package com.efaktur.backend.services.ocr;

import java.awt.image.BufferedImage;

public class DisabledOcrService implements OcrService {

    @Override
    public String extractText(BufferedImage image) {
        throw new IllegalStateException("OCR is disabled. Enable it with efaktur.ocr.enabled=true");
    }
}
