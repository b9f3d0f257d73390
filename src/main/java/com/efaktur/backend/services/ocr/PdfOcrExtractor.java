package com.efaktur.backend.services.ocr;

import java.awt.image.BufferedImage;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class PdfOcrExtractor {

    private final OcrProperties ocrProperties;
    private final OcrService ocrService;

    public boolean isEnabled() {
        return ocrProperties.isEnabled();
    }

    public int maxPages() {
        return Math.max(1, ocrProperties.getPdf().getMaxPages());
    }

    /**
     * Renders one page at {@code efaktur.ocr.pdf.render-dpi} and runs OCR on it. Returns "" when OCR is disabled.
     *
     * @param pageIndex zero-based page index
     */
    public String extractPageText(PDDocument document, int pageIndex) {
        if (document == null) return "";
        if (!ocrProperties.isEnabled()) return "";

        int dpi = Math.max(72, ocrProperties.getPdf().getRenderDpi());
        long startMs = System.currentTimeMillis();

        BufferedImage image;
        try {
            image = new PDFRenderer(document).renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
        } catch (Exception e) {
            throw new OcrException("Failed to render PDF page " + (pageIndex + 1) + " for OCR", e);
        }

        try {
            String text = ocrService.extractText(image);
            text = text == null ? "" : text;
            log.info("[OCR] Page {} done: dpi={} elapsedMs={} textLen={}",
                    pageIndex + 1, dpi, System.currentTimeMillis() - startMs, text.length());
            return text;
        } finally {
            image.flush();
        }
    }
}
