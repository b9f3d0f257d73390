package com.efaktur.backend.services.document;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;

import javax.imageio.ImageIO;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Service;

import com.efaktur.backend.enums.DocumentType;
import com.efaktur.backend.exceptions.CorruptInputException;
import com.efaktur.backend.exceptions.UnsupportedFormatException;
import com.efaktur.backend.model.NormalizedDocument;
import com.efaktur.backend.model.RasterRegion;
import com.efaktur.backend.services.ocr.OcrImagePreprocessor;
import com.efaktur.backend.services.ocr.OcrProperties;
import com.efaktur.backend.services.ocr.OcrService;
import com.efaktur.backend.services.ocr.PdfOcrExtractor;
import com.efaktur.backend.services.ocr.PdfTextExtractor;
import com.efaktur.backend.util.Cancellation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns an upload into one plain-text rendering plus the raster regions that may hold the QR code.
 *
 * PDF: native text layer per page (pages joined by a blank line); pages without text are rendered and OCR'd.
 * Every embedded image becomes a region. Image: OCR of the whole image, which is also the only region.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentNormalizer {

    static final String PAGE_SEPARATOR = "\n\n";

    private final PdfTextExtractor pdfTextExtractor;
    private final PdfOcrExtractor pdfOcrExtractor;
    private final PdfImageExtractor pdfImageExtractor;
    private final OcrService ocrService;
    private final OcrProperties ocrProperties;
    private final OcrImagePreprocessor ocrImagePreprocessor;

    public NormalizedDocument normalize(byte[] content, String mediaType, String filename) {
        DocumentType type = DocumentType.resolve(mediaType, filename)
                .orElseThrow(() -> new UnsupportedFormatException("Only PDF and JPG/PNG files are supported"));

        if (content == null || content.length == 0) {
            throw new CorruptInputException("Uploaded file is empty");
        }

        log.info("[Normalizer] type={} bytes={} filename='{}'", type, content.length, filename == null ? "" : filename);
        return type.isRaster() ? normalizeImage(content, type) : normalizePdf(content);
    }

    private NormalizedDocument normalizePdf(byte[] content) {
        long startMs = System.currentTimeMillis();

        try (PDDocument document = PDDocument.load(content)) {
            int pageCount = document.getNumberOfPages();
            StringBuilder text = new StringBuilder();
            int ocrPages = 0;

            for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
                String pageText = textLayer(document, pageIndex);

                if (pageText.isBlank() && pdfOcrExtractor.isEnabled()) {
                    if (ocrPages < pdfOcrExtractor.maxPages()) {
                        Cancellation.checkpoint("OCR of page " + (pageIndex + 1));
                        pageText = pdfOcrExtractor.extractPageText(document, pageIndex);
                        ocrPages++;
                    } else {
                        log.warn("[Normalizer] Page {} has no text layer; OCR page limit {} reached", pageIndex + 1, pdfOcrExtractor.maxPages());
                    }
                }

                if (!pageText.isBlank()) {
                    if (text.length() > 0) text.append(PAGE_SEPARATOR);
                    text.append(pageText.strip());
                }
            }

            List<RasterRegion> regions = pdfImageExtractor.extractImages(document);

            log.info("[Normalizer] PDF done: pages={} ocrPages={} textLen={} images={} elapsedMs={}",
                    pageCount, ocrPages, text.length(), regions.size(), System.currentTimeMillis() - startMs);
            return new NormalizedDocument(DocumentType.PDF, text.toString(), regions, pageCount, ocrPages);
        } catch (InvalidPasswordException e) {
            throw new CorruptInputException("PDF is password protected", e);
        } catch (IOException e) {
            throw new CorruptInputException("Failed to open PDF: " + e.getMessage(), e);
        }
    }

    /**
     * A page whose content PDFBox cannot read counts as a page without a text layer.
     */
    private String textLayer(PDDocument document, int pageIndex) {
        try {
            return pdfTextExtractor.extractPageText(document, pageIndex);
        } catch (IOException | RuntimeException e) {
            log.warn("[Normalizer] Text layer of page {} unreadable, treating page as scanned: {}", pageIndex + 1, e.getMessage());
            return "";
        }
    }

    private NormalizedDocument normalizeImage(byte[] content, DocumentType type) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(content));
        } catch (IOException e) {
            throw new CorruptInputException("Failed to read image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new CorruptInputException("Failed to read image: unrecognized " + type + " data");
        }

        String text = "";
        if (ocrProperties.isEnabled()) {
            Cancellation.checkpoint("image OCR");
            long startMs = System.currentTimeMillis();
            BufferedImage prepared = ocrProperties.isPreprocessImages() ? ocrImagePreprocessor.prepare(image) : image;
            text = ocrService.extractText(prepared);
            log.info("[Normalizer] Image OCR done: {}x{} textLen={} elapsedMs={}",
                    image.getWidth(), image.getHeight(), text.length(), System.currentTimeMillis() - startMs);
        } else {
            log.warn("[Normalizer] OCR disabled; image text is empty and all fields will be missing from the document side");
        }

        return new NormalizedDocument(type, text, List.of(RasterRegion.standalone(image)), 1, ocrProperties.isEnabled() ? 1 : 0);
    }
}
