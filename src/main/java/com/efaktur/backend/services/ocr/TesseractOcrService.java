package com.efaktur.backend.services.ocr;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITessAPI.TessPageSegMode;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

/**
 * Local OCR through Tess4J. Selected with efaktur.ocr.engine=tesseract (the default).
 *
 * When efaktur.ocr.tessdata-path is set, every language in efaktur.ocr.language ("eng+ind") must have its
 * traineddata file there; a missing file fails the first recognition with an {@link OcrException} naming it.
 */
@Slf4j
public class TesseractOcrService implements OcrService {

    static final String DEFAULT_LANGUAGE = "eng+ind";

    private final String datapath;
    private final String language;

    // Tess4J's Tesseract is not thread-safe.
    private final ThreadLocal<Tesseract> engines;

    public TesseractOcrService(OcrProperties ocrProperties) {
        String configuredPath = ocrProperties.getTessdataPath();
        String configuredLanguage = ocrProperties.getLanguage();
        this.datapath = configuredPath == null ? "" : configuredPath.trim();
        this.language = configuredLanguage == null || configuredLanguage.isBlank() ? DEFAULT_LANGUAGE : configuredLanguage.trim();
        this.engines = ThreadLocal.withInitial(this::createEngine);
    }

    @Override
    public String extractText(BufferedImage image) {
        if (image == null) return "";

        Tesseract engine = engines.get();
        long startMs = System.currentTimeMillis();
        try {
            String text = engine.doOCR(image);
            text = text == null ? "" : text;
            log.debug("[OCR] Tesseract {}x{} lang={} chars={} elapsedMs={}",
                    image.getWidth(), image.getHeight(), language, text.length(), System.currentTimeMillis() - startMs);
            return text;
        } catch (TesseractException e) {
            throw new OcrException("Tesseract failed to recognize image (lang=" + language + ")", e);
        } catch (LinkageError e) {
            throw new OcrException("Tesseract native library is not available", e);
        }
    }

    /**
     * Languages from a Tesseract language spec such as "eng+ind".
     */
    static List<String> languages(String spec) {
        List<String> out = new ArrayList<>();
        for (String part : spec.split("\\+")) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return out;
    }

    /**
     * Fails with the missing file names when the configured tessdata directory lacks a language.
     */
    static void requireLanguageData(String datapath, String language) {
        if (datapath.isEmpty()) return;

        Path dir = Path.of(datapath);
        if (!Files.isDirectory(dir)) {
            throw new OcrException("Tessdata directory not found: " + dir.toAbsolutePath());
        }

        List<String> missing = new ArrayList<>();
        for (String lang : languages(language)) {
            if (!Files.isRegularFile(dir.resolve(lang + ".traineddata"))) {
                missing.add(lang + ".traineddata");
            }
        }
        if (!missing.isEmpty()) {
            throw new OcrException("Tesseract language data missing in " + dir.toAbsolutePath() + ": " + String.join(", ", missing));
        }
    }

    private Tesseract createEngine() {
        requireLanguageData(datapath, language);

        Tesseract tesseract = new Tesseract();
        if (!datapath.isEmpty()) {
            tesseract.setDatapath(datapath);
        }
        tesseract.setLanguage(language);
        tesseract.setPageSegMode(TessPageSegMode.PSM_AUTO);
        // e-Faktur scans rarely carry DPI metadata
        tesseract.setVariable("user_defined_dpi", "300");

        log.info("[OCR] Tesseract engine ready on {} lang={} tessdata='{}'", Thread.currentThread().getName(), language, datapath);
        return tesseract;
    }
}
