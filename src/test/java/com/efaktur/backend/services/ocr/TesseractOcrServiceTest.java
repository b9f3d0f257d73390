package com.efaktur.backend.services.ocr;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TesseractOcrServiceTest {

    @TempDir
    Path tessdata;

    @Test
    void languages_splitsCombinedSpec() {
        assertEquals(List.of("eng", "ind"), TesseractOcrService.languages("eng+ind"));
        assertEquals(List.of("ind"), TesseractOcrService.languages("ind"));
    }

    @Test
    void requireLanguageData_namesEveryMissingLanguage() throws IOException {
        Files.createFile(tessdata.resolve("eng.traineddata"));

        OcrException ex = assertThrows(OcrException.class,
                () -> TesseractOcrService.requireLanguageData(tessdata.toString(), "eng+ind"));

        assertTrue(ex.getMessage().contains("ind.traineddata"));
        assertTrue(!ex.getMessage().contains("eng.traineddata"));
    }

    @Test
    void requireLanguageData_acceptsCompleteDirectory() throws IOException {
        Files.createFile(tessdata.resolve("eng.traineddata"));
        Files.createFile(tessdata.resolve("ind.traineddata"));

        assertDoesNotThrow(() -> TesseractOcrService.requireLanguageData(tessdata.toString(), "eng+ind"));
    }

    @Test
    void requireLanguageData_unconfiguredPathIsLeftToTesseract() {
        assertDoesNotThrow(() -> TesseractOcrService.requireLanguageData("", "eng+ind"));
    }

    @Test
    void extractText_missingTessdataDirectory_failsWithOcrException() {
        OcrProperties props = new OcrProperties();
        props.setTessdataPath(tessdata.resolve("absent").toString());
        TesseractOcrService service = new TesseractOcrService(props);

        OcrException ex = assertThrows(OcrException.class,
                () -> service.extractText(new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB)));

        assertTrue(ex.getMessage().startsWith("Tessdata directory not found"));
    }

    @Test
    void extractText_nullImage_isEmpty() {
        assertEquals("", new TesseractOcrService(new OcrProperties()).extractText(null));
    }
}
