package com.efaktur.backend.services.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.mockito.ArgumentCaptor;

import com.efaktur.backend.enums.DocumentType;
import com.efaktur.backend.enums.ErrorKind;
import com.efaktur.backend.exceptions.CorruptInputException;
import com.efaktur.backend.exceptions.UnsupportedFormatException;
import com.efaktur.backend.exceptions.ValidationCancelledException;
import com.efaktur.backend.model.NormalizedDocument;
import com.efaktur.backend.model.RasterRegion;
import com.efaktur.backend.services.ocr.OcrImagePreprocessor;
import com.efaktur.backend.services.ocr.OcrProperties;
import com.efaktur.backend.services.ocr.OcrService;
import com.efaktur.backend.services.ocr.PdfOcrExtractor;
import com.efaktur.backend.services.ocr.PdfTextExtractor;
import com.efaktur.backend.services.qr.QrLocator;
import com.efaktur.backend.services.qr.QrProperties;
import com.efaktur.backend.services.qr.ZxingQrCodeDecoder;
import com.efaktur.backend.support.EfakturFixtures;

class DocumentNormalizerTest {

    private OcrProperties ocrProperties;
    private OcrService ocrService;
    private DocumentNormalizer normalizer;

    @BeforeEach
    void setup() {
        ocrProperties = new OcrProperties();
        ocrService = mock(OcrService.class);
        normalizer = new DocumentNormalizer(
                new PdfTextExtractor(),
                new PdfOcrExtractor(ocrProperties, ocrService),
                new PdfImageExtractor(),
                ocrService,
                ocrProperties,
                new OcrImagePreprocessor());
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void normalize_pdfWithTextLayerAndQr() {
        byte[] pdf = EfakturFixtures.pdf(EfakturFixtures.SAMPLE_INVOICE_LINES,
                EfakturFixtures.qrImage(EfakturFixtures.LOOKUP_URL, 300));

        NormalizedDocument doc = normalizer.normalize(pdf, "application/pdf", "faktur.pdf");

        assertEquals(DocumentType.PDF, doc.type());
        assertEquals(1, doc.pageCount());
        assertEquals(0, doc.ocrPages());
        assertTrue(doc.plainText().contains("Nama : PT ABC"));
        assertTrue(doc.plainText().contains("Dasar Pengenaan Pajak 15.000.000,00"));
        assertEquals(1, doc.rasterRegions().size());
        assertEquals(RasterRegion.Origin.PDF_EMBEDDED_IMAGE, doc.rasterRegions().get(0).origin());
        verify(ocrService, never()).extractText(any());

        QrLocator locator = new QrLocator(new ZxingQrCodeDecoder(), new QrProperties());
        assertEquals(EfakturFixtures.LOOKUP_URL, locator.locate(doc.rasterRegions()).orElseThrow());
    }

    @Test
    void normalize_pdfWithInlineQrImage_collectsInlineRegion() {
        byte[] pdf = EfakturFixtures.pdfWithInlineImage(EfakturFixtures.SAMPLE_INVOICE_LINES,
                EfakturFixtures.qrImage(EfakturFixtures.LOOKUP_URL, 200));

        NormalizedDocument doc = normalizer.normalize(pdf, "application/pdf", "faktur.pdf");

        assertEquals(1, doc.rasterRegions().size());
        assertEquals(RasterRegion.Origin.PDF_EMBEDDED_IMAGE, doc.rasterRegions().get(0).origin());
        assertEquals(200, doc.rasterRegions().get(0).width());

        QrLocator locator = new QrLocator(new ZxingQrCodeDecoder(), new QrProperties());
        assertEquals(EfakturFixtures.LOOKUP_URL, locator.locate(doc.rasterRegions()).orElseThrow());
    }

    @Test
    void normalize_unreadableTextLayer_fallsBackToOcr() throws IOException {
        PdfTextExtractor brokenTextLayer = mock(PdfTextExtractor.class);
        when(brokenTextLayer.extractPageText(any(PDDocument.class), anyInt())).thenThrow(new IOException("broken font program"));
        ocrProperties.setEnabled(true);
        when(ocrService.extractText(any(BufferedImage.class))).thenReturn(EfakturFixtures.SAMPLE_INVOICE_TEXT);
        DocumentNormalizer tolerant = new DocumentNormalizer(
                brokenTextLayer,
                new PdfOcrExtractor(ocrProperties, ocrService),
                new PdfImageExtractor(),
                ocrService,
                ocrProperties,
                new OcrImagePreprocessor());
        byte[] pdf = EfakturFixtures.pdf(EfakturFixtures.SAMPLE_INVOICE_LINES,
                EfakturFixtures.qrImage(EfakturFixtures.LOOKUP_URL, 300));

        NormalizedDocument doc = tolerant.normalize(pdf, "application/pdf", "faktur.pdf");

        assertEquals(1, doc.ocrPages());
        assertEquals(EfakturFixtures.SAMPLE_INVOICE_TEXT, doc.plainText());
        assertEquals(1, doc.rasterRegions().size());
    }

    @Test
    void normalize_unreadableTextLayerWithoutOcr_keepsRegions() throws IOException {
        PdfTextExtractor brokenTextLayer = mock(PdfTextExtractor.class);
        when(brokenTextLayer.extractPageText(any(PDDocument.class), anyInt())).thenThrow(new IllegalStateException("bad content stream"));
        DocumentNormalizer tolerant = new DocumentNormalizer(
                brokenTextLayer,
                new PdfOcrExtractor(ocrProperties, ocrService),
                new PdfImageExtractor(),
                ocrService,
                ocrProperties,
                new OcrImagePreprocessor());
        byte[] pdf = EfakturFixtures.pdf(EfakturFixtures.SAMPLE_INVOICE_LINES,
                EfakturFixtures.qrImage(EfakturFixtures.LOOKUP_URL, 300));

        NormalizedDocument doc = tolerant.normalize(pdf, "application/pdf", "faktur.pdf");

        assertEquals("", doc.plainText());
        assertEquals(1, doc.rasterRegions().size());
    }

    @Test
    void normalize_scannedPdf_ocrsPagesWithoutTextLayer() {
        ocrProperties.setEnabled(true);
        when(ocrService.extractText(any(BufferedImage.class))).thenReturn(EfakturFixtures.SAMPLE_INVOICE_TEXT);
        byte[] pdf = EfakturFixtures.pdf(List.of(), EfakturFixtures.qrImage(EfakturFixtures.LOOKUP_URL, 300));

        NormalizedDocument doc = normalizer.normalize(pdf, "application/octet-stream", "scan.pdf");

        assertEquals(1, doc.ocrPages());
        assertEquals(EfakturFixtures.SAMPLE_INVOICE_TEXT, doc.plainText());
        verify(ocrService, times(1)).extractText(any(BufferedImage.class));
    }

    @Test
    void normalize_scannedPdf_ocrDisabled_hasEmptyText() {
        byte[] pdf = EfakturFixtures.pdf(List.of(), EfakturFixtures.qrImage(EfakturFixtures.LOOKUP_URL, 300));

        NormalizedDocument doc = normalizer.normalize(pdf, "application/pdf", "scan.pdf");

        assertEquals("", doc.plainText());
        assertEquals(1, doc.rasterRegions().size());
        verify(ocrService, never()).extractText(any());
    }

    @Test
    void normalize_pngWithOcr_preprocessesAndKeepsImageAsRegion() {
        ocrProperties.setEnabled(true);
        when(ocrService.extractText(any(BufferedImage.class))).thenReturn("Nama : PT ABC");
        BufferedImage qr = EfakturFixtures.qrImage(EfakturFixtures.LOOKUP_URL, 300);

        NormalizedDocument doc = normalizer.normalize(EfakturFixtures.png(qr), "image/png", "faktur.png");

        assertEquals(DocumentType.PNG, doc.type());
        assertEquals("Nama : PT ABC", doc.plainText());
        assertEquals(1, doc.rasterRegions().size());
        assertEquals(RasterRegion.Origin.STANDALONE_IMAGE, doc.rasterRegions().get(0).origin());
        assertEquals(300, doc.rasterRegions().get(0).width());

        ArgumentCaptor<BufferedImage> captor = ArgumentCaptor.forClass(BufferedImage.class);
        verify(ocrService).extractText(captor.capture());
        assertNotSame(doc.rasterRegions().get(0).image(), captor.getValue());
    }

    @Test
    void normalize_imageWithOcrDisabled_hasEmptyText() {
        NormalizedDocument doc = normalizer.normalize(
                EfakturFixtures.png(EfakturFixtures.blankImage(40, 40)), null, "scan.png");

        assertEquals("", doc.plainText());
        assertEquals(1, doc.rasterRegions().size());
        verify(ocrService, never()).extractText(any());
    }

    @Test
    void normalize_unsupportedFormat() {
        UnsupportedFormatException ex = assertThrows(UnsupportedFormatException.class,
                () -> normalizer.normalize(new byte[] {1, 2, 3}, "image/gif", "scan.gif"));

        assertEquals(ErrorKind.UNSUPPORTED_FORMAT, ex.getKind());
    }

    @Test
    void normalize_corruptPdf() {
        byte[] garbage = "this is not a pdf".getBytes(StandardCharsets.UTF_8);

        CorruptInputException ex = assertThrows(CorruptInputException.class,
                () -> normalizer.normalize(garbage, "application/pdf", "faktur.pdf"));

        assertEquals(ErrorKind.CORRUPT_INPUT, ex.getKind());
    }

    @Test
    void normalize_corruptImage() {
        byte[] garbage = "this is not a png".getBytes(StandardCharsets.UTF_8);

        assertThrows(CorruptInputException.class, () -> normalizer.normalize(garbage, "image/png", "faktur.png"));
        verify(ocrService, never()).extractText(any());
    }

    @Test
    void normalize_emptyContent() {
        assertThrows(CorruptInputException.class, () -> normalizer.normalize(new byte[0], "application/pdf", "faktur.pdf"));
    }

    @Test
    void normalize_interruptedBeforeOcr_isCancelled() {
        ocrProperties.setEnabled(true);
        byte[] png = EfakturFixtures.png(EfakturFixtures.blankImage(40, 40));

        Thread.currentThread().interrupt();

        assertThrows(ValidationCancelledException.class, () -> normalizer.normalize(png, "image/png", "faktur.png"));
        verify(ocrService, never()).extractText(any());
    }
}
