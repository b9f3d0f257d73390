package com.efaktur.backend.services.document;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDInlineImage;
import org.springframework.stereotype.Component;

import com.efaktur.backend.model.RasterRegion;

import lombok.extern.slf4j.Slf4j;

/**
 * Collects the raster images a PDF draws, page by page, in content-stream order.
 * Covers image XObjects (also inside form XObjects) and inline images ({@code BI ... ID ... EI}).
 * An image XObject drawn several times is collected once. Whole-page renders are not produced here.
 */
@Component
@Slf4j
public class PdfImageExtractor {

    static final int MAX_FORM_DEPTH = 4;

    public List<RasterRegion> extractImages(PDDocument document) {
        List<RasterRegion> regions = new ArrayList<>();
        if (document == null) return regions;

        Set<COSBase> seenXObjects = Collections.newSetFromMap(new IdentityHashMap<>());
        int pageIndex = 0;
        for (PDPage page : document.getPages()) {
            ImageCollector collector = new ImageCollector(pageIndex, regions, seenXObjects);
            try {
                collector.processPage(page);
            } catch (IOException | RuntimeException e) {
                log.warn("[Normalizer] Stopped image scan of page {} after {} image(s): {}",
                        pageIndex + 1, collector.found, e.getMessage());
            }
            pageIndex++;
        }

        log.debug("[Normalizer] Embedded images found: {}", regions.size());
        return regions;
    }

    private static final class ImageCollector extends PDFStreamEngine {

        private final int pageIndex;
        private final List<RasterRegion> out;
        private final Set<COSBase> seenXObjects;
        private int formDepth;
        private int found;

        ImageCollector(int pageIndex, List<RasterRegion> out, Set<COSBase> seenXObjects) {
            this.pageIndex = pageIndex;
            this.out = out;
            this.seenXObjects = seenXObjects;
        }

        @Override
        protected void processOperator(Operator operator, List<COSBase> operands) throws IOException {
            String name = operator.getName();
            if ("BI".equals(name)) {
                drawInline(operator);
            } else if ("Do".equals(name)) {
                drawXObject(operands);
            } else {
                super.processOperator(operator, operands);
            }
        }

        @Override
        public void showForm(PDFormXObject form) throws IOException {
            if (formDepth >= MAX_FORM_DEPTH) {
                log.debug("[Normalizer] Form nesting deeper than {} on page {} ignored", MAX_FORM_DEPTH, pageIndex + 1);
                return;
            }
            formDepth++;
            try {
                super.showForm(form);
            } finally {
                formDepth--;
            }
        }

        private void drawInline(Operator operator) {
            if (operator.getImageParameters() == null || operator.getImageData() == null) return;
            try {
                PDInlineImage image = new PDInlineImage(operator.getImageParameters(), operator.getImageData(), getResources());
                add(image, "inline");
            } catch (IOException | RuntimeException e) {
                log.warn("[Normalizer] Skipping inline image on page {}: {}", pageIndex + 1, e.getMessage());
            }
        }

        private void drawXObject(List<COSBase> operands) throws IOException {
            if (operands.isEmpty() || !(operands.get(0) instanceof COSName)) return;
            COSName name = (COSName) operands.get(0);

            PDResources resources = getResources();
            if (resources == null) return;

            PDXObject xObject;
            try {
                xObject = resources.getXObject(name);
            } catch (IOException e) {
                log.warn("[Normalizer] Skipping unreadable XObject {} on page {}: {}", name.getName(), pageIndex + 1, e.getMessage());
                return;
            }

            if (xObject instanceof PDImageXObject) {
                if (seenXObjects.add(xObject.getCOSObject())) {
                    add((PDImageXObject) xObject, name.getName());
                }
            } else if (xObject instanceof PDFormXObject) {
                showForm((PDFormXObject) xObject);
            }
        }

        private void add(PDImage image, String label) {
            BufferedImage decoded;
            try {
                decoded = image.getImage();
            } catch (IOException | RuntimeException e) {
                // JBIG2/JPX streams need optional ImageIO plugins.
                log.warn("[Normalizer] Skipping image {} on page {} ({}): {}",
                        label, pageIndex + 1, image.getSuffix(), e.getMessage());
                return;
            }
            if (decoded == null) return;

            out.add(RasterRegion.embedded(decoded, pageIndex, out.size()));
            found++;
        }
    }
}
