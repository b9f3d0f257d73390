package com.efaktur.backend.services.ocr;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableConfigurationProperties(OcrProperties.class)
@Slf4j
public class OcrConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "efaktur.ocr", name = "enabled", havingValue = "true")
    public OcrService ocrService(OcrProperties ocrProperties) {
        String engine = safe(ocrProperties.getEngine()).trim();

        if (OcrProperties.ENGINE_GOOGLE_VISION.equalsIgnoreCase(engine)) {
            log.info("[OCR] Enabled: engine=google-vision projectId='{}'",
                    safe(ocrProperties.getGoogleVision().getProjectId()));
            return new GoogleVisionOcrService(ocrProperties.getGoogleVision());
        }

        if (!engine.isEmpty() && !OcrProperties.ENGINE_TESSERACT.equalsIgnoreCase(engine)) {
            log.warn("[OCR] Unknown engine '{}', falling back to tesseract", engine);
        }
        log.info("[OCR] Enabled: engine=tesseract language='{}' tessdataPath='{}' renderDpi={} maxPages={}",
                safe(ocrProperties.getLanguage()),
                safe(ocrProperties.getTessdataPath()),
                ocrProperties.getPdf().getRenderDpi(),
                ocrProperties.getPdf().getMaxPages());
        return new TesseractOcrService(ocrProperties);
    }

    @Bean
    @ConditionalOnMissingBean(OcrService.class)
    public OcrService disabledOcrService() {
        log.info("[OCR] Disabled (efaktur.ocr.enabled=false)");
        return new DisabledOcrService();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
