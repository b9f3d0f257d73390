package com.efaktur.backend.services.ocr;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "efaktur.ocr")
public class OcrProperties {

    public static final String ENGINE_TESSERACT = "tesseract";
    public static final String ENGINE_GOOGLE_VISION = "google-vision";

    /**
     * Enables OCR for uploaded images and for PDF pages without a text layer.
     */
    private boolean enabled = false;

    /**
     * Recognition engine: "tesseract" (local Tess4J) or "google-vision".
     */
    private String engine = ENGINE_TESSERACT;

    /**
     * Tesseract language(s). e-Faktur documents mix Indonesian and English labels.
     */
    private String language = "eng+ind";

    /**
     * Optional path that contains the "tessdata" directory.
     * If empty, Tess4J/Tesseract will rely on OS installation and environment.
     */
    private String tessdataPath = "";

    /**
     * Grayscale + sharpen standalone images before OCR.
     */
    private boolean preprocessImages = true;

    private Pdf pdf = new Pdf();

    private GoogleVision googleVision = new GoogleVision();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getEngine() {
        return engine;
    }

    public void setEngine(String engine) {
        this.engine = engine;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getTessdataPath() {
        return tessdataPath;
    }

    public void setTessdataPath(String tessdataPath) {
        this.tessdataPath = tessdataPath;
    }

    public boolean isPreprocessImages() {
        return preprocessImages;
    }

    public void setPreprocessImages(boolean preprocessImages) {
        this.preprocessImages = preprocessImages;
    }

    public Pdf getPdf() {
        return pdf;
    }

    public void setPdf(Pdf pdf) {
        this.pdf = pdf;
    }

    public GoogleVision getGoogleVision() {
        return googleVision;
    }

    public void setGoogleVision(GoogleVision googleVision) {
        this.googleVision = googleVision;
    }

    public static class Pdf {

        /**
         * Render DPI for OCR of pages without a text layer.
         */
        private int renderDpi = 220;

        /**
         * Max number of pages rendered for OCR in one document.
         */
        private int maxPages = 6;

        public int getRenderDpi() {
            return renderDpi;
        }

        public void setRenderDpi(int renderDpi) {
            this.renderDpi = renderDpi;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }
    }

    public static class GoogleVision {

        private String projectId = "";

        /**
         * Service account JSON. If empty, Application Default Credentials are used.
         */
        private String credentialsPath = "";

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getCredentialsPath() {
            return credentialsPath;
        }

        public void setCredentialsPath(String credentialsPath) {
            this.credentialsPath = credentialsPath;
        }
    }
}
