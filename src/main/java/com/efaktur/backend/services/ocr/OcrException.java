package com.efaktur.backend.services.ocr;

/**
 * Raised when the text recognition engine itself fails (missing tessdata, engine crash, remote API error).
 */
public class OcrException extends RuntimeException {

    public OcrException(String message) {
        super(message);
    }

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
