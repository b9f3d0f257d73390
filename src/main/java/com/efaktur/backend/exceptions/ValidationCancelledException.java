package com.efaktur.backend.exceptions;

/**
 * Thrown at a blocking boundary (OCR call, DJP lookup) when the worker thread was interrupted because the request
 * timed out or the client went away.
 */
public class ValidationCancelledException extends RuntimeException {

    public ValidationCancelledException(String stage) {
        super("Validation cancelled before " + stage);
    }
}
