package com.efaktur.backend.exceptions;

import com.efaktur.backend.enums.ErrorKind;

/**
 * Thrown when the upload is neither a PDF nor a JPEG/PNG image.
 */
public class UnsupportedFormatException extends EfakturValidationException {

    public UnsupportedFormatException(String message) {
        super(ErrorKind.UNSUPPORTED_FORMAT, message);
    }
}
