package com.efaktur.backend.exceptions;

import com.efaktur.backend.enums.ErrorKind;

/**
 * Thrown when no raster region yields a QR payload that is a DJP lookup URL.
 */
public class QrNotFoundException extends EfakturValidationException {

    public QrNotFoundException(String message) {
        super(ErrorKind.QR_NOT_FOUND, message);
    }
}
