package com.efaktur.backend.exceptions;

import com.efaktur.backend.enums.ErrorKind;

/**
 * Thrown when the DJP lookup URL cannot be reached (timeout, refused connection, DNS).
 */
public class DjpNetworkException extends EfakturValidationException {

    public DjpNetworkException(String message) {
        super(ErrorKind.NETWORK_ERROR, message);
    }

    public DjpNetworkException(String message, Throwable cause) {
        super(ErrorKind.NETWORK_ERROR, message, cause);
    }
}
