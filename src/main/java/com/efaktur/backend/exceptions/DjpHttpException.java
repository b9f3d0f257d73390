package com.efaktur.backend.exceptions;

import com.efaktur.backend.enums.ErrorKind;

/**
 * Thrown when the DJP lookup answers with a non-2xx status. The upstream status is part of the message.
 */
public class DjpHttpException extends EfakturValidationException {

    public DjpHttpException(int status) {
        super(ErrorKind.HTTP_ERROR, "DJP service returned HTTP " + status);
    }
}
