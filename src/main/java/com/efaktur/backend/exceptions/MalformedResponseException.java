package com.efaktur.backend.exceptions;

import com.efaktur.backend.enums.ErrorKind;

/**
 * Thrown when the DJP response body is not well-formed XML.
 */
public class MalformedResponseException extends EfakturValidationException {

    public MalformedResponseException(String message) {
        super(ErrorKind.MALFORMED_RESPONSE, message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_RESPONSE, message, cause);
    }
}
