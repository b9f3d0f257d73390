package com.efaktur.backend.exceptions;

import com.efaktur.backend.enums.ErrorKind;

/**
 * Thrown when the PDF or image container cannot be opened at all.
 */
public class CorruptInputException extends EfakturValidationException {

    public CorruptInputException(String message) {
        super(ErrorKind.CORRUPT_INPUT, message);
    }

    public CorruptInputException(String message, Throwable cause) {
        super(ErrorKind.CORRUPT_INPUT, message, cause);
    }
}
