package com.efaktur.backend.exceptions;

import com.efaktur.backend.enums.ErrorKind;

/**
 * Base class for failures that end a validation request. Field-level absence or mismatch never raises this.
 */
public abstract class EfakturValidationException extends RuntimeException {

    private final ErrorKind kind;

    protected EfakturValidationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected EfakturValidationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
