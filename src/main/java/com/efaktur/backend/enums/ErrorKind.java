package com.efaktur.backend.enums;

import org.springframework.http.HttpStatus;

/**
 * Terminal pipeline failures and the HTTP status each one is reported with.
 */
public enum ErrorKind {
    UNSUPPORTED_FORMAT(HttpStatus.UNSUPPORTED_MEDIA_TYPE),
    CORRUPT_INPUT(HttpStatus.BAD_REQUEST),
    QR_NOT_FOUND(HttpStatus.UNPROCESSABLE_ENTITY),
    NETWORK_ERROR(HttpStatus.BAD_GATEWAY),
    HTTP_ERROR(HttpStatus.BAD_GATEWAY),
    MALFORMED_RESPONSE(HttpStatus.BAD_GATEWAY);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
