package com.efaktur.backend.handlers;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import com.efaktur.backend.dto.ValidationResponseDTO;
import com.efaktur.backend.exceptions.EfakturValidationException;
import com.efaktur.backend.exceptions.ValidationCancelledException;
import com.efaktur.backend.mappers.ValidationResponseMapper;
import com.efaktur.backend.services.ocr.OcrException;

import lombok.extern.slf4j.Slf4j;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private ResponseEntity<ValidationResponseDTO> buildResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ValidationResponseMapper.error(message));
    }

    // status taken from the ErrorKind
    @ExceptionHandler(EfakturValidationException.class)
    public ResponseEntity<ValidationResponseDTO> handleValidation(EfakturValidationException ex) {
        return buildResponse(ex.getKind().getHttpStatus(), ex.getMessage());
    }

    // 400 - missing "file" part
    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ValidationResponseDTO> handleMissingPart(Exception ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "Multipart field 'file' is required");
    }

    // 413 - upload over the multipart limit
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ValidationResponseDTO> handleTooLarge(MaxUploadSizeExceededException ex) {
        return buildResponse(HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded file is too large");
    }

    // 400 - unreadable multipart body
    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ValidationResponseDTO> handleMultipart(MultipartException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "Failed to process uploaded file");
    }

    // 503 - request timeout or client disconnect
    @ExceptionHandler({ValidationCancelledException.class, AsyncRequestTimeoutException.class})
    public ResponseEntity<ValidationResponseDTO> handleCancelled(Exception ex) {
        log.warn("[Pipeline] {}", ex.getMessage());
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, "Validation timed out");
    }

    @ExceptionHandler(OcrException.class)
    public ResponseEntity<ValidationResponseDTO> handleOcr(OcrException ex) {
        log.error("[OCR] Recognition failed", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to extract text from document");
    }

    // 500 - unexpected
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ValidationResponseDTO> handleGeneric(Exception ex) {
        log.error("[Pipeline] Unexpected failure", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error during validation");
    }
}
