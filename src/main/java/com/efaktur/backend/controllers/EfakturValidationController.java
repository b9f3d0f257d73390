package com.efaktur.backend.controllers;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.WebAsyncTask;
import org.springframework.web.multipart.MultipartFile;

import com.efaktur.backend.config.AsyncExecutorConfig;
import com.efaktur.backend.config.ValidationProperties;
import com.efaktur.backend.dto.ValidationResponseDTO;
import com.efaktur.backend.exceptions.CorruptInputException;
import com.efaktur.backend.mappers.ValidationResponseMapper;
import com.efaktur.backend.model.ValidationOutcome;
import com.efaktur.backend.services.validation.EfakturValidationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

@RestController
@Tag(name = "E-Faktur", description = "Validate e-Faktur documents against DJP records")
@Slf4j
public class EfakturValidationController {

    static final String TIMEOUT_MESSAGE = "Validation timed out";

    private final EfakturValidationService validationService;
    private final ValidationProperties validationProperties;
    private final AsyncTaskExecutor validationExecutor;

    public EfakturValidationController(
            EfakturValidationService validationService,
            ValidationProperties validationProperties,
            @Qualifier(AsyncExecutorConfig.VALIDATION_EXECUTOR) AsyncTaskExecutor validationExecutor
    ) {
        this.validationService = validationService;
        this.validationProperties = validationProperties;
        this.validationExecutor = validationExecutor;
    }

    @Operation(summary = "Validate an e-Faktur PDF or image against the DJP record referenced by its QR code")
    @PostMapping(value = "/validate-efaktur", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public WebAsyncTask<ResponseEntity<ValidationResponseDTO>> validate(@RequestParam("file") MultipartFile file)
            throws IOException {
        if (file == null || file.isEmpty()) {
            throw new CorruptInputException("Uploaded file is empty");
        }

        // the multipart temp file does not outlive the servlet thread
        byte[] bytes = file.getBytes();
        String contentType = file.getContentType();
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";

        Callable<ResponseEntity<ValidationResponseDTO>> work = () -> {
            ValidationOutcome outcome = validationService.validate(bytes, contentType, filename);
            ValidationResponseDTO body = ValidationResponseMapper.toResponseDTO(
                    outcome, validationProperties.isIncludeDiagnostics());
            HttpStatus status = outcome.isError() ? outcome.getErrorKind().getHttpStatus() : HttpStatus.OK;
            return ResponseEntity.status(status).body(body);
        };

        long timeoutMs = validationProperties.getRequestTimeout().toMillis();
        WebAsyncTask<ResponseEntity<ValidationResponseDTO>> task = new WebAsyncTask<>(timeoutMs, validationExecutor, work);
        task.onTimeout(() -> {
            log.warn("[Pipeline] Request for {} exceeded {}ms", filename, timeoutMs);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ValidationResponseMapper.error(TIMEOUT_MESSAGE));
        });
        return task;
    }
}
