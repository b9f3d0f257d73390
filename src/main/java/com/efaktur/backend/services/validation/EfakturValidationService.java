package com.efaktur.backend.services.validation;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.efaktur.backend.exceptions.EfakturValidationException;
import com.efaktur.backend.exceptions.QrNotFoundException;
import com.efaktur.backend.model.InvoiceFieldSet;
import com.efaktur.backend.model.NormalizedDocument;
import com.efaktur.backend.model.ValidationOutcome;
import com.efaktur.backend.services.djp.DjpRecordFetcher;
import com.efaktur.backend.services.djp.DjpResponseParser;
import com.efaktur.backend.services.document.DocumentNormalizer;
import com.efaktur.backend.services.extraction.InvoiceFieldExtractor;
import com.efaktur.backend.services.qr.QrLocator;
import com.efaktur.backend.util.Cancellation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one upload through the whole pipeline: normalize, locate the QR code, fetch and parse the DJP record,
 * extract the document fields and compare.
 *
 * Every pipeline failure ends as an ERROR outcome with the matching {@link com.efaktur.backend.enums.ErrorKind};
 * the DJP service is never contacted when no QR code is found. Cancellation and unexpected failures propagate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EfakturValidationService {

    static final String QR_NOT_FOUND_MESSAGE = "No QR code with a DJP lookup URL found in document";

    private final DocumentNormalizer documentNormalizer;
    private final QrLocator qrLocator;
    private final DjpRecordFetcher djpRecordFetcher;
    private final DjpResponseParser djpResponseParser;
    private final InvoiceFieldExtractor invoiceFieldExtractor;
    private final DeviationEngine deviationEngine;

    public ValidationOutcome validate(byte[] content, String mediaType, String filename) {
        long startMs = System.currentTimeMillis();
        log.info("[Pipeline] Start file={} type={} bytes={}", filename, mediaType, content == null ? 0 : content.length);

        try {
            NormalizedDocument document = documentNormalizer.normalize(content, mediaType, filename);

            Optional<String> qrUrl = qrLocator.locate(document.rasterRegions());
            if (qrUrl.isEmpty()) {
                throw new QrNotFoundException(QR_NOT_FOUND_MESSAGE);
            }

            Cancellation.checkpoint("djp-fetch");
            byte[] xml = djpRecordFetcher.fetch(qrUrl.get());
            InvoiceFieldSet authoritative = djpResponseParser.parse(xml);

            InvoiceFieldSet extracted = invoiceFieldExtractor.extract(document.plainText());

            ValidationOutcome outcome = deviationEngine.compare(extracted, authoritative)
                    .toBuilder()
                    .qrUrl(qrUrl.get())
                    .extractedData(extracted)
                    .rawText(document.plainText())
                    .build();

            log.info("[Pipeline] Done status={} deviations={} elapsedMs={}",
                    outcome.getStatus(), outcome.getDeviations().size(), System.currentTimeMillis() - startMs);
            return outcome;
        } catch (EfakturValidationException e) {
            log.warn("[Pipeline] Failed kind={} message={} elapsedMs={}",
                    e.getKind(), e.getMessage(), System.currentTimeMillis() - startMs);
            return ValidationOutcome.error(e.getKind(), e.getMessage());
        }
    }
}
