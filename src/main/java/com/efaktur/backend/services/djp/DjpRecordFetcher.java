package com.efaktur.backend.services.djp;

/**
 * Retrieves the raw DJP record (XML) behind a lookup URL.
 */
@FunctionalInterface
public interface DjpRecordFetcher {

    /**
     * @throws com.efaktur.backend.exceptions.DjpNetworkException when the URL cannot be reached
     * @throws com.efaktur.backend.exceptions.DjpHttpException    when the service answers with a non-2xx status
     */
    byte[] fetch(String url);
}
