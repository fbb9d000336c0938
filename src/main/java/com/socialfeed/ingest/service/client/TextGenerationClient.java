package com.socialfeed.ingest.service.client;

import com.socialfeed.ingest.service.EnrichmentTransportException;

/**
 * Single-shot text completion. One call per record, no streaming, no retries.
 */
public interface TextGenerationClient {

    /**
     * @return the completion text as returned by the service
     * @throws EnrichmentTransportException if the call fails or the reply has no text
     */
    String complete(String systemInstruction, String prompt, double temperature);
}
