package com.socialfeed.ingest.service;

/**
 * A text-generation call failed in transport or was rejected by the remote service.
 */
public class EnrichmentTransportException extends IngestionException {
    public EnrichmentTransportException(String m) { super(m); }
    public EnrichmentTransportException(String m, Throwable c) { super(m, c); }
}
