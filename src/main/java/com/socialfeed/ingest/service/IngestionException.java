package com.socialfeed.ingest.service;

public class IngestionException extends RuntimeException {
    /**
     * Creates an exception describing an ingestion failure.
     */
    public IngestionException(String m) { super(m); }
    /**
     * Creates an exception that preserves the originating cause.
     */
    public IngestionException(String m, Throwable c) { super(m, c); }
}
