package com.socialfeed.ingest.service;

/**
 * A required setting or credential is absent. Raised at startup, never per invocation.
 */
public class MissingConfigurationException extends IngestionException {
    public MissingConfigurationException(String property) {
        super("Required configuration '" + property + "' is not set");
    }
}
