package com.socialfeed.ingest.model;

/**
 * Content sources a user can follow. Each one is scraped by its own actor and
 * persisted under its own natural-key namespace.
 */
public enum ContentSource {

    TWITTER("profile-handle"),
    FACEBOOK("page-url");

    private final String referenceKind;

    ContentSource(String referenceKind) {
        this.referenceKind = referenceKind;
    }

    /**
     * Returns the kind of reference users declare for this source.
     */
    public String getReferenceKind() {
        return referenceKind;
    }
}
