package com.socialfeed.ingest.service;

import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/**
 * Canonicalizes user-declared profile references.
 */
@Component
public class ReferenceNormalizer {

    /**
     * Reduces {@code name}, {@code @name}, {@code https://host/name} or
     * {@code https://host/name/status/...} to the bare handle. Case is passed through.
     *
     * @return the handle, or empty when nothing usable remains
     */
    public Optional<String> normalizeHandle(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (hasScheme(value)) {
            value = firstPathSegment(value);
        }
        if (value.startsWith("@")) {
            value = value.substring(1);
        }
        value = value.trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Page references are handed to the actor as URLs; only surrounding whitespace is removed.
     *
     * @return the trimmed URL, or empty when blank
     */
    public Optional<String> normalizePageUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(raw.trim());
    }

    private boolean hasScheme(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private String firstPathSegment(String url) {
        String path;
        try {
            path = new URI(url).getPath();
        } catch (URISyntaxException e) {
            // fall back to manual split for URLs with unescaped characters
            int hostStart = url.indexOf("://") + 3;
            int pathStart = url.indexOf('/', hostStart);
            path = pathStart < 0 ? "" : url.substring(pathStart);
            int query = path.indexOf('?');
            if (query >= 0) path = path.substring(0, query);
        }
        if (path == null) {
            return "";
        }
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                return segment;
            }
        }
        return "";
    }
}
