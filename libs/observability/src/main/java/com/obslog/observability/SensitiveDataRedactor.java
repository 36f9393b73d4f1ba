package com.obslog.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Masks sensitive values inside a parsed JSON tree so request and response previews never
 * carry credentials.
 * <p>
 * A key is sensitive when its lower-cased, trimmed form equals or contains any configured
 * redact key. Matching is applied to object keys only: array elements are walked into but
 * never masked by position, so a secret stored as a bare array value is left as is.
 */
public final class SensitiveDataRedactor {

    /** The replacement written in place of a redacted value. */
    public static final String MASK = "***";

    /** Keys redacted when no explicit set is configured. */
    public static final Set<String> DEFAULT_REDACT_KEYS = Set.of(
            "authorization", "cookie", "set-cookie", "password", "passwd", "secret",
            "token", "access_token", "refresh_token", "api_token", "api_key"
    );

    private static final SensitiveDataRedactor DEFAULT = new SensitiveDataRedactor(DEFAULT_REDACT_KEYS);

    private final Set<String> redactKeys;

    /**
     * Creates a redactor for the given keys. Keys are lower-cased and trimmed, blanks are
     * dropped; a null or effectively empty collection falls back to {@link #DEFAULT_REDACT_KEYS}.
     *
     * @param keys redact keys (nullable)
     */
    public SensitiveDataRedactor(Collection<String> keys) {
        Set<String> normalized = normalize(keys);
        this.redactKeys = normalized.isEmpty() ? DEFAULT_REDACT_KEYS : Set.copyOf(normalized);
    }

    /**
     * Returns the redactor using {@link #DEFAULT_REDACT_KEYS}.
     */
    public static SensitiveDataRedactor defaults() {
        return DEFAULT;
    }

    /**
     * Recursively masks every sensitive key of the tree in place.
     *
     * @param node parsed JSON value (objects and arrays are walked, scalars ignored)
     */
    public void redact(JsonNode node) {
        if (node instanceof ObjectNode object) {
            List<String> fieldNames = new ArrayList<>();
            object.fieldNames().forEachRemaining(fieldNames::add);
            for (String fieldName : fieldNames) {
                if (isSensitive(fieldName)) {
                    object.put(fieldName, MASK);
                } else {
                    redact(object.get(fieldName));
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (JsonNode element : array) {
                redact(element);
            }
        }
    }

    /**
     * Checks whether a field name matches any redact key (exact or substring, case-insensitive).
     *
     * @param fieldName the field name to check
     * @return true if the value under this name must be masked
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        String normalized = fieldName.strip().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return false;
        }
        if (redactKeys.contains(normalized)) {
            return true;
        }
        for (String key : redactKeys) {
            if (normalized.contains(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the effective redact keys.
     */
    public Set<String> redactKeys() {
        return redactKeys;
    }

    private static Set<String> normalize(Collection<String> keys) {
        Set<String> normalized = new LinkedHashSet<>();
        if (keys == null) {
            return normalized;
        }
        for (String key : keys) {
            if (key == null) {
                continue;
            }
            String trimmed = key.strip().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty()) {
                normalized.add(trimmed);
            }
        }
        return normalized;
    }
}
