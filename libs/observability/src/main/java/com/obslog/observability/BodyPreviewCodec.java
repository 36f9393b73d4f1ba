package com.obslog.observability;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Optional;

/**
 * Builds {@link BodyPreview}s for access logs and LLM-call spans.
 * <p>
 * Pipeline: JSON objects and arrays are parsed, redacted with {@link SensitiveDataRedactor}
 * and re-serialized; anything else (form bodies, plain text, binary, JSON scalars) is passed
 * through untouched, so no redaction happens on non-JSON payloads. The sanitized bytes are then
 * cut to the byte budget and decoded as UTF-8 with malformed sequences replaced.
 * <p>
 * The reported size is always that of the original payload.
 */
public final class BodyPreviewCodec {

    /** Byte budget used when none is configured. */
    public static final int DEFAULT_MAX_BYTES = 2048;

    private BodyPreviewCodec() {
        // utility class
    }

    /**
     * Previews a payload with the default budget and redact keys.
     */
    public static BodyPreview preview(byte[] body) {
        return preview(body, DEFAULT_MAX_BYTES, null);
    }

    /**
     * Previews a raw payload.
     *
     * @param body       payload bytes (nullable)
     * @param maxBytes   byte budget, values below 1 are treated as 1
     * @param redactKeys keys to mask, null or empty for {@link SensitiveDataRedactor#DEFAULT_REDACT_KEYS}
     * @return the preview, {@link BodyPreview#empty()} for a null or empty body
     */
    public static BodyPreview preview(byte[] body, int maxBytes, Collection<String> redactKeys) {
        if (body == null || body.length == 0) {
            return BodyPreview.empty();
        }
        byte[] sanitized = sanitize(body, new SensitiveDataRedactor(redactKeys));
        return truncate(sanitized, maxBytes, body.length);
    }

    /**
     * Previews a textual payload, encoded as UTF-8 first.
     */
    public static BodyPreview preview(String body, int maxBytes, Collection<String> redactKeys) {
        if (body == null) {
            return BodyPreview.empty();
        }
        return preview(body.getBytes(StandardCharsets.UTF_8), maxBytes, redactKeys);
    }

    /**
     * Serializes an arbitrary value as JSON and previews the serialized form. No redaction is
     * applied and {@code size} is the length of the serialized JSON.
     *
     * @param value    value to serialize (records, maps, lists, scalars)
     * @param maxBytes byte budget, values below 1 are treated as 1
     */
    public static BodyPreview previewJson(Object value, int maxBytes) {
        byte[] encoded = ObservabilityJson.writeBytes(value);
        return truncate(encoded, maxBytes, encoded.length);
    }

    private static byte[] sanitize(byte[] raw, SensitiveDataRedactor redactor) {
        Optional<JsonNode> parsed = ObservabilityJson.tryParse(raw);
        if (parsed.isEmpty() || !parsed.get().isContainerNode()) {
            return raw;
        }
        JsonNode tree = parsed.get();
        redactor.redact(tree);
        try {
            return ObservabilityJson.writeBytes(tree);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }

    private static BodyPreview truncate(byte[] sanitized, int maxBytes, int originalSize) {
        int limit = Math.max(maxBytes, 1);
        boolean truncated = sanitized.length > limit;
        int length = truncated ? limit : sanitized.length;
        String text = new String(sanitized, 0, length, StandardCharsets.UTF_8);
        return new BodyPreview(text, truncated, originalSize);
    }
}
