package com.obslog.observability.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.obslog.observability.ObservabilityJson;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Pure functions that decide which trace and session identity a request is recorded under.
 * <p>
 * Trace identity: a valid {@code X-Trace-Id}-style header (32 hex characters, any case) wins;
 * otherwise the ambient OpenTelemetry trace id is used and the rejected header is kept as
 * "upstream raw". Resolved trace ids are always lowercase.
 * <p>
 * Session identity: accepted when ASCII and at most {@value #MAX_SESSION_ID_LENGTH}
 * characters, otherwise rejected and kept as "upstream raw".
 */
public final class TraceIdentityResolver {

    /** Longest session id accepted from a header or body. */
    public static final int MAX_SESSION_ID_LENGTH = 200;

    private static final Pattern TRACE_ID_PATTERN = Pattern.compile("^[0-9a-f]{32}$");
    private static final String JSON_CONTENT_TYPE = "application/json";

    private TraceIdentityResolver() {
        // utility class
    }

    /**
     * Reconciles a header-supplied trace id with the ambient one.
     *
     * @param headerValue    raw header value (nullable)
     * @param ambientTraceId trace id of the currently active span (nullable)
     * @return the resolved id plus the rejected header, if any
     */
    public static ResolvedId resolveTraceId(String headerValue, String ambientTraceId) {
        String upstreamRaw = headerValue == null ? "" : headerValue.strip();
        if (!upstreamRaw.isEmpty()) {
            String candidate = upstreamRaw.toLowerCase(Locale.ROOT);
            if (TRACE_ID_PATTERN.matcher(candidate).matches()) {
                return ResolvedId.accepted(candidate);
            }
            return new ResolvedId(normalizeAmbient(ambientTraceId), upstreamRaw);
        }
        return new ResolvedId(normalizeAmbient(ambientTraceId), null);
    }

    /**
     * Validates a session id.
     *
     * @param headerValue raw session value (nullable)
     * @return the accepted session, or the rejected value as upstream raw
     */
    public static ResolvedId resolveSessionId(String headerValue) {
        String upstreamRaw = headerValue == null ? "" : headerValue.strip();
        if (upstreamRaw.isEmpty()) {
            return ResolvedId.none();
        }
        if (upstreamRaw.length() <= MAX_SESSION_ID_LENGTH && isAscii(upstreamRaw)) {
            return ResolvedId.accepted(upstreamRaw);
        }
        return new ResolvedId(null, upstreamRaw);
    }

    /**
     * Reads {@code user_id} and {@code session_id} (falling back to {@code sessionId}) from a
     * JSON object body. Never throws: non-JSON content types, malformed JSON and non-object
     * documents all yield {@link BodyTraceAttributes#none()}.
     *
     * @param body        request body (nullable)
     * @param contentType request content type (nullable)
     */
    public static BodyTraceAttributes extractTraceAttrsFromBody(byte[] body, String contentType) {
        if (body == null || body.length == 0) {
            return BodyTraceAttributes.none();
        }
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).contains(JSON_CONTENT_TYPE)) {
            return BodyTraceAttributes.none();
        }
        Optional<JsonNode> parsed = ObservabilityJson.tryParse(body);
        if (parsed.isEmpty() || !parsed.get().isObject()) {
            return BodyTraceAttributes.none();
        }
        JsonNode payload = parsed.get();
        String userId = stringify(payload.get("user_id"));
        String sessionId = stringify(payload.get("session_id"));
        if (sessionId == null) {
            sessionId = stringify(payload.get("sessionId"));
        }
        return new BodyTraceAttributes(userId, sessionId);
    }

    /**
     * Shortcut returning only the body's {@code user_id}.
     */
    public static String extractUserIdFromBody(byte[] body, String contentType) {
        return extractTraceAttrsFromBody(body, contentType).userId();
    }

    private static String normalizeAmbient(String ambientTraceId) {
        String normalized = ambientTraceId == null ? "" : ambientTraceId.strip();
        return normalized.isEmpty() ? null : normalized.toLowerCase(Locale.ROOT);
    }

    private static String stringify(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return node.toString();
    }

    private static boolean isAscii(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) > 0x7F) {
                return false;
            }
        }
        return true;
    }
}
