package com.obslog.observability.llm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the identity headers forwarded to downstream LLM gateways.
 */
public final class TraceHeaders {

    public static final String USER_ID_HEADER = "X-User-ID";
    public static final String UUID_HEADER = "X-UUID";
    public static final String SESSION_ID_HEADER = "X-Session-ID";

    /** Fixed value sent in {@value #UUID_HEADER}; gateways only check that it is present. */
    public static final String DEFAULT_TRACE_UUID = "123e4567-e89b-12d3-a456-426614174000";

    private TraceHeaders() {
        // utility class
    }

    /**
     * Returns the headers for the given identity. {@value #UUID_HEADER} is only sent alongside a
     * user id. Null or empty ids are skipped.
     */
    public static Map<String, String> build(String userId, String sessionId, boolean includeUuid) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (userId != null && !userId.isEmpty()) {
            headers.put(USER_ID_HEADER, userId);
            if (includeUuid) {
                headers.put(UUID_HEADER, DEFAULT_TRACE_UUID);
            }
        }
        if (sessionId != null && !sessionId.isEmpty()) {
            headers.put(SESSION_ID_HEADER, sessionId);
        }
        return Collections.unmodifiableMap(headers);
    }

    public static Map<String, String> build(String userId, String sessionId) {
        return build(userId, sessionId, true);
    }
}
