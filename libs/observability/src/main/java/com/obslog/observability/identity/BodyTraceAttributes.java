package com.obslog.observability.identity;

/**
 * User and session identifiers found in a JSON request body.
 *
 * @param userId    stringified {@code user_id}, null when absent
 * @param sessionId stringified {@code session_id} (or {@code sessionId}), null when absent
 */
public record BodyTraceAttributes(String userId, String sessionId) {

    private static final BodyTraceAttributes NONE = new BodyTraceAttributes(null, null);

    public static BodyTraceAttributes none() {
        return NONE;
    }
}
