package com.obslog.observability;

/**
 * Attribute names shared by the span helpers and the filters.
 */
public final class SpanAttrKeys {

    public static final String DURATION_MS = "duration_ms";
    public static final String ERROR_CODE = "error_code";
    public static final String ERROR_MESSAGE = "error_message";

    public static final String DEPENDENCY_TYPE = "dependency.type";
    public static final String DEPENDENCY_NAME = "dependency.name";
    public static final String DEPENDENCY_WEBSITE = "dependency.website";
    public static final String DEPENDENCY_DURATION_MS = "dependency.duration_ms";

    public static final String HTTP_METHOD = "http.method";
    public static final String HTTP_TARGET = "http.target";
    public static final String HTTP_STATUS_CODE = "http.status_code";
    public static final String HTTP_SERVER_DURATION_MS = "http.server_duration_ms";

    public static final String REQUEST_BODY_SIZE = "http_request_body_size";
    public static final String REQUEST_BODY_PREVIEW = "http_request_body_preview";
    public static final String REQUEST_BODY_PREVIEW_TRUNCATED = "http_request_body_preview_truncated";
    public static final String RESPONSE_BODY_SIZE = "http_response_body_size";
    public static final String RESPONSE_BODY_PREVIEW = "http_response_body_preview";
    public static final String RESPONSE_BODY_PREVIEW_TRUNCATED = "http_response_body_preview_truncated";

    public static final String LLM_MODEL = "llm.model";
    public static final String LLM_DURATION_MS = "llm.duration_ms";
    public static final String LLM_OUTPUT_LENGTH = "llm.output_length";
    public static final String APP_USER_ID = "app.user_id";
    public static final String APP_SESSION_ID = "app.session_id";

    private SpanAttrKeys() {
    }
}
