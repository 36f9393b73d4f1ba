package com.obslog.observability.web.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Header names read by the Langfuse request filter, bound from {@code obslog.langfuse.*}.
 *
 * @param traceHeader header carrying an upstream 32-hex trace id (default {@code X-Trace-Id})
 * @param sessionHeader header carrying the session id (default {@code X-Session-Id})
 */
@ConfigurationProperties(prefix = "obslog.langfuse")
public record LangfuseTracingProperties(String traceHeader, String sessionHeader) {

    public static final String DEFAULT_TRACE_HEADER = "X-Trace-Id";
    public static final String DEFAULT_SESSION_HEADER = "X-Session-Id";

    public LangfuseTracingProperties {
        if (traceHeader == null || traceHeader.isBlank()) {
            traceHeader = DEFAULT_TRACE_HEADER;
        }
        if (sessionHeader == null || sessionHeader.isBlank()) {
            sessionHeader = DEFAULT_SESSION_HEADER;
        }
    }

    public static LangfuseTracingProperties defaults() {
        return new LangfuseTracingProperties(null, null);
    }
}
