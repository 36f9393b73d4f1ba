package com.obslog.observability.web.config;

import com.obslog.observability.BodyPreviewCodec;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration of the access-log filter, bound from {@code obslog.access-log.*}:
 *
 * <pre>
 * obslog:
 *   access-log:
 *     trace-header-name: X-Trace-Id
 *     body-preview-enabled: true
 *     body-preview-max-bytes: 2048
 *     body-preview-paths: [/api/chat, /api/completions]
 *     redact-keys: [password, token]
 *     log-correlation: true
 * </pre>
 *
 * @param traceHeaderName response header carrying the 32-hex trace id
 * @param bodyPreviewEnabled capture request and response body previews
 * @param bodyPreviewMaxBytes preview byte budget (at least 1)
 * @param bodyPreviewPaths path prefixes eligible for previews; empty means every path
 * @param redactKeys JSON keys to mask in previews; empty means the built-in list
 * @param logCorrelation put {@code trace_id}/{@code span_id} in the SLF4J MDC during requests
 * @param applicationName {@code application_name} of access-log lines; defaults to
 *     {@code OTEL_SERVICE_NAME}
 */
@ConfigurationProperties(prefix = "obslog.access-log")
public record AccessLogProperties(
        String traceHeaderName,
        boolean bodyPreviewEnabled,
        Integer bodyPreviewMaxBytes,
        List<String> bodyPreviewPaths,
        List<String> redactKeys,
        boolean logCorrelation,
        String applicationName) {

    public static final String DEFAULT_TRACE_HEADER_NAME = "X-Trace-Id";

    /** Compact constructor: applies defaults and normalizes the path prefixes. */
    public AccessLogProperties {
        if (traceHeaderName == null || traceHeaderName.isBlank()) {
            traceHeaderName = DEFAULT_TRACE_HEADER_NAME;
        }
        bodyPreviewMaxBytes =
                bodyPreviewMaxBytes == null
                        ? BodyPreviewCodec.DEFAULT_MAX_BYTES
                        : Math.max(bodyPreviewMaxBytes, 1);
        bodyPreviewPaths =
                bodyPreviewPaths == null
                        ? List.of()
                        : bodyPreviewPaths.stream()
                                .filter(path -> path != null && !path.isBlank())
                                .map(String::strip)
                                .toList();
        redactKeys = redactKeys == null ? List.of() : List.copyOf(redactKeys);
    }

    /** Properties with every default applied. */
    public static AccessLogProperties defaults() {
        return new AccessLogProperties(null, false, null, null, null, false, null);
    }

    /**
     * Whether request and response previews are captured for the given path: never when
     * previews are disabled, always when no prefix is configured, otherwise when the path equals
     * or starts with a configured prefix.
     */
    public boolean shouldCapture(String path) {
        if (!bodyPreviewEnabled) {
            return false;
        }
        if (bodyPreviewPaths.isEmpty()) {
            return true;
        }
        String candidate = path == null ? "" : path;
        return bodyPreviewPaths.stream().anyMatch(candidate::startsWith);
    }
}
