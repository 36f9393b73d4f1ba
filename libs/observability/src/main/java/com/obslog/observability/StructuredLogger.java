package com.obslog.observability;

import org.slf4j.Logger;
import org.slf4j.event.Level;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Writes one JSON object per log call through an SLF4J {@link Logger}.
 * <p>
 * Every line carries {@code application_name}, {@code method_name}, {@code detail},
 * {@code time} (ISO-8601, UTC) and {@code level}, plus {@code trace_id}/{@code span_id} when a
 * valid span is current, followed by the caller's fields:
 * <pre>
 * {"application_name":"mail-api","method_name":"http.request","detail":"incoming request handled",
 *  "time":"2026-01-05T10:15:30.120Z","level":"info","trace_id":"4bf9...","span_id":"00f0...",
 *  "http_status":200}
 * </pre>
 */
public final class StructuredLogger {

    /** Environment variable consulted for the default application name. */
    public static final String SERVICE_NAME_ENV = "OTEL_SERVICE_NAME";

    /** Application name used when nothing is configured. */
    public static final String DEFAULT_APPLICATION_NAME = "unknown_service";

    private final Logger delegate;
    private final String applicationName;
    private final Clock clock;

    /**
     * Creates a structured logger.
     *
     * @param delegate        SLF4J logger receiving the serialized lines
     * @param applicationName value of {@code application_name}, blank for {@link #defaultApplicationName()}
     */
    public StructuredLogger(Logger delegate, String applicationName) {
        this(delegate, applicationName, Clock.systemUTC());
    }

    StructuredLogger(Logger delegate, String applicationName, Clock clock) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        this.delegate = delegate;
        this.applicationName = applicationName == null || applicationName.isBlank()
                ? defaultApplicationName()
                : applicationName;
        this.clock = clock;
    }

    /**
     * Returns {@code OTEL_SERVICE_NAME} when set, otherwise {@value #DEFAULT_APPLICATION_NAME}.
     */
    public static String defaultApplicationName() {
        String fromEnv = System.getenv(SERVICE_NAME_ENV);
        return fromEnv == null || fromEnv.isBlank() ? DEFAULT_APPLICATION_NAME : fromEnv.strip();
    }

    public void info(String methodName, String detail, Map<String, ?> fields) {
        log(Level.INFO, methodName, detail, fields);
    }

    public void warn(String methodName, String detail, Map<String, ?> fields) {
        log(Level.WARN, methodName, detail, fields);
    }

    public void error(String methodName, String detail, Map<String, ?> fields) {
        log(Level.ERROR, methodName, detail, fields);
    }

    /**
     * Serializes the payload and emits it at the given level. TRACE is emitted as DEBUG.
     */
    public void log(Level level, String methodName, String detail, Map<String, ?> fields) {
        Map<String, Object> payload = buildPayload(level, methodName, detail, fields);
        String line = serialize(payload);
        switch (level) {
            case ERROR -> delegate.error(line);
            case WARN -> delegate.warn(line);
            case DEBUG, TRACE -> delegate.debug(line);
            default -> delegate.info(line);
        }
    }

    /**
     * Builds the ordered payload without logging it.
     */
    public Map<String, Object> buildPayload(Level level, String methodName, String detail, Map<String, ?> fields) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("application_name", applicationName);
        payload.put("method_name", methodName);
        payload.put("detail", detail);
        payload.put("time", Instant.now(clock).toString());
        payload.put("level", levelName(level));
        OtelContexts.currentTraceId().ifPresent(traceId -> payload.put("trace_id", traceId));
        OtelContexts.currentSpanId().ifPresent(spanId -> payload.put("span_id", spanId));
        if (fields != null) {
            payload.putAll(fields);
        }
        return payload;
    }

    public String applicationName() {
        return applicationName;
    }

    private static String levelName(Level level) {
        return level.name().toLowerCase(Locale.ROOT);
    }

    private static String serialize(Map<String, Object> payload) {
        try {
            return ObservabilityJson.write(payload);
        } catch (IllegalArgumentException e) {
            // Fall back to string values so a single odd field never drops the whole line
            Map<String, Object> stringified = new LinkedHashMap<>();
            payload.forEach((key, value) -> stringified.put(key, value == null ? null : String.valueOf(value)));
            return ObservabilityJson.write(stringified);
        }
    }
}
