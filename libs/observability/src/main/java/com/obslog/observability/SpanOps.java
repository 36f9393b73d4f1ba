package com.obslog.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent façade for stamping attributes and status on one OpenTelemetry {@link Span}.
 * <p>
 * Every method mutates the wrapped span and returns this façade; nothing here starts or ends
 * a span. Typical use inside a handler:
 * <pre>{@code
 * SpanOps.of(Span.current())
 *         .attrs(Map.of("order.id", orderId))
 *         .durationMs(elapsed)
 *         .ok();
 * }</pre>
 */
public final class SpanOps {

    private final Span span;

    /**
     * Wraps the given span.
     *
     * @param span the span to decorate (must not be null)
     */
    public SpanOps(Span span) {
        if (span == null) {
            throw new IllegalArgumentException("span must not be null");
        }
        this.span = span;
    }

    public static SpanOps of(Span span) {
        return new SpanOps(span);
    }

    /**
     * Sets all non-null attributes of the map.
     */
    public SpanOps attrs(Map<String, ?> attrs) {
        setSpanAttrs(span, attrs);
        return this;
    }

    /**
     * Sets {@value SpanAttrKeys#DURATION_MS}, rounded to three decimals.
     */
    public SpanOps durationMs(double value) {
        return durationMs(value, SpanAttrKeys.DURATION_MS);
    }

    /**
     * Sets a duration attribute under a custom key, rounded to three decimals.
     */
    public SpanOps durationMs(double value, String key) {
        span.setAttribute(key, roundMillis(value));
        return this;
    }

    public SpanOps ok() {
        span.setStatus(StatusCode.OK);
        return this;
    }

    /**
     * Records the exception on the span and marks it as failed.
     */
    public SpanOps error(Throwable error) {
        return error(error, null, null);
    }

    /**
     * Records the exception, sets ERROR status and the error code/message attributes. The
     * message attribute falls back to the exception's message.
     *
     * @param error        the failure (must not be null)
     * @param errorCode    optional application error code
     * @param errorMessage optional message overriding the exception's
     */
    public SpanOps error(Throwable error, String errorCode, String errorMessage) {
        span.recordException(error);
        return markError(Objects.toString(error.getMessage(), ""), errorCode, errorMessage);
    }

    /**
     * Marks the span as failed without an exception object.
     */
    public SpanOps error(String message, String errorCode, String errorMessage) {
        return markError(Objects.toString(message, ""), errorCode, errorMessage);
    }

    /** Returns the underlying span. */
    public Span span() {
        return span;
    }

    /**
     * Sets every non-null entry as a typed attribute: strings, booleans, integral numbers and
     * floating numbers keep their type, anything else is stringified.
     */
    public static void setSpanAttrs(Span span, Map<String, ?> attrs) {
        if (attrs == null) {
            return;
        }
        attrs.forEach((key, value) -> setAttribute(span, key, value));
    }

    /**
     * Tags the span as an outbound HTTP dependency call.
     *
     * @param span       target span
     * @param name       dependency name (e.g. "payments-api")
     * @param website    optional base URL of the dependency
     * @param durationMs optional call duration
     */
    public static void setDependencyHttpAttrs(Span span, String name, String website, Double durationMs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(SpanAttrKeys.DEPENDENCY_TYPE, "http");
        payload.put(SpanAttrKeys.DEPENDENCY_NAME, name);
        if (website != null && !website.isEmpty()) {
            payload.put(SpanAttrKeys.DEPENDENCY_WEBSITE, website);
        }
        if (durationMs != null) {
            payload.put(SpanAttrKeys.DEPENDENCY_DURATION_MS, roundMillis(durationMs));
        }
        setSpanAttrs(span, payload);
    }

    /**
     * Rounds a millisecond value to three decimals.
     */
    public static double roundMillis(double value) {
        return Math.round(value * 1000.0d) / 1000.0d;
    }

    private SpanOps markError(String defaultMessage, String errorCode, String errorMessage) {
        span.setStatus(StatusCode.ERROR, defaultMessage);
        Map<String, Object> payload = new LinkedHashMap<>();
        if (errorCode != null && !errorCode.isEmpty()) {
            payload.put(SpanAttrKeys.ERROR_CODE, errorCode);
        }
        String resolvedMessage = errorMessage != null && !errorMessage.isEmpty() ? errorMessage : defaultMessage;
        if (!resolvedMessage.isEmpty()) {
            payload.put(SpanAttrKeys.ERROR_MESSAGE, resolvedMessage);
        }
        setSpanAttrs(span, payload);
        return this;
    }

    private static void setAttribute(Span span, String key, Object value) {
        if (key == null || value == null) {
            return;
        }
        if (value instanceof String s) {
            span.setAttribute(key, s);
        } else if (value instanceof Boolean b) {
            span.setAttribute(key, b);
        } else if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            span.setAttribute(key, ((Number) value).doubleValue());
        } else if (value instanceof Number n) {
            span.setAttribute(key, n.longValue());
        } else {
            span.setAttribute(key, value.toString());
        }
    }
}
