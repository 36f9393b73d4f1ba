package com.obslog.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.slf4j.MDC;

/**
 * SLF4J MDC bridge for the current OpenTelemetry span.
 * <p>
 * While a {@link Binding} is open, every log statement on this thread carries {@value #MDC_TRACE_ID}
 * and {@value #MDC_SPAN_ID}, so plain log patterns such as
 * {@code %d %-5level %logger - %msg trace_id=%X{trace_id} span_id=%X{span_id}%n} correlate with
 * traces. Closing the binding restores whatever values were present before, which keeps nested
 * bindings (filter inside filter) consistent.
 */
public final class TraceLogContext {

    /** MDC key for the 32-hex trace id. */
    public static final String MDC_TRACE_ID = "trace_id";

    /** MDC key for the 16-hex span id. */
    public static final String MDC_SPAN_ID = "span_id";

    private TraceLogContext() {
        // Utility class: no instantiation
    }

    /**
     * Populates the MDC from the given span. Invalid span contexts bind nothing.
     *
     * @param span the span whose ids should appear in log lines
     * @return a binding restoring the previous MDC values on close
     */
    public static Binding bind(Span span) {
        String previousTraceId = MDC.get(MDC_TRACE_ID);
        String previousSpanId = MDC.get(MDC_SPAN_ID);
        SpanContext spanContext = span == null ? SpanContext.getInvalid() : span.getSpanContext();
        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        }
        return new Binding(previousTraceId, previousSpanId);
    }

    /**
     * Restores the MDC values captured when the binding was opened.
     */
    public static final class Binding implements AutoCloseable {

        private final String previousTraceId;
        private final String previousSpanId;

        private Binding(String previousTraceId, String previousSpanId) {
            this.previousTraceId = previousTraceId;
            this.previousSpanId = previousSpanId;
        }

        @Override
        public void close() {
            restore(MDC_TRACE_ID, previousTraceId);
            restore(MDC_SPAN_ID, previousSpanId);
        }

        private static void restore(String key, String value) {
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        }
    }
}
