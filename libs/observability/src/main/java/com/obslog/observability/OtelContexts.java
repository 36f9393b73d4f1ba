package com.obslog.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;

import java.util.Optional;

/**
 * Scoped access to the ambient OpenTelemetry context.
 * <p>
 * All reads go through {@link Span#current()} and all writes return a {@link Scope} that must
 * be closed by the caller, so the thread-local context always unwinds in the order it was
 * entered.
 */
public final class OtelContexts {

    private OtelContexts() {
        // utility class
    }

    /**
     * Returns the 32-hex trace id of the current span, if its context is valid.
     */
    public static Optional<String> currentTraceId() {
        SpanContext spanContext = Span.current().getSpanContext();
        return spanContext.isValid() ? Optional.of(spanContext.getTraceId()) : Optional.empty();
    }

    /**
     * Returns the 16-hex span id of the current span, if its context is valid.
     */
    public static Optional<String> currentSpanId() {
        SpanContext spanContext = Span.current().getSpanContext();
        return spanContext.isValid() ? Optional.of(spanContext.getSpanId()) : Optional.empty();
    }

    /**
     * Makes {@code parentSpan} the current span for the returned scope while keeping every
     * other context value (Langfuse observation, baggage) intact.
     * <p>
     * Used around downstream calls made inside a Langfuse observation: the observation is
     * current in the OTel context as well, so without this scope the primary tracer would
     * parent new spans under the secondary backend's span.
     *
     * @param parentSpan the span to restore, null for the span current at call time
     * @return the scope to close when the downstream call returns
     */
    public static Scope preserveParentSpan(Span parentSpan) {
        Span base = parentSpan != null ? parentSpan : Span.current();
        return Context.current().with(base).makeCurrent();
    }
}
