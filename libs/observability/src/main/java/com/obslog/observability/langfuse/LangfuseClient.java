package com.obslog.observability.langfuse;

import java.util.Map;
import java.util.Optional;

/**
 * Capability interface for the Langfuse LLM-observability backend.
 * <p>
 * Implementations track the current observation per thread. Methods acting on "the current"
 * observation are no-ops when none is open.
 */
public interface LangfuseClient extends AutoCloseable {

    /**
     * Opens a span and makes it current.
     *
     * @param name     span name
     * @param traceId  32-hex trace id to bind the span to, null to continue the current trace
     * @param metadata span metadata (nullable)
     */
    LangfuseObservation startSpan(String name, String traceId, Map<String, Object> metadata);

    /**
     * Opens a generation observation and makes it current.
     */
    LangfuseObservation startGeneration(GenerationSpec spec);

    /**
     * Returns the observation opened most recently on this thread and not yet closed.
     */
    Optional<LangfuseObservation> currentObservation();

    /**
     * Sets user and session ids on the current trace.
     */
    default void updateCurrentTrace(String userId, String sessionId) {
        currentObservation().ifPresent(observation -> observation.setTraceAttributes(userId, sessionId));
    }

    /**
     * Applies an update to the current observation.
     */
    default void updateCurrentObservation(ObservationUpdate update) {
        currentObservation().ifPresent(observation -> observation.update(update));
    }

    /**
     * Blocks until buffered observations have been exported.
     */
    void flush();

    /**
     * Flushes and releases exporter resources.
     */
    @Override
    void close();
}
