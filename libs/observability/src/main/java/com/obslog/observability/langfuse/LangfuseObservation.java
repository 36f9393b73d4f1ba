package com.obslog.observability.langfuse;

/**
 * An open Langfuse span or generation. Opening makes it current; {@link #close()} ends it and
 * restores the previous context, so observations must be used with try-with-resources on the
 * thread that opened them.
 */
public interface LangfuseObservation extends AutoCloseable {

    /** Trace the observation belongs to (32 hex). */
    String traceId();

    /** Observation id (16 hex). */
    String observationId();

    /**
     * Applies a partial update.
     */
    void update(ObservationUpdate update);

    /**
     * Sets trace-level user and session attributes on this observation; observations opened
     * inside it inherit them. Null arguments are ignored.
     */
    void setTraceAttributes(String userId, String sessionId);

    @Override
    void close();
}
