package com.obslog.observability.langfuse;

/**
 * Severity of a Langfuse observation.
 */
public enum ObservationLevel {
    DEBUG,
    DEFAULT,
    WARNING,
    ERROR
}
