package com.obslog.observability.langfuse;

import java.util.Map;

/**
 * Partial update applied to an open observation. Null components are left untouched.
 *
 * @param level         new severity
 * @param statusMessage human-readable status, typically the failure message
 * @param output        observation output (serialized as JSON)
 * @param usageDetails  token counts keyed by {@code prompt_tokens}, {@code completion_tokens},
 *                      {@code total_tokens}
 * @param metadata      extra metadata merged into the observation's metadata
 */
public record ObservationUpdate(
        ObservationLevel level,
        String statusMessage,
        Object output,
        Map<String, Integer> usageDetails,
        Map<String, Object> metadata
) {

    /**
     * Error update carrying the failure message.
     */
    public static ObservationUpdate error(String statusMessage) {
        return new ObservationUpdate(ObservationLevel.ERROR, statusMessage, null, null, null);
    }

    /**
     * Error update carrying the failure message and metadata such as the exception type.
     */
    public static ObservationUpdate error(String statusMessage, Map<String, Object> metadata) {
        return new ObservationUpdate(ObservationLevel.ERROR, statusMessage, null, null, metadata);
    }

    /**
     * Success update with output and optional token usage.
     */
    public static ObservationUpdate output(Object output, Map<String, Integer> usageDetails) {
        return new ObservationUpdate(null, null, output, usageDetails, null);
    }
}
