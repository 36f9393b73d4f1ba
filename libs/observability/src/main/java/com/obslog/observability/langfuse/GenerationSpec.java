package com.obslog.observability.langfuse;

import java.util.Map;

/**
 * Description of a Langfuse "generation" observation (one LLM call).
 *
 * @param name            observation name
 * @param model           model identifier as sent to the provider
 * @param input           call input, usually {@code {"messages": [...]}}
 * @param modelParameters allow-listed sampling/timeout parameters, null when none
 * @param metadata        extra metadata, null when none
 */
public record GenerationSpec(
        String name,
        String model,
        Object input,
        Map<String, Object> modelParameters,
        Map<String, Object> metadata
) {

    public GenerationSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
    }
}
