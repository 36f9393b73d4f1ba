package com.obslog.observability.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token usage reported by the provider. Every count is optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Usage(
        @JsonProperty("prompt_tokens") Integer promptTokens,
        @JsonProperty("completion_tokens") Integer completionTokens,
        @JsonProperty("total_tokens") Integer totalTokens
) {

    /**
     * Usage details keyed by their wire names, without absent counts; null when all are absent.
     */
    public Map<String, Integer> toDetails() {
        Map<String, Integer> details = new LinkedHashMap<>();
        if (promptTokens != null) {
            details.put("prompt_tokens", promptTokens);
        }
        if (completionTokens != null) {
            details.put("completion_tokens", completionTokens);
        }
        if (totalTokens != null) {
            details.put("total_tokens", totalTokens);
        }
        return details.isEmpty() ? null : details;
    }
}
