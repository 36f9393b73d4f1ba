package com.obslog.observability.llm;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Chat completion response in OpenAI wire format (only the fields the instrumentation reads).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletion(
        String id,
        String model,
        List<Choice> choices,
        Usage usage
) {

    public ChatCompletion {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    /**
     * Text of the first choice's message, or an empty string.
     */
    @JsonIgnore
    public String content() {
        if (choices.isEmpty()) {
            return "";
        }
        Choice first = choices.get(0);
        if (first == null || first.message() == null || first.message().content() == null) {
            return "";
        }
        return first.message().content();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Choice(
            Integer index,
            ChatMessage message,
            @JsonProperty("finish_reason") String finishReason
    ) {
    }
}
