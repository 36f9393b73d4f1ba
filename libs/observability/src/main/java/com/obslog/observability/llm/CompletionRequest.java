package com.obslog.observability.llm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One chat completion call.
 *
 * @param model      model identifier understood by the provider
 * @param messages   conversation sent to the model
 * @param parameters extra call parameters ({@code temperature}, {@code max_tokens}, {@code timeout}
 *                   in seconds, ...), serialized into the request body as-is
 * @param baseUrl    provider base URL, null for the client's default
 * @param apiKey     provider API key, null for the client's default; never recorded in telemetry
 */
public record CompletionRequest(
        String model,
        List<ChatMessage> messages,
        Map<String, Object> parameters,
        String baseUrl,
        String apiKey
) {

    /** Parameter name that is never forwarded into telemetry or the request body. */
    public static final String API_KEY_PARAMETER = "api_key";

    public CompletionRequest {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be null or blank");
        }
        messages = messages == null ? List.of() : List.copyOf(messages);
        // LinkedHashMap keeps caller order and tolerates null values
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static CompletionRequest of(String model, List<ChatMessage> messages) {
        return new CompletionRequest(model, messages, null, null, null);
    }

    public CompletionRequest withParameters(Map<String, Object> parameters) {
        return new CompletionRequest(model, messages, parameters, baseUrl, apiKey);
    }

    public CompletionRequest withParameter(String name, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(parameters);
        merged.put(name, value);
        return new CompletionRequest(model, messages, merged, baseUrl, apiKey);
    }

    public CompletionRequest withBaseUrl(String baseUrl) {
        return new CompletionRequest(model, messages, parameters, baseUrl, apiKey);
    }

    public CompletionRequest withApiKey(String apiKey) {
        return new CompletionRequest(model, messages, parameters, baseUrl, apiKey);
    }

    @Override
    public String toString() {
        return "CompletionRequest[model=" + model
                + ", messages=" + messages.size()
                + ", parameters=" + parameters.keySet()
                + ", baseUrl=" + baseUrl
                + ", apiKey=" + (apiKey == null ? "null" : "***") + "]";
    }
}
