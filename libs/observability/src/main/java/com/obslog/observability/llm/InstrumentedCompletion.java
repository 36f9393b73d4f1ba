package com.obslog.observability.llm;

import com.obslog.observability.OtelContexts;
import com.obslog.observability.langfuse.GenerationSpec;
import com.obslog.observability.langfuse.LangfuseClientRegistry;
import com.obslog.observability.langfuse.LangfuseHandle;
import com.obslog.observability.langfuse.LangfuseObservation;
import com.obslog.observability.langfuse.LangfuseSettings;
import com.obslog.observability.langfuse.ObservationUpdate;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Wraps a {@link CompletionClient} so every call is recorded as a Langfuse generation.
 * <p>
 * When Langfuse is disabled the call goes straight through. Otherwise a generation carrying the
 * model, the input messages and an allow-listed subset of the call parameters is opened around
 * the call; the API key never reaches it. The primary OTel span current at call time stays the
 * parent of anything the client instruments. Failures to update the generation are logged and
 * never affect the call's outcome; failures of the call itself are recorded and rethrown.
 */
public final class InstrumentedCompletion {

    /** Call parameters copied into the generation's model parameters. */
    public static final List<String> MODEL_PARAMETER_KEYS = List.of(
            "temperature",
            "top_p",
            "max_tokens",
            "max_completion_tokens",
            "timeout",
            "presence_penalty",
            "frequency_penalty",
            "seed",
            "response_format",
            "extra_body"
    );

    static final String BASE_URL_METADATA_KEY = "llm.base_url";

    private static final Logger log = LoggerFactory.getLogger(InstrumentedCompletion.class);

    private final CompletionClient client;
    private final Supplier<LangfuseHandle> langfuse;

    /**
     * Instruments calls with the client the registry holds for the given settings.
     */
    public InstrumentedCompletion(CompletionClient client, LangfuseClientRegistry registry, LangfuseSettings settings) {
        this(client, supplierOf(registry, settings));
    }

    /**
     * Instruments calls with a fixed handle.
     */
    public InstrumentedCompletion(CompletionClient client, LangfuseHandle handle) {
        this(client, supplierOf(handle));
    }

    private InstrumentedCompletion(CompletionClient client, Supplier<LangfuseHandle> langfuse) {
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        this.client = client;
        this.langfuse = langfuse;
    }

    /**
     * Performs the call inside a Langfuse generation.
     *
     * @param name    generation name
     * @param request the call
     * @return the provider's response
     * @throws CompletionCallException when the call fails, after the generation was marked as failed
     */
    public ChatCompletion complete(String name, CompletionRequest request) throws CompletionCallException {
        if (!(langfuse.get() instanceof LangfuseHandle.Active active)) {
            return client.complete(request);
        }

        Span parentSpan = Span.current();
        LangfuseObservation generation;
        try {
            generation = active.client().startGeneration(generationSpec(name, request));
        } catch (RuntimeException e) {
            log.warn("Langfuse generation could not be started: {}", e.getMessage(), e);
            return client.complete(request);
        }

        try (generation) {
            ChatCompletion response;
            try (Scope ignored = OtelContexts.preserveParentSpan(parentSpan)) {
                response = client.complete(request);
            } catch (CompletionCallException | RuntimeException e) {
                markFailed(generation, e);
                throw e;
            }
            recordOutput(generation, response);
            return response;
        }
    }

    /**
     * Allow-listed parameters: JSON-native values are kept, anything else is stringified.
     */
    static Map<String, Object> modelParameters(Map<String, Object> parameters) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String key : MODEL_PARAMETER_KEYS) {
            if (!parameters.containsKey(key)) {
                continue;
            }
            out.put(key, jsonSafe(parameters.get(key)));
        }
        return out;
    }

    static Object jsonSafe(Object value) {
        if (value == null
                || value instanceof Boolean
                || value instanceof Number
                || value instanceof String
                || value instanceof List<?>
                || value instanceof Map<?, ?>) {
            return value;
        }
        return value.toString();
    }

    static Map<String, Object> output(ChatCompletion response) {
        if (response == null) {
            return Map.of("raw", "null");
        }
        return Map.of("content", response.content());
    }

    private static GenerationSpec generationSpec(String name, CompletionRequest request) {
        Map<String, Object> modelParameters = modelParameters(request.parameters());
        Map<String, Object> metadata = null;
        if (request.baseUrl() != null) {
            metadata = Map.of(BASE_URL_METADATA_KEY, request.baseUrl());
        }
        return new GenerationSpec(
                name,
                request.model(),
                Map.of("messages", request.messages()),
                modelParameters.isEmpty() ? null : modelParameters,
                metadata
        );
    }

    private static void markFailed(LangfuseObservation generation, Exception error) {
        try {
            generation.update(ObservationUpdate.error(Objects.toString(error.getMessage(), "")));
        } catch (RuntimeException e) {
            log.warn("Langfuse generation update failed: {}", e.getMessage(), e);
        }
    }

    private static void recordOutput(LangfuseObservation generation, ChatCompletion response) {
        Map<String, Integer> usage = response != null && response.usage() != null
                ? response.usage().toDetails()
                : null;
        try {
            generation.update(ObservationUpdate.output(output(response), usage));
        } catch (RuntimeException e) {
            log.warn("Langfuse generation update failed: {}", e.getMessage(), e);
        }
    }

    private static Supplier<LangfuseHandle> supplierOf(LangfuseClientRegistry registry, LangfuseSettings settings) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        return () -> registry.get(settings);
    }

    private static Supplier<LangfuseHandle> supplierOf(LangfuseHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle must not be null");
        }
        return () -> handle;
    }
}
