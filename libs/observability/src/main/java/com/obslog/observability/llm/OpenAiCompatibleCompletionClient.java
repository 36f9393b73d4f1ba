package com.obslog.observability.llm;

import com.obslog.observability.ObservabilityJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link CompletionClient} for any OpenAI-compatible {@code POST /chat/completions} endpoint
 * (OpenAI, OpenRouter, LiteLLM proxy, vLLM, ...).
 * <p>
 * The request's base URL and API key override the client defaults. The {@code timeout}
 * parameter (seconds) bounds the HTTP exchange and is not sent to the provider; every other
 * parameter except {@code api_key} is merged into the JSON body.
 */
public final class OpenAiCompatibleCompletionClient implements CompletionClient {

    static final String TIMEOUT_PARAMETER = "timeout";
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleCompletionClient.class);
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final HttpClient httpClient;
    private final String defaultBaseUrl;
    private final String defaultApiKey;
    private final Map<String, String> extraHeaders;

    public OpenAiCompatibleCompletionClient(String defaultBaseUrl, String defaultApiKey) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build(),
                defaultBaseUrl, defaultApiKey, Map.of());
    }

    /**
     * @param httpClient     client used for every call
     * @param defaultBaseUrl base URL when the request has none, e.g. {@code https://api.openai.com/v1}
     * @param defaultApiKey  API key when the request has none (nullable)
     * @param extraHeaders   headers sent with every call, e.g. {@link TraceHeaders#build}
     */
    public OpenAiCompatibleCompletionClient(HttpClient httpClient, String defaultBaseUrl, String defaultApiKey,
                                            Map<String, String> extraHeaders) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient must not be null");
        }
        this.httpClient = httpClient;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultApiKey = defaultApiKey;
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
    }

    @Override
    public ChatCompletion complete(CompletionRequest request) throws CompletionCallException {
        String url = chatCompletionsUrl(request.baseUrl() != null ? request.baseUrl() : defaultBaseUrl);
        String apiKey = request.apiKey() != null ? request.apiKey() : defaultApiKey;

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout(request.parameters().get(TIMEOUT_PARAMETER)))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(ObservabilityJson.writeBytes(requestBody(request))));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        extraHeaders.forEach(builder::header);

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionCallException("chat completion interrupted (model=" + request.model() + ")", e);
        } catch (IOException e) {
            throw new CompletionCallException("chat completion failed (model=" + request.model()
                    + ", error=" + e.getMessage() + ")", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String detail = "chat completion failed (http=" + status
                    + ", model=" + request.model()
                    + ", error=" + shorten(response.body()) + ")";
            log.warn(detail);
            throw new CompletionCallException(detail, status);
        }
        try {
            return ObservabilityJson.objectMapper().readValue(response.body(), ChatCompletion.class);
        } catch (IOException e) {
            throw new CompletionCallException("chat completion response is not valid JSON (model="
                    + request.model() + ")", e);
        }
    }

    static String chatCompletionsUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be null or blank");
        }
        String base = baseUrl.strip();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base.endsWith("/chat/completions") ? base : base + "/chat/completions";
    }

    static Map<String, Object> requestBody(CompletionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.model());
        body.put("messages", request.messages());
        request.parameters().forEach((key, value) -> {
            if (CompletionRequest.API_KEY_PARAMETER.equals(key) || TIMEOUT_PARAMETER.equals(key) || value == null) {
                return;
            }
            body.put(key, value);
        });
        return body;
    }

    static Duration timeout(Object raw) {
        if (raw instanceof Number seconds && seconds.doubleValue() > 0) {
            return Duration.ofMillis(Math.round(seconds.doubleValue() * 1000.0d));
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                double seconds = Double.parseDouble(text.strip());
                if (seconds > 0) {
                    return Duration.ofMillis(Math.round(seconds * 1000.0d));
                }
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric timeout parameter '{}'", text);
            }
        }
        return DEFAULT_TIMEOUT;
    }

    private static String shorten(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_ERROR_BODY_CHARS ? text : text.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }
}
