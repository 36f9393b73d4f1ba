package com.obslog.observability.llm;

import com.obslog.observability.BodyPreview;
import com.obslog.observability.BodyPreviewCodec;
import com.obslog.observability.SpanAttrKeys;
import com.obslog.observability.SpanOps;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Scope;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * High-level LLM call wrapper: a primary OTel span around an {@link InstrumentedCompletion}.
 * <p>
 * The span carries the model, user and session ids, caller attributes, bounded JSON previews
 * of the request and the response, the call duration and the output length. Business code
 * only builds an {@link ObservedCall}.
 */
public final class ObservedCompletion {

    private final OpenTelemetry openTelemetry;
    private final InstrumentedCompletion completion;

    public ObservedCompletion(OpenTelemetry openTelemetry, InstrumentedCompletion completion) {
        if (openTelemetry == null) {
            throw new IllegalArgumentException("openTelemetry must not be null");
        }
        if (completion == null) {
            throw new IllegalArgumentException("completion must not be null");
        }
        this.openTelemetry = openTelemetry;
        this.completion = completion;
    }

    /**
     * Performs the call inside a new span.
     *
     * @throws CompletionCallException when the call fails, after the span was marked as failed
     */
    public ChatCompletion complete(ObservedCall call) throws CompletionCallException {
        Span span = openTelemetry.getTracer(call.tracerName())
                .spanBuilder(call.spanName())
                .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            CompletionRequest request = call.request();
            span.setAttribute(SpanAttrKeys.LLM_MODEL, request.model());
            if (call.userId() != null && !call.userId().isEmpty()) {
                span.setAttribute(SpanAttrKeys.APP_USER_ID, call.userId());
            }
            if (call.sessionId() != null && !call.sessionId().isEmpty()) {
                span.setAttribute(SpanAttrKeys.APP_SESSION_ID, call.sessionId());
            }
            SpanOps.setSpanAttrs(span, call.extraSpanAttrs());

            Map<String, Object> payload = call.requestPayload() == null || call.requestPayload().isEmpty()
                    ? defaultRequestPayload(request)
                    : call.requestPayload();
            BodyPreview requestPreview = BodyPreviewCodec.previewJson(payload, call.previewMaxBytes());
            span.setAttribute(SpanAttrKeys.REQUEST_BODY_PREVIEW, requestPreview.text());
            span.setAttribute(SpanAttrKeys.REQUEST_BODY_PREVIEW_TRUNCATED, requestPreview.truncated());
            span.setAttribute(SpanAttrKeys.REQUEST_BODY_SIZE, (long) requestPreview.size());

            long start = System.nanoTime();
            ChatCompletion response;
            try {
                response = completion.complete(call.generationName(), request);
            } catch (CompletionCallException | RuntimeException e) {
                span.recordException(e);
                span.setStatus(StatusCode.ERROR, Objects.toString(e.getMessage(), ""));
                throw e;
            }
            SpanOps.of(span).durationMs((System.nanoTime() - start) / 1_000_000.0d, SpanAttrKeys.LLM_DURATION_MS);

            BodyPreview responsePreview = BodyPreviewCodec.previewJson(response, call.previewMaxBytes());
            span.setAttribute(SpanAttrKeys.RESPONSE_BODY_PREVIEW, responsePreview.text());
            span.setAttribute(SpanAttrKeys.RESPONSE_BODY_PREVIEW_TRUNCATED, responsePreview.truncated());
            span.setAttribute(SpanAttrKeys.RESPONSE_BODY_SIZE, (long) responsePreview.size());
            if (response != null) {
                span.setAttribute(SpanAttrKeys.LLM_OUTPUT_LENGTH, (long) response.content().length());
            }
            return response;
        } finally {
            span.end();
        }
    }

    /**
     * {@code {model, messages, ...parameters}} without the API key and without null parameters.
     */
    static Map<String, Object> defaultRequestPayload(CompletionRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("messages", request.messages());
        request.parameters().forEach((key, value) -> {
            if (CompletionRequest.API_KEY_PARAMETER.equals(key) || value == null) {
                return;
            }
            payload.put(key, InstrumentedCompletion.jsonSafe(value));
        });
        return payload;
    }
}
