package com.obslog.observability.web.filter;

import com.obslog.observability.BodyPreview;
import com.obslog.observability.BodyPreviewCodec;
import com.obslog.observability.SpanAttrKeys;
import com.obslog.observability.SpanOps;
import com.obslog.observability.StructuredLogger;
import com.obslog.observability.TraceLogContext;
import com.obslog.observability.web.config.AccessLogProperties;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapPropagator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

/**
 * Servlet filter that wraps every request in a server span and writes one structured access-log
 * line when it completes.
 *
 * <p>When an outer instrumentation layer (the OTel Java agent, Spring's observation filter)
 * already made a server span current, that span is reused so the request is not traced twice.
 * Otherwise the W3C trace context is extracted from the request headers and a new
 * {@link SpanKind#SERVER} span named {@code "{METHOD} {PATH}"} is started.
 *
 * <p>The response carries the trace id in the configured header (default {@code X-Trace-Id}).
 * It is written before the chain runs because the handler may commit the response.
 *
 * <p>When previews are enabled for the path, the request body is buffered once and replayed to
 * the handler, and the response body is buffered, previewed and then copied unchanged to the
 * client. Multipart request bodies are not buffered and get no preview. Handler exceptions are
 * recorded on the span and rethrown; no log line is written for them since the container's
 * error handling produces its own response.
 */
public class TraceAccessLogFilter extends OncePerRequestFilter {

    public static final String TRACER_NAME = "obslog/servlet";
    static final String LOG_METHOD_NAME = "http.request";
    static final String LOG_DETAIL = "incoming request handled";

    private static final TextMapGetter<HttpServletRequest> HEADER_GETTER = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(HttpServletRequest carrier) {
            return Collections.list(carrier.getHeaderNames());
        }

        @Override
        public String get(HttpServletRequest carrier, String key) {
            return carrier == null ? null : carrier.getHeader(key);
        }
    };

    private final Tracer tracer;
    private final TextMapPropagator propagator;
    private final AccessLogProperties properties;
    private final StructuredLogger accessLog;

    public TraceAccessLogFilter(
            OpenTelemetry openTelemetry, AccessLogProperties properties, StructuredLogger accessLog) {
        if (openTelemetry == null) {
            throw new IllegalArgumentException("openTelemetry must not be null");
        }
        if (properties == null) {
            throw new IllegalArgumentException("properties must not be null");
        }
        if (accessLog == null) {
            throw new IllegalArgumentException("accessLog must not be null");
        }
        this.tracer = openTelemetry.getTracer(TRACER_NAME);
        this.propagator = openTelemetry.getPropagators().getTextMapPropagator();
        this.properties = properties;
        this.accessLog = accessLog;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        long start = System.nanoTime();
        String path = request.getRequestURI();
        boolean capture = properties.shouldCapture(path);

        CachedBodyHttpServletRequest cachedRequest = capture && CachedBodyHttpServletRequest.isBufferable(request)
                ? CachedBodyHttpServletRequest.of(request)
                : null;
        ContentCachingResponseWrapper cachedResponse = capture ? new ContentCachingResponseWrapper(response) : null;
        HttpServletRequest requestToUse = cachedRequest != null ? cachedRequest : request;
        HttpServletResponse responseToUse = cachedResponse != null ? cachedResponse : response;

        Span current = Span.current();
        boolean reuse = current.getSpanContext().isValid();
        Span span = reuse ? current : startServerSpan(request, path);

        try (Scope ignored = reuse ? null : span.makeCurrent();
                TraceLogContext.Binding binding = properties.logCorrelation() ? TraceLogContext.bind(span) : null) {
            stampTraceHeader(span.getSpanContext(), response);
            try {
                filterChain.doFilter(requestToUse, responseToUse);
            } catch (IOException | ServletException | RuntimeException | Error e) {
                span.recordException(e);
                span.setStatus(StatusCode.ERROR, Objects.toString(e.getMessage(), ""));
                throw e;
            }
            finish(span, request, responseToUse, start, capture, cachedRequest, cachedResponse);
        } finally {
            if (cachedResponse != null) {
                cachedResponse.copyBodyToResponse();
            }
            if (!reuse) {
                span.end();
            }
        }
    }

    private Span startServerSpan(HttpServletRequest request, String path) {
        Context parent = propagator.extract(Context.current(), request, HEADER_GETTER);
        return tracer.spanBuilder(request.getMethod() + " " + path)
                .setParent(parent)
                .setSpanKind(SpanKind.SERVER)
                .startSpan();
    }

    private void stampTraceHeader(SpanContext spanContext, HttpServletResponse response) {
        if (spanContext.isValid()) {
            response.setHeader(properties.traceHeaderName(), spanContext.getTraceId());
        }
    }

    private void finish(
            Span span,
            HttpServletRequest request,
            HttpServletResponse response,
            long start,
            boolean capture,
            CachedBodyHttpServletRequest cachedRequest,
            ContentCachingResponseWrapper cachedResponse) {
        double durationMs = SpanOps.roundMillis((System.nanoTime() - start) / 1_000_000.0d);
        int status = response.getStatus();
        String path = request.getRequestURI();

        if (status >= 500) {
            span.setStatus(StatusCode.ERROR);
        } else {
            span.setStatus(StatusCode.OK);
        }
        span.setAttribute(SpanAttrKeys.HTTP_METHOD, request.getMethod());
        span.setAttribute(SpanAttrKeys.HTTP_TARGET, path);
        span.setAttribute(SpanAttrKeys.HTTP_STATUS_CODE, (long) status);
        span.setAttribute(SpanAttrKeys.HTTP_SERVER_DURATION_MS, durationMs);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("http_method", request.getMethod());
        fields.put("http_path", path);
        fields.put("http_status", status);
        fields.put("duration_ms", durationMs);
        fields.put("user_agent", Objects.toString(request.getHeader("User-Agent"), ""));

        if (capture) {
            BodyPreview requestPreview = cachedRequest != null
                    ? BodyPreviewCodec.preview(
                            cachedRequest.getCachedBody(), properties.bodyPreviewMaxBytes(), properties.redactKeys())
                    : BodyPreview.empty();
            attachPreview(span, fields, requestPreview,
                    SpanAttrKeys.REQUEST_BODY_SIZE,
                    SpanAttrKeys.REQUEST_BODY_PREVIEW,
                    SpanAttrKeys.REQUEST_BODY_PREVIEW_TRUNCATED);
            BodyPreview responsePreview = BodyPreviewCodec.preview(
                    cachedResponse.getContentAsByteArray(), properties.bodyPreviewMaxBytes(), properties.redactKeys());
            attachPreview(span, fields, responsePreview,
                    SpanAttrKeys.RESPONSE_BODY_SIZE,
                    SpanAttrKeys.RESPONSE_BODY_PREVIEW,
                    SpanAttrKeys.RESPONSE_BODY_PREVIEW_TRUNCATED);
        }

        accessLog.info(LOG_METHOD_NAME, LOG_DETAIL, fields);
    }

    private static void attachPreview(
            Span span,
            Map<String, Object> fields,
            BodyPreview preview,
            String sizeKey,
            String previewKey,
            String truncatedKey) {
        if (preview.size() > 0) {
            fields.put(sizeKey, preview.size());
            span.setAttribute(sizeKey, (long) preview.size());
        }
        if (preview.hasText()) {
            fields.put(previewKey, preview.text());
            span.setAttribute(previewKey, preview.text());
        }
        if (preview.truncated()) {
            fields.put(truncatedKey, true);
            span.setAttribute(truncatedKey, true);
        }
    }
}
