package com.obslog.observability.web.filter;

import com.obslog.observability.OtelContexts;
import com.obslog.observability.identity.BodyTraceAttributes;
import com.obslog.observability.identity.ResolvedId;
import com.obslog.observability.identity.TraceIdentityResolver;
import com.obslog.observability.langfuse.LangfuseClient;
import com.obslog.observability.langfuse.LangfuseClientRegistry;
import com.obslog.observability.langfuse.LangfuseHandle;
import com.obslog.observability.langfuse.LangfuseObservation;
import com.obslog.observability.langfuse.LangfuseSettings;
import com.obslog.observability.langfuse.ObservationUpdate;
import com.obslog.observability.web.config.LangfuseTracingProperties;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Scope;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that mirrors each request into Langfuse as a span bound to the request's trace
 * id, so LLM generations made while handling it group under one Langfuse trace.
 *
 * <p>The trace id comes from the configured header when it is valid 32-hex, else from the
 * current OTel span. The session id comes from the session header, else from {@code session_id}
 * or {@code sessionId} in a JSON body; the user id comes from {@code user_id} in a JSON body.
 * Bodies are only read for POST, PUT and PATCH and are replayed to the handler. Multipart
 * bodies are left to the container.
 *
 * <p>The Langfuse span is current in the OTel context while it is open, so the primary span
 * captured on entry is restored around the chain. Langfuse calls that only add telemetry never
 * fail the request; handler failures are recorded on the span and rethrown unchanged.
 */
public class LangfuseTraceFilter extends OncePerRequestFilter {

    static final Set<String> WRITE_METHODS = Set.of("POST", "PUT", "PATCH");

    private static final Logger log = LoggerFactory.getLogger(LangfuseTraceFilter.class);

    private final LangfuseClientRegistry registry;
    private final LangfuseSettings settings;
    private final String traceHeader;
    private final String sessionHeader;

    public LangfuseTraceFilter(
            LangfuseClientRegistry registry, LangfuseSettings settings, LangfuseTracingProperties headers) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        LangfuseTracingProperties resolvedHeaders = headers != null ? headers : LangfuseTracingProperties.defaults();
        this.registry = registry;
        this.settings = settings;
        this.traceHeader = resolvedHeaders.traceHeader();
        this.sessionHeader = resolvedHeaders.sessionHeader();
    }

    /**
     * Returns a filter when the settings are configured for tracing, empty otherwise.
     */
    public static Optional<LangfuseTraceFilter> forSettings(
            LangfuseClientRegistry registry, LangfuseSettings settings, LangfuseTracingProperties headers) {
        if (settings == null || !settings.isConfiguredForTracing()) {
            return Optional.empty();
        }
        return Optional.of(new LangfuseTraceFilter(registry, settings, headers));
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (!(registry.get(settings) instanceof LangfuseHandle.Active active)) {
            filterChain.doFilter(request, response);
            return;
        }
        LangfuseClient langfuse = active.client();

        try {
            Span parentSpan = Span.current();
            ResolvedId traceId = TraceIdentityResolver.resolveTraceId(
                    request.getHeader(traceHeader), OtelContexts.currentTraceId().orElse(null));
            ResolvedId sessionId = TraceIdentityResolver.resolveSessionId(request.getHeader(sessionHeader));

            HttpServletRequest requestToUse = request;
            BodyTraceAttributes bodyAttrs = BodyTraceAttributes.none();
            if (WRITE_METHODS.contains(request.getMethod()) && CachedBodyHttpServletRequest.isBufferable(request)) {
                CachedBodyHttpServletRequest cached = CachedBodyHttpServletRequest.of(request);
                requestToUse = cached;
                bodyAttrs = TraceIdentityResolver.extractTraceAttrsFromBody(
                        cached.getCachedBody(), request.getContentType());
            }

            if (!sessionId.isPresent() && bodyAttrs.sessionId() != null && !bodyAttrs.sessionId().isEmpty()) {
                sessionId = TraceIdentityResolver.resolveSessionId(bodyAttrs.sessionId());
            }

            if (!traceId.isPresent()) {
                filterChain.doFilter(requestToUse, response);
                return;
            }

            String path = request.getRequestURI();
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("http.method", request.getMethod());
            metadata.put("http.path", path);
            if (traceId.upstreamRaw() != null) {
                metadata.put("upstream_trace_id_raw", traceId.upstreamRaw());
            }
            if (sessionId.isPresent()) {
                metadata.put("session_id", sessionId.value());
            }
            if (sessionId.upstreamRaw() != null) {
                metadata.put("upstream_session_id_raw", sessionId.upstreamRaw());
            }

            LangfuseObservation span;
            try {
                span = langfuse.startSpan(request.getMethod() + " " + path, traceId.value(), metadata);
            } catch (RuntimeException e) {
                log.warn("Langfuse span could not be started: {}", e.getMessage(), e);
                filterChain.doFilter(requestToUse, response);
                return;
            }

            try (span) {
                setTraceAttributes(langfuse, bodyAttrs.userId(), sessionId.value());
                try (Scope ignored = OtelContexts.preserveParentSpan(parentSpan)) {
                    filterChain.doFilter(requestToUse, response);
                } catch (IOException | ServletException | RuntimeException | Error e) {
                    markFailed(span, e);
                    throw e;
                }
            }
        } finally {
            if (settings.flushAtRequestEnd()) {
                flush(langfuse);
            }
        }
    }

    private static void setTraceAttributes(LangfuseClient langfuse, String userId, String sessionId) {
        if (userId == null && sessionId == null) {
            return;
        }
        try {
            langfuse.updateCurrentTrace(userId, sessionId);
        } catch (RuntimeException e) {
            log.warn("Langfuse trace attribute update failed: {}", e.getMessage(), e);
        }
    }

    private static void markFailed(LangfuseObservation span, Throwable error) {
        try {
            span.update(ObservationUpdate.error(
                    Objects.toString(error.getMessage(), ""),
                    Map.of("exception.type", error.getClass().getSimpleName())));
        } catch (RuntimeException e) {
            log.warn("Langfuse span error update failed: {}", e.getMessage(), e);
        }
    }

    private static void flush(LangfuseClient langfuse) {
        try {
            langfuse.flush();
        } catch (RuntimeException e) {
            log.warn("Langfuse flush failed: {}", e.getMessage(), e);
        }
    }
}
