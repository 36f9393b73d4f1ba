package com.obslog.observability.langfuse;

import com.obslog.observability.ObservabilityJson;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.ContextKey;
import io.opentelemetry.context.Scope;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.IdGenerator;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link LangfuseClient} that records observations as OpenTelemetry spans on a dedicated
 * tracer provider and ships them to Langfuse's OTLP ingestion endpoint
 * ({@code {host}/api/public/otel/v1/traces}, HTTP Basic auth with the project keys).
 * <p>
 * The provider is separate from the application's global one, so Langfuse never receives the
 * service's ordinary spans and the service's collector never receives LLM payloads. The
 * observations do share the thread's OTel {@link Context}: an open observation is the current
 * span, which is why callers restore the primary span with
 * {@link com.obslog.observability.OtelContexts#preserveParentSpan} around downstream work.
 */
public final class OtelLangfuseClient implements LangfuseClient {

    static final String OTLP_TRACES_PATH = "/api/public/otel/v1/traces";

    static final String ATTR_OBSERVATION_TYPE = "langfuse.observation.type";
    static final String ATTR_OBSERVATION_LEVEL = "langfuse.observation.level";
    static final String ATTR_OBSERVATION_STATUS_MESSAGE = "langfuse.observation.status_message";
    static final String ATTR_OBSERVATION_INPUT = "langfuse.observation.input";
    static final String ATTR_OBSERVATION_OUTPUT = "langfuse.observation.output";
    static final String ATTR_OBSERVATION_MODEL = "langfuse.observation.model.name";
    static final String ATTR_OBSERVATION_MODEL_PARAMETERS = "langfuse.observation.model.parameters";
    static final String ATTR_OBSERVATION_USAGE_DETAILS = "langfuse.observation.usage_details";
    static final String ATTR_OBSERVATION_METADATA_PREFIX = "langfuse.observation.metadata.";
    static final String ATTR_AS_ROOT = "langfuse.internal.as_root";
    static final String ATTR_TRACE_USER_ID = "user.id";
    static final String ATTR_TRACE_SESSION_ID = "session.id";

    private static final Logger log = LoggerFactory.getLogger(OtelLangfuseClient.class);
    private static final String INSTRUMENTATION_SCOPE = "obslog-langfuse";
    private static final long FLUSH_TIMEOUT_SECONDS = 10;

    private final SdkTracerProvider tracerProvider;
    private final Tracer tracer;
    private final IdGenerator idGenerator = IdGenerator.random();
    private final ContextKey<OtelObservation> observationKey = ContextKey.named("langfuse-observation");

    /**
     * Creates a client exporting to the Langfuse instance named by the settings.
     *
     * @param settings settings that are {@linkplain LangfuseSettings#isConfiguredForTracing() configured}
     */
    public static OtelLangfuseClient create(LangfuseSettings settings) {
        if (!settings.isConfiguredForTracing()) {
            throw new IllegalArgumentException("Langfuse settings are not configured for tracing: " + settings);
        }
        OtlpHttpSpanExporter exporter = OtlpHttpSpanExporter.builder()
                .setEndpoint(tracesEndpoint(settings.host()))
                .addHeader("Authorization", basicAuth(settings.publicKey(), settings.secretKey()))
                .build();
        return new OtelLangfuseClient(BatchSpanProcessor.builder(exporter).build());
    }

    /**
     * Creates a client around an arbitrary span processor (tests use an in-memory exporter).
     */
    public OtelLangfuseClient(SpanProcessor spanProcessor) {
        if (spanProcessor == null) {
            throw new IllegalArgumentException("spanProcessor must not be null");
        }
        this.tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(spanProcessor)
                .build();
        this.tracer = tracerProvider.get(INSTRUMENTATION_SCOPE);
    }

    @Override
    public LangfuseObservation startSpan(String name, String traceId, Map<String, Object> metadata) {
        Context parent = parentContext(traceId);
        Span span = tracer.spanBuilder(name).setParent(parent).startSpan();
        span.setAttribute(ATTR_OBSERVATION_TYPE, "span");
        if (traceId != null) {
            span.setAttribute(ATTR_AS_ROOT, true);
        }
        setMetadata(span, metadata);
        return open(parent, span);
    }

    @Override
    public LangfuseObservation startGeneration(GenerationSpec spec) {
        Context parent = parentContext(null);
        Span span = tracer.spanBuilder(spec.name()).setParent(parent).startSpan();
        span.setAttribute(ATTR_OBSERVATION_TYPE, "generation");
        if (spec.model() != null) {
            span.setAttribute(ATTR_OBSERVATION_MODEL, spec.model());
        }
        if (spec.input() != null) {
            span.setAttribute(ATTR_OBSERVATION_INPUT, ObservabilityJson.write(spec.input()));
        }
        if (spec.modelParameters() != null && !spec.modelParameters().isEmpty()) {
            span.setAttribute(ATTR_OBSERVATION_MODEL_PARAMETERS, ObservabilityJson.write(spec.modelParameters()));
        }
        setMetadata(span, spec.metadata());
        return open(parent, span);
    }

    @Override
    public Optional<LangfuseObservation> currentObservation() {
        return Optional.ofNullable(Context.current().get(observationKey));
    }

    @Override
    public void flush() {
        CompletableResultCode result = tracerProvider.forceFlush().join(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
            throw new IllegalStateException("Langfuse flush did not complete within " + FLUSH_TIMEOUT_SECONDS + "s");
        }
    }

    @Override
    public void close() {
        CompletableResultCode result = tracerProvider.shutdown().join(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
            log.warn("Langfuse tracer provider did not shut down cleanly");
        }
    }

    static String tracesEndpoint(String host) {
        String base = host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
        return base + OTLP_TRACES_PATH;
    }

    static String basicAuth(String publicKey, String secretKey) {
        String credentials = publicKey + ":" + secretKey;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Parent for a new observation: a remote span context carrying the requested trace id, else
     * the current observation, else whatever span is current.
     */
    private Context parentContext(String traceId) {
        Context current = Context.current();
        if (traceId != null) {
            SpanContext remoteParent = SpanContext.createFromRemoteParent(
                    traceId, idGenerator.generateSpanId(), TraceFlags.getSampled(), TraceState.getDefault());
            return current.with(Span.wrap(remoteParent));
        }
        OtelObservation enclosing = current.get(observationKey);
        return enclosing != null ? current.with(enclosing.span) : current;
    }

    private LangfuseObservation open(Context parent, Span span) {
        OtelObservation enclosing = parent.get(observationKey);
        OtelObservation observation = new OtelObservation(span);
        if (enclosing != null) {
            observation.setTraceAttributes(enclosing.userId, enclosing.sessionId);
        }
        observation.scope = parent.with(span).with(observationKey, observation).makeCurrent();
        return observation;
    }

    private static void setMetadata(Span span, Map<String, Object> metadata) {
        if (metadata == null) {
            return;
        }
        metadata.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            String rendered = value instanceof String s ? s : ObservabilityJson.write(value);
            span.setAttribute(ATTR_OBSERVATION_METADATA_PREFIX + key, rendered);
        });
    }

    private static final class OtelObservation implements LangfuseObservation {

        private final Span span;
        private Scope scope;
        private volatile String userId;
        private volatile String sessionId;

        private OtelObservation(Span span) {
            this.span = span;
        }

        @Override
        public String traceId() {
            return span.getSpanContext().getTraceId();
        }

        @Override
        public String observationId() {
            return span.getSpanContext().getSpanId();
        }

        @Override
        public void update(ObservationUpdate update) {
            if (update == null) {
                return;
            }
            if (update.level() != null) {
                span.setAttribute(ATTR_OBSERVATION_LEVEL, update.level().name());
                if (update.level() == ObservationLevel.ERROR) {
                    span.setStatus(StatusCode.ERROR, Objects.toString(update.statusMessage(), ""));
                }
            }
            if (update.statusMessage() != null) {
                span.setAttribute(ATTR_OBSERVATION_STATUS_MESSAGE, update.statusMessage());
            }
            if (update.output() != null) {
                span.setAttribute(ATTR_OBSERVATION_OUTPUT, ObservabilityJson.write(update.output()));
            }
            if (update.usageDetails() != null && !update.usageDetails().isEmpty()) {
                span.setAttribute(ATTR_OBSERVATION_USAGE_DETAILS, ObservabilityJson.write(update.usageDetails()));
            }
            setMetadata(span, update.metadata());
        }

        @Override
        public void setTraceAttributes(String userId, String sessionId) {
            if (userId != null && !userId.isEmpty()) {
                this.userId = userId;
                span.setAttribute(ATTR_TRACE_USER_ID, userId);
            }
            if (sessionId != null && !sessionId.isEmpty()) {
                this.sessionId = sessionId;
                span.setAttribute(ATTR_TRACE_SESSION_ID, sessionId);
            }
        }

        @Override
        public void close() {
            try {
                if (scope != null) {
                    scope.close();
                }
            } finally {
                span.end();
            }
        }
    }
}
