package com.obslog.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;

import java.util.Map;
import java.util.function.Function;

/**
 * One-time OpenTelemetry SDK setup for services that are not run under the Java agent.
 * <p>
 * Reads {@code OTEL_EXPORTER_OTLP_ENDPOINT} (scheme decides TLS: {@code https://} is secure,
 * {@code http://} or no scheme is plaintext) and {@code OTEL_SERVICE_NAME}, builds a tracer
 * provider with a batching OTLP/gRPC exporter and registers it globally. Repeated calls return
 * the instance created by the first one; if something else already registered a global SDK,
 * that instance is reused. A no-op global left behind by an earlier
 * {@code GlobalOpenTelemetry.get()} is replaced.
 */
public final class OtelBootstrap {

    /** Environment variable holding the collector endpoint. */
    public static final String ENDPOINT_ENV = "OTEL_EXPORTER_OTLP_ENDPOINT";

    /** Collector endpoint used when the environment does not name one. */
    public static final String DEFAULT_ENDPOINT = "localhost:4317";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final String BOOTSTRAP_TRACER = "obslog/bootstrap";
    private static final Object LOCK = new Object();
    private static volatile OpenTelemetry initialized;

    private OtelBootstrap() {
        // utility class
    }

    /**
     * Collector endpoint without scheme plus the plaintext flag derived from it.
     *
     * @param hostPort endpoint as {@code host:port[/path]}
     * @param insecure true for plaintext gRPC
     */
    public record OtlpEndpoint(String hostPort, boolean insecure) {

        /** Endpoint URL in the form the OTLP exporter builders accept. */
        public String url() {
            return (insecure ? "http://" : "https://") + hostPort;
        }
    }

    /**
     * Initializes the SDK from the process environment.
     */
    public static OpenTelemetry init(String serviceName, StructuredLogger logger) {
        return init(serviceName, logger, System::getenv);
    }

    static OpenTelemetry init(String serviceName, StructuredLogger logger, Function<String, String> env) {
        OpenTelemetry current = initialized;
        if (current != null) {
            return current;
        }
        synchronized (LOCK) {
            if (initialized != null) {
                return initialized;
            }
            OtlpEndpoint endpoint = parseEndpoint(env.apply(ENDPOINT_ENV));
            String envServiceName = env.apply(StructuredLogger.SERVICE_NAME_ENV);
            String resolvedName = envServiceName == null || envServiceName.isBlank() ? serviceName : envServiceName.strip();

            OpenTelemetrySdk sdk = build(resolvedName, endpoint);
            try {
                GlobalOpenTelemetry.set(sdk);
            } catch (IllegalStateException e) {
                OpenTelemetry existing = GlobalOpenTelemetry.get();
                if (producesValidSpans(existing)) {
                    sdk.getSdkTracerProvider().shutdown();
                    initialized = existing;
                    if (logger != null) {
                        logger.info("observability.init_otel",
                                "otel tracer provider already initialized, skipping setup", Map.of());
                    }
                    return initialized;
                }
                // no-op fallback left by an early GlobalOpenTelemetry.get()
                GlobalOpenTelemetry.resetForTest();
                GlobalOpenTelemetry.set(sdk);
                if (logger != null) {
                    logger.warn("observability.init_otel",
                            "replaced no-op global otel instance registered before setup", Map.of());
                }
            }
            initialized = sdk;
            if (logger != null) {
                logger.info("observability.init_otel", "initialized otel tracer provider",
                        Map.of("otlp_endpoint", endpoint.hostPort(), "otlp_insecure", endpoint.insecure()));
            }
            return sdk;
        }
    }

    /**
     * Whether the instance is backed by a real SDK. The API's no-op tracer only hands out
     * invalid span contexts; an SDK generates ids even for spans it does not sample.
     */
    static boolean producesValidSpans(OpenTelemetry openTelemetry) {
        Span span = openTelemetry.getTracer(BOOTSTRAP_TRACER).spanBuilder("otel-bootstrap-check").startSpan();
        return span.getSpanContext().isValid();
    }

    /** Forgets the instance set up by an earlier {@link #init} call. */
    static void reset() {
        synchronized (LOCK) {
            initialized = null;
        }
    }

    /**
     * Splits an endpoint setting into host/port and the plaintext flag.
     *
     * @param raw value of {@value #ENDPOINT_ENV} (nullable)
     */
    public static OtlpEndpoint parseEndpoint(String raw) {
        String endpoint = raw == null ? "" : raw.strip();
        if (endpoint.isEmpty()) {
            return new OtlpEndpoint(DEFAULT_ENDPOINT, true);
        }
        if (endpoint.startsWith("http://")) {
            return new OtlpEndpoint(endpoint.substring("http://".length()), true);
        }
        if (endpoint.startsWith("https://")) {
            return new OtlpEndpoint(endpoint.substring("https://".length()), false);
        }
        return new OtlpEndpoint(endpoint, true);
    }

    private static OpenTelemetrySdk build(String serviceName, OtlpEndpoint endpoint) {
        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));
        OtlpGrpcSpanExporter exporter = OtlpGrpcSpanExporter.builder()
                .setEndpoint(endpoint.url())
                .build();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .setResource(resource)
                .addSpanProcessor(BatchSpanProcessor.builder(exporter).build())
                .build();
        return OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();
    }
}
