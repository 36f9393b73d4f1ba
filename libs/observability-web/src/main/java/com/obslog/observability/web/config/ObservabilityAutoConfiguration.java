package com.obslog.observability.web.config;

import com.obslog.observability.OtelBootstrap;
import com.obslog.observability.StructuredLogger;
import com.obslog.observability.langfuse.LangfuseClientRegistry;
import com.obslog.observability.web.filter.LangfuseTraceFilter;
import com.obslog.observability.web.filter.TraceAccessLogFilter;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.core.Ordered;
import org.springframework.core.env.Environment;

/**
 * Registers the access-log filter and, when Langfuse credentials are configured, the Langfuse
 * request filter.
 *
 * <p>The access-log filter runs first so its server span is current when the Langfuse filter
 * resolves the trace id. Both run ahead of application filters.
 */
@AutoConfiguration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties({
    AccessLogProperties.class,
    LangfuseProperties.class,
    LangfuseTracingProperties.class
})
public class ObservabilityAutoConfiguration {

    public static final int ACCESS_LOG_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 10;
    public static final int LANGFUSE_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 20;

    static final String ACCESS_LOGGER_NAME = "obslog.access";

    @Bean
    @ConditionalOnMissingBean
    public StructuredLogger structuredLogger(AccessLogProperties properties, Environment environment) {
        String applicationName = properties.applicationName();
        if (applicationName == null || applicationName.isBlank()) {
            applicationName = environment.getProperty("spring.application.name");
        }
        return new StructuredLogger(LoggerFactory.getLogger(ACCESS_LOGGER_NAME), applicationName);
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry(StructuredLogger structuredLogger) {
        return OtelBootstrap.init(structuredLogger.applicationName(), structuredLogger);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public LangfuseClientRegistry langfuseClientRegistry() {
        return new LangfuseClientRegistry();
    }

    @Bean
    public FilterRegistrationBean<TraceAccessLogFilter> traceAccessLogFilter(
            OpenTelemetry openTelemetry, AccessLogProperties properties, StructuredLogger structuredLogger) {
        FilterRegistrationBean<TraceAccessLogFilter> registration =
                new FilterRegistrationBean<>(new TraceAccessLogFilter(openTelemetry, properties, structuredLogger));
        registration.setName("traceAccessLogFilter");
        registration.setOrder(ACCESS_LOG_FILTER_ORDER);
        return registration;
    }

    @Bean
    @Conditional(LangfuseTracingCondition.class)
    public FilterRegistrationBean<LangfuseTraceFilter> langfuseTraceFilter(
            LangfuseClientRegistry registry,
            LangfuseProperties langfuseProperties,
            LangfuseTracingProperties tracingProperties,
            Environment environment) {
        LangfuseTraceFilter filter = LangfuseTraceFilter.forSettings(
                        registry, langfuseProperties.toSettings(environment::getProperty), tracingProperties)
                .orElseThrow(() -> new IllegalStateException("Langfuse tracing condition matched without settings"));
        FilterRegistrationBean<LangfuseTraceFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setName("langfuseTraceFilter");
        registration.setOrder(LANGFUSE_FILTER_ORDER);
        return registration;
    }
}
