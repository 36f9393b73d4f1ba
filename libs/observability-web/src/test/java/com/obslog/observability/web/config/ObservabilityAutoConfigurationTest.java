package com.obslog.observability.web.config;

import com.obslog.observability.StructuredLogger;
import com.obslog.observability.langfuse.LangfuseClientRegistry;
import com.obslog.observability.web.filter.LangfuseTraceFilter;
import com.obslog.observability.web.filter.TraceAccessLogFilter;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ObservabilityAutoConfiguration}. A no-op {@link OpenTelemetry} bean keeps the
 * global SDK untouched.
 */
@DisplayName("ObservabilityAutoConfiguration")
class ObservabilityAutoConfigurationTest {

    private final WebApplicationContextRunner contextRunner = new WebApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ObservabilityAutoConfiguration.class))
            .withUserConfiguration(NoopOpenTelemetryConfig.class);

    @Configuration(proxyBeanMethods = false)
    static class NoopOpenTelemetryConfig {

        @Bean
        OpenTelemetry openTelemetry() {
            return OpenTelemetry.noop();
        }
    }

    @Test
    @DisplayName("should register the access-log filter and skip Langfuse by default")
    void shouldRegisterAccessLogFilter() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(StructuredLogger.class);
            assertThat(context).hasSingleBean(LangfuseClientRegistry.class);
            assertThat(context).hasSingleBean(OpenTelemetry.class);

            FilterRegistrationBean<?> accessLog = context.getBean("traceAccessLogFilter", FilterRegistrationBean.class);
            assertThat(accessLog.getFilter()).isInstanceOf(TraceAccessLogFilter.class);
            assertThat(accessLog.getOrder()).isEqualTo(ObservabilityAutoConfiguration.ACCESS_LOG_FILTER_ORDER);
            assertThat(context).doesNotHaveBean("langfuseTraceFilter");
        });
    }

    @Test
    @DisplayName("should register the Langfuse filter after the access-log filter when configured")
    void shouldRegisterLangfuseFilter() {
        contextRunner
                .withPropertyValues(
                        "langfuse.host=https://cloud.langfuse.com",
                        "langfuse.public-key=pk-lf",
                        "langfuse.secret-key=sk-lf",
                        "langfuse.tracing-enabled=true",
                        "obslog.langfuse.session-header=X-Conversation")
                .run(context -> {
                    FilterRegistrationBean<?> langfuse = context.getBean("langfuseTraceFilter", FilterRegistrationBean.class);
                    assertThat(langfuse.getFilter()).isInstanceOf(LangfuseTraceFilter.class);
                    assertThat(langfuse.getOrder()).isGreaterThan(ObservabilityAutoConfiguration.ACCESS_LOG_FILTER_ORDER);
                    assertThat(context.getBean(LangfuseTracingProperties.class).sessionHeader())
                            .isEqualTo("X-Conversation");
                });
    }

    @Test
    @DisplayName("should skip the Langfuse filter when tracing is switched off")
    void shouldSkipDisabledLangfuse() {
        contextRunner
                .withPropertyValues(
                        "langfuse.host=https://cloud.langfuse.com",
                        "langfuse.public-key=pk-lf",
                        "langfuse.secret-key=sk-lf",
                        "langfuse.tracing-enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean("langfuseTraceFilter"));
    }

    @Test
    @DisplayName("should bind access-log properties and name the logger after the application")
    void shouldBindAccessLogProperties() {
        contextRunner
                .withPropertyValues(
                        "spring.application.name=chat-api",
                        "obslog.access-log.body-preview-enabled=true",
                        "obslog.access-log.body-preview-max-bytes=512",
                        "obslog.access-log.body-preview-paths=/api/chat,/api/completions")
                .run(context -> {
                    AccessLogProperties properties = context.getBean(AccessLogProperties.class);
                    assertThat(properties.bodyPreviewEnabled()).isTrue();
                    assertThat(properties.bodyPreviewMaxBytes()).isEqualTo(512);
                    assertThat(properties.bodyPreviewPaths()).containsExactly("/api/chat", "/api/completions");
                    assertThat(context.getBean(StructuredLogger.class).applicationName()).isEqualTo("chat-api");
                });
    }

    @Test
    @DisplayName("should prefer the configured access-log application name")
    void shouldPreferConfiguredApplicationName() {
        contextRunner
                .withPropertyValues(
                        "spring.application.name=chat-api",
                        "obslog.access-log.application-name=chat-gateway")
                .run(context -> assertThat(context.getBean(StructuredLogger.class).applicationName())
                        .isEqualTo("chat-gateway"));
    }

    @Test
    @DisplayName("should stay inactive outside servlet applications")
    void shouldStayInactiveOutsideWeb() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(ObservabilityAutoConfiguration.class))
                .run(context -> assertThat(context).doesNotHaveBean(StructuredLogger.class));
    }
}
