package com.obslog.observability.web.config;

import com.obslog.observability.langfuse.LangfuseSettings;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LangfuseProperties} and {@link LangfuseTracingProperties}.
 */
@DisplayName("LangfuseProperties")
class LangfusePropertiesTest {

    private static final Map<String, String> ENV = Map.of(
            LangfuseSettings.HOST_ENV, "https://env.langfuse.com",
            LangfuseSettings.PUBLIC_KEY_ENV, "pk-env",
            LangfuseSettings.SECRET_KEY_ENV, "sk-env",
            LangfuseSettings.TRACING_ENABLED_ENV, "true",
            LangfuseSettings.FLUSH_AT_REQUEST_END_ENV, "false");

    @Test
    @DisplayName("should prefer bound properties over the environment")
    void shouldPreferProperties() {
        LangfuseProperties properties =
                new LangfuseProperties("https://cloud.langfuse.com", "pk", "sk", false, true);

        assertThat(properties.toSettings(ENV::get))
                .isEqualTo(new LangfuseSettings("https://cloud.langfuse.com", "pk", "sk", false, true));
    }

    @Test
    @DisplayName("should fill unset properties from the environment")
    void shouldFallBackToEnvironment() {
        LangfuseProperties properties = new LangfuseProperties(null, " ", "sk", null, null);

        assertThat(properties.toSettings(ENV::get))
                .isEqualTo(new LangfuseSettings("https://env.langfuse.com", "pk-env", "sk", true, false));
    }

    @Test
    @DisplayName("should mask the secret key in toString")
    void shouldMaskSecret() {
        assertThat(new LangfuseProperties("h", "pk", "sk-secret", true, true).toString())
                .contains("***")
                .doesNotContain("sk-secret");
    }

    @Test
    @DisplayName("should default the header names")
    void shouldDefaultHeaders() {
        LangfuseTracingProperties headers = new LangfuseTracingProperties("", "X-Conversation");

        assertThat(headers.traceHeader()).isEqualTo("X-Trace-Id");
        assertThat(headers.sessionHeader()).isEqualTo("X-Conversation");
        assertThat(LangfuseTracingProperties.defaults().sessionHeader()).isEqualTo("X-Session-Id");
    }
}
