package com.obslog.observability.web.config;

import com.obslog.observability.langfuse.LangfuseSettings;
import java.util.function.Function;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Langfuse connection properties, bound from {@code langfuse.*}.
 *
 * <p>Every property left unset falls back to the matching {@code LANGFUSE_*} environment
 * variable when converted with {@link #toSettings()}.
 *
 * @param host Langfuse base URL
 * @param publicKey project public key
 * @param secretKey project secret key
 * @param tracingEnabled master switch (default false)
 * @param flushAtRequestEnd flush after every traced request (default true)
 */
@ConfigurationProperties(prefix = "langfuse")
public record LangfuseProperties(
        String host,
        String publicKey,
        String secretKey,
        Boolean tracingEnabled,
        Boolean flushAtRequestEnd) {

    /** Converts to settings, filling gaps from the process environment. */
    public LangfuseSettings toSettings() {
        return toSettings(System::getenv);
    }

    /** Converts to settings, filling gaps from the given environment lookup. */
    public LangfuseSettings toSettings(Function<String, String> env) {
        LangfuseSettings fromEnv = LangfuseSettings.fromEnv(env);
        return new LangfuseSettings(
                hasText(host) ? host : fromEnv.host(),
                hasText(publicKey) ? publicKey : fromEnv.publicKey(),
                hasText(secretKey) ? secretKey : fromEnv.secretKey(),
                tracingEnabled != null ? tracingEnabled : fromEnv.tracingEnabled(),
                flushAtRequestEnd != null ? flushAtRequestEnd : fromEnv.flushAtRequestEnd());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        return "LangfuseProperties[host=" + host
                + ", publicKey=" + publicKey
                + ", secretKey=" + (hasText(secretKey) ? "***" : "")
                + ", tracingEnabled=" + tracingEnabled
                + ", flushAtRequestEnd=" + flushAtRequestEnd + "]";
    }
}
