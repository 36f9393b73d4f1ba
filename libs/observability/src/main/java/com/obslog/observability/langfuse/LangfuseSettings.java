package com.obslog.observability.langfuse;

import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable Langfuse connection settings. Value equality makes an instance usable as a cache
 * key in {@link LangfuseClientRegistry}.
 *
 * @param host              Langfuse base URL, e.g. {@code https://cloud.langfuse.com}
 * @param publicKey         project public key
 * @param secretKey         project secret key
 * @param tracingEnabled    master switch, off by default
 * @param flushAtRequestEnd flush pending observations before each traced request returns
 */
public record LangfuseSettings(
        String host,
        String publicKey,
        String secretKey,
        boolean tracingEnabled,
        boolean flushAtRequestEnd
) {

    public static final String HOST_ENV = "LANGFUSE_HOST";
    public static final String PUBLIC_KEY_ENV = "LANGFUSE_PUBLIC_KEY";
    public static final String SECRET_KEY_ENV = "LANGFUSE_SECRET_KEY";
    public static final String TRACING_ENABLED_ENV = "LANGFUSE_TRACING_ENABLED";
    public static final String FLUSH_AT_REQUEST_END_ENV = "LANGFUSE_FLUSH_AT_REQUEST_END";

    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes", "on");

    /**
     * Compact constructor: trims strings and turns nulls into empty strings.
     */
    public LangfuseSettings {
        host = host == null ? "" : host.strip();
        publicKey = publicKey == null ? "" : publicKey.strip();
        secretKey = secretKey == null ? "" : secretKey.strip();
    }

    /**
     * Settings that never enable tracing.
     */
    public static LangfuseSettings disabled() {
        return new LangfuseSettings("", "", "", false, true);
    }

    /**
     * Loads settings from the process environment.
     */
    public static LangfuseSettings fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Loads settings from an environment lookup function.
     */
    public static LangfuseSettings fromEnv(Function<String, String> env) {
        return new LangfuseSettings(
                env.apply(HOST_ENV),
                env.apply(PUBLIC_KEY_ENV),
                env.apply(SECRET_KEY_ENV),
                parseBool(env.apply(TRACING_ENABLED_ENV), false),
                parseBool(env.apply(FLUSH_AT_REQUEST_END_ENV), true)
        );
    }

    /**
     * True when tracing is switched on and host and both keys are present.
     */
    public boolean isConfiguredForTracing() {
        if (!tracingEnabled) {
            return false;
        }
        return !host.isEmpty() && !publicKey.isEmpty() && !secretKey.isEmpty();
    }

    @Override
    public String toString() {
        return "LangfuseSettings[host=" + host
                + ", publicKey=" + publicKey
                + ", secretKey=" + (secretKey.isEmpty() ? "" : "***")
                + ", tracingEnabled=" + tracingEnabled
                + ", flushAtRequestEnd=" + flushAtRequestEnd + "]";
    }

    static boolean parseBool(String raw, boolean defaultValue) {
        String value = raw == null ? "" : raw.strip().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return defaultValue;
        }
        return TRUE_VALUES.contains(value);
    }
}
