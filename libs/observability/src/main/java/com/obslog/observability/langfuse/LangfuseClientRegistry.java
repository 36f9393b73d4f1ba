package com.obslog.observability.langfuse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Memoizing factory handing out one {@link LangfuseClient} per distinct {@link LangfuseSettings}
 * value.
 * <p>
 * Settings that are not configured for tracing always yield {@link LangfuseHandle#disabled()}
 * and are not cached. A client whose construction fails is logged once and cached as disabled,
 * so a broken configuration does not retry on every request.
 */
public final class LangfuseClientRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LangfuseClientRegistry.class);

    private final Map<LangfuseSettings, LangfuseHandle> handles = new ConcurrentHashMap<>();
    private final Function<LangfuseSettings, ? extends LangfuseClient> clientFactory;

    /**
     * Creates a registry building {@link OtelLangfuseClient}s.
     */
    public LangfuseClientRegistry() {
        this(OtelLangfuseClient::create);
    }

    /**
     * Creates a registry with a custom client factory.
     *
     * @param clientFactory builds a client for configured settings; may throw
     */
    public LangfuseClientRegistry(Function<LangfuseSettings, ? extends LangfuseClient> clientFactory) {
        if (clientFactory == null) {
            throw new IllegalArgumentException("clientFactory must not be null");
        }
        this.clientFactory = clientFactory;
    }

    /**
     * Returns the handle for the given settings, creating the client on first use.
     */
    public LangfuseHandle get(LangfuseSettings settings) {
        if (settings == null || !settings.isConfiguredForTracing()) {
            return LangfuseHandle.disabled();
        }
        return handles.computeIfAbsent(settings, this::create);
    }

    /**
     * Number of settings values with a cached handle.
     */
    public int size() {
        return handles.size();
    }

    /**
     * Shuts down every client created by this registry.
     */
    @Override
    public void close() {
        handles.values().forEach(handle -> {
            if (handle instanceof LangfuseHandle.Active active) {
                try {
                    active.client().close();
                } catch (RuntimeException e) {
                    log.warn("Failed to close Langfuse client: {}", e.getMessage(), e);
                }
            }
        });
        handles.clear();
    }

    private LangfuseHandle create(LangfuseSettings settings) {
        try {
            LangfuseClient client = clientFactory.apply(settings);
            if (client == null) {
                log.warn("Langfuse client factory returned null for host {}", settings.host());
                return LangfuseHandle.disabled();
            }
            log.info("Langfuse tracing enabled for host {}", settings.host());
            return LangfuseHandle.active(client);
        } catch (RuntimeException e) {
            log.warn("Failed to create Langfuse client for host {}: {}", settings.host(), e.getMessage(), e);
            return LangfuseHandle.disabled();
        }
    }
}
