package com.obslog.observability.langfuse;

import com.obslog.observability.testing.InMemoryLangfuseClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LangfuseClientRegistry}: memoization, disabled handles and shutdown.
 */
@DisplayName("LangfuseClientRegistry")
class LangfuseClientRegistryTest {

    private static final LangfuseSettings CONFIGURED =
            new LangfuseSettings("https://cloud.langfuse.com", "pk", "sk", true, true);

    @Test
    @DisplayName("should build one client per distinct settings value")
    void shouldMemoize() {
        AtomicInteger builds = new AtomicInteger();
        LangfuseClientRegistry registry = new LangfuseClientRegistry(settings -> {
            builds.incrementAndGet();
            return new InMemoryLangfuseClient();
        });

        LangfuseHandle first = registry.get(CONFIGURED);
        LangfuseHandle second = registry.get(new LangfuseSettings("https://cloud.langfuse.com", "pk", "sk", true, true));
        LangfuseHandle other = registry.get(new LangfuseSettings("https://eu.langfuse.com", "pk", "sk", true, true));

        assertThat(first).isInstanceOf(LangfuseHandle.Active.class).isSameAs(second);
        assertThat(other).isInstanceOf(LangfuseHandle.Active.class).isNotSameAs(first);
        assertThat(builds).hasValue(2);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should return disabled without caching for unconfigured settings")
    void shouldReturnDisabledForUnconfigured() {
        AtomicInteger builds = new AtomicInteger();
        LangfuseClientRegistry registry = new LangfuseClientRegistry(settings -> {
            builds.incrementAndGet();
            return new InMemoryLangfuseClient();
        });

        assertThat(registry.get(LangfuseSettings.disabled())).isSameAs(LangfuseHandle.disabled());
        assertThat(registry.get(new LangfuseSettings("https://lf", "pk", "sk", false, true)))
                .isSameAs(LangfuseHandle.disabled());
        assertThat(registry.get(null)).isSameAs(LangfuseHandle.disabled());
        assertThat(builds).hasValue(0);
        assertThat(registry.size()).isZero();
    }

    @Test
    @DisplayName("should cache a failed construction as disabled")
    void shouldCacheFailure() {
        AtomicInteger builds = new AtomicInteger();
        LangfuseClientRegistry registry = new LangfuseClientRegistry(settings -> {
            builds.incrementAndGet();
            throw new IllegalStateException("exporter unavailable");
        });

        assertThat(registry.get(CONFIGURED)).isSameAs(LangfuseHandle.disabled());
        assertThat(registry.get(CONFIGURED)).isSameAs(LangfuseHandle.disabled());
        assertThat(builds).hasValue(1);
    }

    @Test
    @DisplayName("should treat a null client as disabled")
    void shouldHandleNullClient() {
        LangfuseClientRegistry registry = new LangfuseClientRegistry(settings -> null);

        assertThat(registry.get(CONFIGURED)).isSameAs(LangfuseHandle.disabled());
    }

    @Test
    @DisplayName("should close every active client and forget them")
    void shouldCloseClients() {
        InMemoryLangfuseClient client = new InMemoryLangfuseClient();
        LangfuseClientRegistry registry = new LangfuseClientRegistry(settings -> client);
        registry.get(CONFIGURED);

        registry.close();

        assertThat(client.isClosed()).isTrue();
        assertThat(registry.size()).isZero();
    }

    @Test
    @DisplayName("should reject a null factory")
    void shouldRejectNullFactory() {
        assertThatThrownBy(() -> new LangfuseClientRegistry(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
