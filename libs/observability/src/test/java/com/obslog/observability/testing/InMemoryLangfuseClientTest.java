package com.obslog.observability.testing;

import com.obslog.observability.langfuse.GenerationSpec;
import com.obslog.observability.langfuse.LangfuseObservation;
import com.obslog.observability.langfuse.ObservationUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InMemoryLangfuseClient}, the recording client used by other modules' tests.
 */
@DisplayName("InMemoryLangfuseClient")
class InMemoryLangfuseClientTest {

    private static final String TRACE_ID = "0af7651916cd43dd8448eb211c80319c";

    private final InMemoryLangfuseClient client = new InMemoryLangfuseClient();

    @Test
    @DisplayName("should nest generations under the open span and inherit its identity")
    void shouldNestObservations() {
        try (LangfuseObservation span = client.startSpan("request", TRACE_ID, Map.of("http.method", "POST"))) {
            client.updateCurrentTrace("7", "campaign_42");
            try (LangfuseObservation generation = client.startGeneration(
                    new GenerationSpec("chat", "gpt-4o-mini", null, null, null))) {
                assertThat(client.currentObservation()).containsSame(generation);
                assertThat(generation.traceId()).isEqualTo(TRACE_ID);
            }
            assertThat(client.currentObservation()).containsSame(span);
        }

        assertThat(client.currentObservation()).isEmpty();
        assertThat(client.spans()).singleElement().satisfies(span -> {
            assertThat(span.metadata()).containsEntry("http.method", "POST");
            assertThat(span.userId()).isEqualTo("7");
            assertThat(span.isEnded()).isTrue();
        });
        assertThat(client.generations()).singleElement().satisfies(generation -> {
            assertThat(generation.sessionId()).isEqualTo("campaign_42");
            assertThat(generation.model()).isEqualTo("gpt-4o-mini");
        });
    }

    @Test
    @DisplayName("should generate a trace id when none is given")
    void shouldGenerateTraceId() {
        try (LangfuseObservation span = client.startSpan("op", null, null)) {
            assertThat(span.traceId()).hasSize(32).matches("[0-9a-f]+");
            assertThat(span.observationId()).hasSize(16);
        }
    }

    @Test
    @DisplayName("should simulate update and flush failures")
    void shouldSimulateFailures() {
        client.failFlushWith(new IllegalStateException("flush"))
                .failUpdatesWith(new IllegalStateException("update"));

        try (LangfuseObservation span = client.startSpan("op", TRACE_ID, null)) {
            assertThatThrownBy(() -> span.update(ObservationUpdate.error("boom"))).hasMessage("update");
        }
        assertThatThrownBy(client::flush).hasMessage("flush");
        assertThat(client.flushCount()).isEqualTo(1);

        client.reset();
        assertThat(client.observations()).isEmpty();
        assertThat(client.flushCount()).isZero();
    }
}
