package com.obslog.observability;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SensitiveDataRedactor}: key matching, key normalization and in-place
 * redaction of parsed JSON trees.
 */
@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = SensitiveDataRedactor.defaults();

    private static JsonNode parse(String json) {
        return ObservabilityJson.tryParse(json.getBytes(StandardCharsets.UTF_8)).orElseThrow();
    }

    @Nested
    @DisplayName("Key matching")
    class KeyMatching {

        @ParameterizedTest
        @ValueSource(strings = {"password", "Authorization", "COOKIE", "set-cookie", "api_key", " token "})
        @DisplayName("should match default keys case-insensitively")
        void shouldMatchDefaultKeys(String key) {
            assertThat(redactor.isSensitive(key)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"user_password", "x-api_key-header", "client_secret", "id_token"})
        @DisplayName("should match keys containing a redact key")
        void shouldMatchBySubstring(String key) {
            assertThat(redactor.isSensitive(key)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"username", "email", "amount", "pass"})
        @DisplayName("should not match ordinary keys")
        void shouldNotMatchOrdinaryKeys(String key) {
            assertThat(redactor.isSensitive(key)).isFalse();
        }

        @Test
        @DisplayName("should not match null or blank keys")
        void shouldNotMatchNullOrBlank() {
            assertThat(redactor.isSensitive(null)).isFalse();
            assertThat(redactor.isSensitive("   ")).isFalse();
        }
    }

    @Nested
    @DisplayName("Configured keys")
    class ConfiguredKeys {

        @Test
        @DisplayName("should normalize keys and drop blanks")
        void shouldNormalizeKeys() {
            SensitiveDataRedactor custom = new SensitiveDataRedactor(Arrays.asList(" SSN ", "", null, "Pin"));

            assertThat(custom.redactKeys()).containsExactlyInAnyOrder("ssn", "pin");
            assertThat(custom.isSensitive("customer_ssn")).isTrue();
            assertThat(custom.isSensitive("password")).isFalse();
        }

        @Test
        @DisplayName("should fall back to defaults for null or empty collections")
        void shouldFallBackToDefaults() {
            assertThat(new SensitiveDataRedactor(null).redactKeys())
                    .isEqualTo(SensitiveDataRedactor.DEFAULT_REDACT_KEYS);
            assertThat(new SensitiveDataRedactor(List.of()).redactKeys())
                    .isEqualTo(SensitiveDataRedactor.DEFAULT_REDACT_KEYS);
            assertThat(new SensitiveDataRedactor(List.of("  ")).redactKeys())
                    .isEqualTo(SensitiveDataRedactor.DEFAULT_REDACT_KEYS);
        }
    }

    @Nested
    @DisplayName("Tree redaction")
    class TreeRedaction {

        @Test
        @DisplayName("should mask sensitive values and keep the rest")
        void shouldMaskSensitiveValues() {
            JsonNode tree = parse("{\"user\":\"jane\",\"password\":\"s3cr3t\"}");

            redactor.redact(tree);

            assertThat(tree.get("user").asText()).isEqualTo("jane");
            assertThat(tree.get("password").asText()).isEqualTo(SensitiveDataRedactor.MASK);
        }

        @Test
        @DisplayName("should mask whole subtrees under a sensitive key")
        void shouldMaskSubtrees() {
            JsonNode tree = parse("{\"credentials\":{\"secret\":{\"a\":1}},\"auth\":{\"token\":[1,2]}}");

            redactor.redact(tree);

            assertThat(tree.get("credentials").get("secret").asText()).isEqualTo("***");
            assertThat(tree.get("auth").get("token").asText()).isEqualTo("***");
        }

        @Test
        @DisplayName("should walk arrays of objects")
        void shouldWalkArrays() {
            JsonNode tree = parse("[{\"api_key\":\"k1\"},{\"name\":\"n\"},\"token\"]");

            redactor.redact(tree);

            assertThat(tree.get(0).get("api_key").asText()).isEqualTo("***");
            assertThat(tree.get(1).get("name").asText()).isEqualTo("n");
            assertThat(tree.get(2).asText()).isEqualTo("token");
        }

        @Test
        @DisplayName("should ignore scalars")
        void shouldIgnoreScalars() {
            JsonNode tree = parse("\"password\"");

            redactor.redact(tree);

            assertThat(tree.asText()).isEqualTo("password");
        }
    }
}
