package com.obslog.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BodyPreviewCodec}: redaction before truncation, size accounting and
 * pass-through of non-JSON payloads.
 */
@DisplayName("BodyPreviewCodec")
class BodyPreviewCodecTest {

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Empty payloads")
    class EmptyPayloads {

        @Test
        @DisplayName("should return the empty preview for null and empty bodies")
        void shouldReturnEmptyPreview() {
            assertThat(BodyPreviewCodec.preview((byte[]) null)).isEqualTo(BodyPreview.empty());
            assertThat(BodyPreviewCodec.preview(new byte[0], 10, null)).isEqualTo(new BodyPreview("", false, 0));
            assertThat(BodyPreviewCodec.preview((String) null, 10, null)).isEqualTo(BodyPreview.empty());
        }
    }

    @Nested
    @DisplayName("JSON payloads")
    class JsonPayloads {

        @Test
        @DisplayName("should redact default keys and re-serialize compactly")
        void shouldRedactDefaultKeys() {
            byte[] body = utf8("{ \"user\": \"jane\", \"password\": \"s3cr3t\" }");

            BodyPreview preview = BodyPreviewCodec.preview(body);

            assertThat(preview.text()).isEqualTo("{\"user\":\"jane\",\"password\":\"***\"}");
            assertThat(preview.truncated()).isFalse();
            assertThat(preview.size()).isEqualTo(body.length);
        }

        @Test
        @DisplayName("should redact configured keys only")
        void shouldRedactConfiguredKeys() {
            byte[] body = utf8("{\"ssn\":\"123\",\"password\":\"p\"}");

            BodyPreview preview = BodyPreviewCodec.preview(body, 2048, List.of("SSN"));

            assertThat(preview.text()).isEqualTo("{\"ssn\":\"***\",\"password\":\"p\"}");
        }

        @Test
        @DisplayName("should redact nested objects inside arrays")
        void shouldRedactInsideArrays() {
            BodyPreview preview = BodyPreviewCodec.preview(utf8("[{\"token\":\"t\"},{\"id\":1}]"));

            assertThat(preview.text()).isEqualTo("[{\"token\":\"***\"},{\"id\":1}]");
        }

        @Test
        @DisplayName("should truncate the redacted form, not the original")
        void shouldTruncateRedactedForm() {
            byte[] body = utf8("{\"password\":\"a-very-long-secret-value\",\"n\":1}");

            BodyPreview preview = BodyPreviewCodec.preview(body, 12, null);

            assertThat(preview.text()).isEqualTo("{\"password\":");
            assertThat(preview.truncated()).isTrue();
            assertThat(preview.size()).isEqualTo(body.length);
        }

        @Test
        @DisplayName("should be stable when previewing its own output again")
        void shouldBeIdempotent() {
            byte[] body = utf8("{\"api_key\":\"k\",\"items\":[1,2,3],\"note\":\"hello world\"}");

            BodyPreview first = BodyPreviewCodec.preview(body, 30, null);
            BodyPreview second = BodyPreviewCodec.preview(first.text(), 30, null);

            assertThat(second.text()).isEqualTo(first.text());
            assertThat(second.truncated()).isFalse();
        }
    }

    @Nested
    @DisplayName("Non-JSON payloads")
    class NonJsonPayloads {

        @Test
        @DisplayName("should pass plain text through without redaction")
        void shouldPassTextThrough() {
            BodyPreview preview = BodyPreviewCodec.preview(utf8("password=s3cr3t&user=jane"));

            assertThat(preview.text()).isEqualTo("password=s3cr3t&user=jane");
            assertThat(preview.truncated()).isFalse();
        }

        @Test
        @DisplayName("should pass JSON scalars through unchanged")
        void shouldPassScalarsThrough() {
            assertThat(BodyPreviewCodec.preview(utf8("  42 ")).text()).isEqualTo("  42 ");
        }

        @Test
        @DisplayName("should treat JSON followed by garbage as text")
        void shouldRejectTrailingTokens() {
            BodyPreview preview = BodyPreviewCodec.preview(utf8("{\"token\":\"t\"} trailing"));

            assertThat(preview.text()).isEqualTo("{\"token\":\"t\"} trailing");
        }

        @Test
        @DisplayName("should replace a multi-byte character cut by truncation")
        void shouldReplaceBrokenMultiByteCharacter() {
            byte[] body = utf8("héllo");

            BodyPreview preview = BodyPreviewCodec.preview(body, 2, null);

            assertThat(preview.text()).isEqualTo("h\uFFFD");
            assertThat(preview.truncated()).isTrue();
            assertThat(preview.size()).isEqualTo(6);
        }

        @Test
        @DisplayName("should keep at least one byte when the budget is not positive")
        void shouldClampBudgetToOneByte() {
            BodyPreview preview = BodyPreviewCodec.preview(utf8("abc"), 0, null);

            assertThat(preview.text()).isEqualTo("a");
            assertThat(preview.truncated()).isTrue();
        }
    }

    @Nested
    @DisplayName("previewJson")
    class PreviewJson {

        @Test
        @DisplayName("should report the serialized size")
        void shouldReportSerializedSize() {
            BodyPreview preview = BodyPreviewCodec.previewJson(Map.of("model", "gpt"), 4096);

            assertThat(preview.text()).isEqualTo("{\"model\":\"gpt\"}");
            assertThat(preview.size()).isEqualTo(15);
            assertThat(preview.truncated()).isFalse();
        }

        @Test
        @DisplayName("should truncate long values")
        void shouldTruncate() {
            BodyPreview preview = BodyPreviewCodec.previewJson(List.of("abcdefghij"), 5);

            assertThat(preview.text()).isEqualTo("[\"abc");
            assertThat(preview.truncated()).isTrue();
            assertThat(preview.size()).isEqualTo(14);
        }

        @Test
        @DisplayName("should serialize null as the JSON literal")
        void shouldSerializeNull() {
            assertThat(BodyPreviewCodec.previewJson(null, 10).text()).isEqualTo("null");
        }
    }

    @Nested
    @DisplayName("BodyPreview")
    class BodyPreviewRecord {

        @Test
        @DisplayName("should reject negative sizes")
        void shouldRejectNegativeSize() {
            assertThatThrownBy(() -> new BodyPreview("", false, -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
