package com.obslog.observability;

/**
 * Redacted, size-bounded textual rendering of a request or response payload.
 *
 * @param text      the (possibly truncated) preview, never null
 * @param truncated whether the sanitized form was cut to the byte budget
 * @param size      length in bytes of the original payload, independent of redaction
 */
public record BodyPreview(String text, boolean truncated, int size) {

    private static final BodyPreview EMPTY = new BodyPreview("", false, 0);

    public BodyPreview {
        if (text == null) {
            text = "";
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative");
        }
    }

    /**
     * Preview of an absent or zero-length payload.
     */
    public static BodyPreview empty() {
        return EMPTY;
    }

    /**
     * Returns true when there is preview text to report.
     */
    public boolean hasText() {
        return !text.isEmpty();
    }
}
