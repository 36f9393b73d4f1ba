package com.obslog.observability.llm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything {@link ObservedCompletion} needs for one call. Build with {@link #builder(CompletionRequest)}.
 */
public final class ObservedCall {

    /** Byte budget for the request and response previews when none is set. */
    public static final int DEFAULT_PREVIEW_MAX_BYTES = 4096;

    private final String tracerName;
    private final String spanName;
    private final String generationName;
    private final CompletionRequest request;
    private final String userId;
    private final String sessionId;
    private final Map<String, Object> requestPayload;
    private final Map<String, Object> extraSpanAttrs;
    private final int previewMaxBytes;

    private ObservedCall(Builder builder) {
        this.tracerName = builder.tracerName;
        this.spanName = builder.spanName;
        this.generationName = builder.generationName;
        this.request = builder.request;
        this.userId = builder.userId;
        this.sessionId = builder.sessionId;
        this.requestPayload = builder.requestPayload;
        this.extraSpanAttrs = Collections.unmodifiableMap(builder.extraSpanAttrs);
        this.previewMaxBytes = builder.previewMaxBytes;
    }

    public static Builder builder(CompletionRequest request) {
        return new Builder(request);
    }

    public String tracerName() {
        return tracerName;
    }

    public String spanName() {
        return spanName;
    }

    public String generationName() {
        return generationName;
    }

    public CompletionRequest request() {
        return request;
    }

    public String userId() {
        return userId;
    }

    public String sessionId() {
        return sessionId;
    }

    /** Caller-supplied payload to preview instead of the synthesized one, may be null. */
    public Map<String, Object> requestPayload() {
        return requestPayload;
    }

    public Map<String, Object> extraSpanAttrs() {
        return extraSpanAttrs;
    }

    public int previewMaxBytes() {
        return previewMaxBytes;
    }

    public static final class Builder {

        private final CompletionRequest request;
        private String tracerName = "obslog.llm";
        private String spanName = "llm.completion";
        private String generationName = "llm.completion";
        private String userId;
        private String sessionId;
        private Map<String, Object> requestPayload;
        private final Map<String, Object> extraSpanAttrs = new LinkedHashMap<>();
        private int previewMaxBytes = DEFAULT_PREVIEW_MAX_BYTES;

        private Builder(CompletionRequest request) {
            if (request == null) {
                throw new IllegalArgumentException("request must not be null");
            }
            this.request = request;
        }

        public Builder tracerName(String tracerName) {
            this.tracerName = requireText(tracerName, "tracerName");
            return this;
        }

        public Builder spanName(String spanName) {
            this.spanName = requireText(spanName, "spanName");
            return this;
        }

        public Builder generationName(String generationName) {
            this.generationName = requireText(generationName, "generationName");
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder requestPayload(Map<String, Object> requestPayload) {
            this.requestPayload = requestPayload;
            return this;
        }

        public Builder extraSpanAttr(String key, Object value) {
            this.extraSpanAttrs.put(key, value);
            return this;
        }

        public Builder extraSpanAttrs(Map<String, ?> attrs) {
            if (attrs != null) {
                this.extraSpanAttrs.putAll(attrs);
            }
            return this;
        }

        public Builder previewMaxBytes(int previewMaxBytes) {
            this.previewMaxBytes = previewMaxBytes;
            return this;
        }

        public ObservedCall build() {
            return new ObservedCall(this);
        }

        private static String requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
            return value;
        }
    }
}
