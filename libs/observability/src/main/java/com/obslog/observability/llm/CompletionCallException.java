package com.obslog.observability.llm;

/**
 * A completion call failed: transport error, interruption or non-2xx provider response.
 */
public class CompletionCallException extends Exception {

    private final int statusCode;

    public CompletionCallException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public CompletionCallException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the provider, or -1 when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }
}
