package com.obslog.observability.llm;

/**
 * Boundary to the LLM provider. Implementations perform exactly one completion call.
 */
@FunctionalInterface
public interface CompletionClient {

    ChatCompletion complete(CompletionRequest request) throws CompletionCallException;
}
