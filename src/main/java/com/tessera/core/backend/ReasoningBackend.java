package com.tessera.core.backend;

import com.tessera.core.model.ExecutionContext;

/**
 * Streams a response for one command. Implementations must not block in
 * {@code stream} beyond opening the request; the first chunk is awaited by the caller.
 */
public interface ReasoningBackend {

    /**
     * @throws BackendException if the request cannot be started
     */
    BackendStream stream(String systemPrompt, ExecutionContext context, String userRequest);

    /** Model or endpoint description for health output. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
