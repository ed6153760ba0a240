package io.agentic.core.provider;

import java.io.IOException;

/**
 * Provider failure: transport error, non-2xx response or a response without any choice.
 */
public class LlmBackendException extends IOException {
    private final int httpStatus;

    public LlmBackendException(String message) {
        this(message, -1, null);
    }

    public LlmBackendException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public LlmBackendException(String message, int httpStatus) {
        this(message, httpStatus, null);
    }

    public LlmBackendException(String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    /**
     * Status code returned by the provider, or {@code -1} when the call never got a response.
     */
    public int httpStatus() {
        return httpStatus;
    }
}
