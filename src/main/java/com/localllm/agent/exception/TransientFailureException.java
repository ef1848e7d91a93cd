package com.localllm.agent.exception;

/**
 * A failure that may succeed if repeated: timeouts, dropped connections,
 * and backend responses 429 / 502 / 503 / 504.
 */
public class TransientFailureException extends AgentException {

    private final int statusCode;

    public TransientFailureException(String message) {
        this(message, -1, null);
    }

    public TransientFailureException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TransientFailureException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status reported by the backend, or -1 when the failure happened below HTTP. */
    public int getStatusCode() {
        return statusCode;
    }
}
