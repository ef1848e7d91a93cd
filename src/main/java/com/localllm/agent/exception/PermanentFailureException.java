package com.localllm.agent.exception;

/**
 * A failure that repeating the call cannot fix: malformed input, bad credentials,
 * unknown model, any 4xx other than 429. Surfaced to the user verbatim.
 */
public class PermanentFailureException extends AgentException {

    private final int statusCode;

    public PermanentFailureException(String message) {
        this(message, -1, null);
    }

    public PermanentFailureException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public PermanentFailureException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
