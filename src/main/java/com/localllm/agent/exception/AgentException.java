package com.localllm.agent.exception;

/**
 * Base type for every error the agent raises on purpose.
 *
 * Anything thrown that is not an AgentException is treated as a bug and
 * surfaces as a 500 through {@link GlobalExceptionHandler}.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
