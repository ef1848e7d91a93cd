package com.localllm.agent.exception;

/**
 * Parent of the three failure kinds that all mean "the backend cannot take this
 * request right now". The agent collapses them into one user-facing message.
 */
public abstract class ServiceUnavailableException extends AgentException {

    protected ServiceUnavailableException(String message) {
        super(message);
    }

    protected ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
