package com.localllm.agent.exception;

import com.localllm.agent.resilience.CircuitState;

/**
 * The circuit breaker refused to dispatch the call. The operation was not invoked.
 */
public class CircuitOpenException extends ServiceUnavailableException {

    private final CircuitState state;

    public CircuitOpenException(String message, CircuitState state) {
        super(message);
        this.state = state;
    }

    /** OPEN, or HALF_OPEN when the trial-call quota was already taken. */
    public CircuitState getState() {
        return state;
    }
}
