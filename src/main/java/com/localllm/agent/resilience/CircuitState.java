package com.localllm.agent.resilience;

public enum CircuitState {
    /** Normal operation, every call is dispatched. */
    CLOSED,
    /** Dependency considered down, calls are rejected without dispatch. */
    OPEN,
    /** Probing: a bounded number of trial calls decide between CLOSED and OPEN. */
    HALF_OPEN
}
