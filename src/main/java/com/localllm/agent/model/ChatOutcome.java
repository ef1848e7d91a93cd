package com.localllm.agent.model;

public enum ChatOutcome {
    /** The backend (or the cache) produced an answer. */
    SUCCESS,
    /** The backend refused the request as invalid; the answer carries its reason. */
    REJECTED,
    /** Breaker open, retries exhausted or rate limit timeout. */
    UNAVAILABLE,
    /** Any other agent failure. */
    ERROR
}
