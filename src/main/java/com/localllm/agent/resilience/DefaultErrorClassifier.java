package com.localllm.agent.resilience;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.localllm.agent.exception.AgentException;
import com.localllm.agent.exception.TransientFailureException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Generic transient-vs-permanent classification.
 *
 * | Error                                           | Retriable |
 * |-------------------------------------------------|-----------|
 * | TransientFailureException                       | yes       |
 * | any other AgentException (permanent, breaker)   | no        |
 * | TimeoutException                                | yes       |
 * | IOException (refused, reset, broken pipe, ...)  | yes       |
 * | JSON parse errors (IOException subtypes)        | no        |
 * | HTTP 429 / 502 / 503 / 504                      | yes       |
 * | any other HTTP status                           | no        |
 * | InterruptedException, everything else          | no        |
 *
 * Wrappers such as ResourceAccessException or UncheckedIOException are looked
 * through: the cause chain is walked until a decisive type is found.
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    public static final Set<Integer> RETRIABLE_STATUS_CODES = Set.of(429, 502, 503, 504);

    private static final int MAX_CAUSE_DEPTH = 10;

    @Override
    public boolean isRetriable(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof TransientFailureException) return true;
            if (current instanceof AgentException) return false;
            if (current instanceof InterruptedException) return false;
            if (current instanceof TimeoutException) return true;
            if (current instanceof JsonProcessingException) return false;
            if (current instanceof IOException) return true;
            if (current instanceof RestClientResponseException http) {
                return RETRIABLE_STATUS_CODES.contains(http.getStatusCode().value());
            }
            if (current.getCause() == current) break;
            current = current.getCause();
        }
        return false;
    }
}
