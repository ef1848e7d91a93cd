package com.localllm.agent.conversation;

import com.localllm.agent.model.ChatOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Chat history: the Redis window for prompting plus the MongoDB turn log.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConversationService {

    private final ChatTurnRepository turnRepository;
    private final ConversationMemory memory;

    /**
     * Persists a finished turn off the request thread.
     * A MongoDB failure is logged; the user already has the answer.
     */
    @Async("conversationTaskExecutor")
    public void recordTurn(ChatTurn turn) {
        try {
            turnRepository.save(turn);
            log.debug("Chat turn recorded [sessionId={}, outcome={}, latency={}ms]",
                    turn.getSessionId(), turn.getOutcome(), turn.getLatencyMs());
        } catch (DataAccessException e) {
            log.error("Failed to record chat turn for session {}: {}", turn.getSessionId(), e.getMessage());
        }
    }

    public List<ChatTurn> getTurns(String sessionId) {
        return turnRepository.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }

    /**
     * Removes both the prompt window and the stored turns.
     *
     * @return number of stored turns deleted
     */
    public long deleteSession(String sessionId) {
        memory.clear(sessionId);
        long deleted = turnRepository.deleteBySessionId(sessionId);
        log.info("Deleted session {} ({} turns)", sessionId, deleted);
        return deleted;
    }

    /** Turn counts per outcome across all sessions. */
    public Map<ChatOutcome, Long> outcomeCounts() {
        Map<ChatOutcome, Long> counts = new EnumMap<>(ChatOutcome.class);
        for (ChatOutcome outcome : ChatOutcome.values()) {
            counts.put(outcome, turnRepository.countByOutcome(outcome));
        }
        return counts;
    }
}
