package com.localllm.agent.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.localllm.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis-backed conversation window for a chat session.
 *
 * Key pattern: chat:session:{sessionId}:messages, stored as one JSON array.
 * The TTL is reset on every write so idle sessions expire on their own.
 * Only the last N user/assistant messages are kept; the system prompt is
 * rebuilt per request and never stored.
 *
 * Redis being down degrades to a stateless chat, it never fails the request.
 */
@Component
@Slf4j
public class ConversationMemory {

    private static final String KEY_PREFIX = "chat:session:";
    private static final String KEY_SUFFIX = ":messages";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${chat.memory.ttl-minutes:60}")
    private long ttlMinutes;

    @Value("${chat.memory.max-messages:20}")
    private int maxMessages;

    public ConversationMemory(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Conversation history for a session, oldest first.
     * Empty if the session is unknown, expired or unreadable.
     */
    public List<Message> load(String sessionId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(buildKey(sessionId));
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, continuing without history for session {}: {}", sessionId, e.getMessage());
            return new ArrayList<>();
        }

        if (json == null) {
            log.debug("No conversation history for session: {}", sessionId);
            return new ArrayList<>();
        }

        try {
            List<Message> messages = objectMapper.readValue(json, new TypeReference<>() {});
            log.debug("Loaded {} messages for session: {}", messages.size(), sessionId);
            return messages;
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize history for session: {}. Returning empty.", sessionId, e);
            return new ArrayList<>();
        }
    }

    /**
     * Appends one exchange and persists the trimmed window.
     */
    public void append(String sessionId, Message userMessage, Message assistantMessage) {
        List<Message> messages = load(sessionId);
        messages.add(userMessage);
        messages.add(assistantMessage);
        save(sessionId, messages);
    }

    void save(String sessionId, List<Message> messages) {
        List<Message> windowed = applyWindow(messages);
        try {
            String json = objectMapper.writeValueAsString(windowed);
            redisTemplate.opsForValue().set(buildKey(sessionId), json, Duration.ofMinutes(ttlMinutes));
            log.debug("Saved {} messages for session: {} (TTL: {}m)", windowed.size(), sessionId, ttlMinutes);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize history for session: {}", sessionId, e);
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, history for session {} not saved: {}", sessionId, e.getMessage());
        }
    }

    public void clear(String sessionId) {
        try {
            redisTemplate.delete(buildKey(sessionId));
            log.info("Cleared conversation history for session: {}", sessionId);
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, history for session {} not cleared: {}", sessionId, e.getMessage());
        }
    }

    List<Message> applyWindow(List<Message> messages) {
        if (messages.size() <= maxMessages) {
            return messages;
        }
        int from = messages.size() - maxMessages;
        log.debug("Applied sliding window: {} → {} messages", messages.size(), maxMessages);
        return new ArrayList<>(messages.subList(from, messages.size()));
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId + KEY_SUFFIX;
    }
}
