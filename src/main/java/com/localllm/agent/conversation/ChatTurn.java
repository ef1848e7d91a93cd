package com.localllm.agent.conversation;

import com.localllm.agent.model.ChatOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One question/answer exchange, kept in MongoDB after the Redis window has moved on.
 *
 * Collection: chat_turns
 */
@Document(collection = "chat_turns")
@CompoundIndexes({
    @CompoundIndex(name = "idx_session_date", def = "{'sessionId': 1, 'createdAt': 1}"),
    @CompoundIndex(name = "idx_user_date",    def = "{'userId': 1, 'createdAt': -1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatTurn {

    @Id
    private String id;

    private String sessionId;
    private String userId;

    private String userMessage;
    private String answer;

    private ChatOutcome outcome;

    /** Exception type for non-success outcomes, e.g. RetryExhaustedException */
    private String errorType;

    private boolean cached;
    private String model;
    private long latencyMs;
    private int promptTokens;
    private int completionTokens;

    @CreatedDate
    private Instant createdAt;
}
