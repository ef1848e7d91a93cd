package com.localllm.agent.conversation;

import com.localllm.agent.model.ChatOutcome;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChatTurnRepository extends MongoRepository<ChatTurn, String> {

    List<ChatTurn> findBySessionIdOrderByCreatedAtAsc(String sessionId);

    long countBySessionId(String sessionId);

    long countByOutcome(ChatOutcome outcome);

    long deleteBySessionId(String sessionId);
}
