package com.localllm.agent.api;

import com.localllm.agent.conversation.ChatTurn;
import com.localllm.agent.conversation.ConversationService;
import com.localllm.agent.model.ChatOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Chat history.
 *
 * GET    /api/v1/conversations/{sessionId}   recorded turns, oldest first
 * DELETE /api/v1/conversations/{sessionId}   forget the session
 * GET    /api/v1/conversations/analytics     turn counts per outcome
 */
@RestController
@RequestMapping("/api/v1/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;

    @GetMapping("/analytics")
    public ResponseEntity<Map<ChatOutcome, Long>> analytics() {
        return ResponseEntity.ok(conversationService.outcomeCounts());
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<List<ChatTurn>> getTurns(@PathVariable String sessionId) {
        return ResponseEntity.ok(conversationService.getTurns(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String sessionId) {
        long deleted = conversationService.deleteSession(sessionId);
        return ResponseEntity.ok(Map.of("sessionId", sessionId, "deletedTurns", deleted));
    }
}
