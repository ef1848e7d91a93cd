package com.localllm.agent.core;

import com.localllm.agent.conversation.ChatTurn;
import com.localllm.agent.conversation.ConversationMemory;
import com.localllm.agent.conversation.ConversationService;
import com.localllm.agent.exception.AgentException;
import com.localllm.agent.exception.PermanentFailureException;
import com.localllm.agent.exception.ServiceUnavailableException;
import com.localllm.agent.llm.LlmClient;
import com.localllm.agent.model.ChatOutcome;
import com.localllm.agent.model.ChatRequest;
import com.localllm.agent.model.ChatResponse;
import com.localllm.agent.model.LlmResponse;
import com.localllm.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Single-turn chat over the resilient LLM client.
 *
 * Per-request flow:
 * 1. Load the session window (Redis)
 * 2. Prompt = system message + history + new user message
 * 3. LLM call through cache / rate limiter / retry / circuit breaker
 * 4. Save the exchange to the window on success
 * 5. Async: record the turn in MongoDB, whatever the outcome
 *
 * Backend trouble never reaches the user as a stack trace:
 * circuit open, retries exhausted and rate-limit timeouts all become one
 * "temporarily unavailable" answer, while a permanent failure is shown as-is
 * because the user can usually fix the input.
 */
@Service
@Slf4j
public class ChatAgent {

    public static final String UNAVAILABLE_MESSAGE =
            "The assistant is temporarily unavailable. Please try again in a moment.";

    private final LlmClient llmClient;
    private final ConversationMemory memory;
    private final ConversationService conversationService;

    @Value("${chat.system-prompt:You are a helpful assistant running on a local model. Answer clearly and concisely.}")
    private String systemPrompt;

    public ChatAgent(LlmClient llmClient,
                     ConversationMemory memory,
                     ConversationService conversationService) {
        this.llmClient = llmClient;
        this.memory = memory;
        this.conversationService = conversationService;
    }

    public ChatResponse chat(ChatRequest request) {
        String sessionId = resolveSessionId(request.getSessionId());
        String userId    = request.getUserId() != null ? request.getUserId() : "default";
        long start = System.currentTimeMillis();

        log.info("Chat started [sessionId={}, userId={}, cache={}]", sessionId, userId, request.cacheRequested());

        ChatResponse response = null;
        String errorType = null;
        LlmResponse llmResponse = null;

        try {
            Message userMessage = Message.user(request.getMessage());

            List<Message> messages = new ArrayList<>();
            messages.add(Message.system(systemPrompt));
            messages.addAll(memory.load(sessionId));
            messages.add(userMessage);

            llmResponse = llmClient.chat(messages, request.cacheRequested());
            memory.append(sessionId, userMessage, Message.assistant(llmResponse.getContent()));

            response = respond(sessionId, ChatOutcome.SUCCESS, llmResponse.getContent(), llmResponse, start);

        } catch (PermanentFailureException e) {
            log.warn("LLM rejected request [sessionId={}]: {}", sessionId, e.getMessage());
            errorType = e.getClass().getSimpleName();
            response = respond(sessionId, ChatOutcome.REJECTED, e.getMessage(), null, start);

        } catch (ServiceUnavailableException e) {
            log.warn("LLM unavailable [sessionId={}, cause={}]: {}",
                    sessionId, e.getClass().getSimpleName(), e.getMessage());
            errorType = e.getClass().getSimpleName();
            response = respond(sessionId, ChatOutcome.UNAVAILABLE, UNAVAILABLE_MESSAGE, null, start);

        } catch (AgentException e) {
            log.error("Chat failed [sessionId={}]", sessionId, e);
            errorType = e.getClass().getSimpleName();
            response = respond(sessionId, ChatOutcome.ERROR, "An error occurred: " + e.getMessage(), null, start);

        } finally {
            // Always record the turn, even on error
            if (response != null) {
                conversationService.recordTurn(toTurn(request, userId, response, llmResponse, errorType));
            }
        }

        log.info("Chat complete [sessionId={}, outcome={}, cached={}, latency={}ms]",
                sessionId, response.getOutcome(), response.isCached(), response.getDurationMs());
        return response;
    }

    private ChatResponse respond(String sessionId, ChatOutcome outcome, String answer,
                                 LlmResponse llmResponse, long start) {
        return ChatResponse.builder()
                .sessionId(sessionId)
                .outcome(outcome)
                .answer(answer)
                .cached(llmResponse != null && llmResponse.isCached())
                .promptTokens(llmResponse != null ? llmResponse.getPromptTokens() : 0)
                .completionTokens(llmResponse != null ? llmResponse.getCompletionTokens() : 0)
                .durationMs(System.currentTimeMillis() - start)
                .build();
    }

    private ChatTurn toTurn(ChatRequest request, String userId, ChatResponse response,
                            LlmResponse llmResponse, String errorType) {
        return ChatTurn.builder()
                .sessionId(response.getSessionId())
                .userId(userId)
                .userMessage(request.getMessage())
                .answer(response.getAnswer())
                .outcome(response.getOutcome())
                .errorType(errorType)
                .cached(response.isCached())
                .model(llmResponse != null ? llmResponse.getModel() : llmClient.modelName())
                .latencyMs(response.getDurationMs())
                .promptTokens(response.getPromptTokens())
                .completionTokens(response.getCompletionTokens())
                .build();
    }

    private String resolveSessionId(String provided) {
        return (provided != null && !provided.isBlank()) ? provided : UUID.randomUUID().toString();
    }
}
