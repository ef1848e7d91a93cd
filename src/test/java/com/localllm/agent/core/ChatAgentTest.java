package com.localllm.agent.core;

import com.localllm.agent.conversation.ChatTurn;
import com.localllm.agent.conversation.ConversationMemory;
import com.localllm.agent.conversation.ConversationService;
import com.localllm.agent.exception.AgentException;
import com.localllm.agent.exception.CircuitOpenException;
import com.localllm.agent.exception.PermanentFailureException;
import com.localllm.agent.exception.RateLimitTimeoutException;
import com.localllm.agent.exception.RetryExhaustedException;
import com.localllm.agent.exception.TransientFailureException;
import com.localllm.agent.llm.LlmClient;
import com.localllm.agent.model.ChatOutcome;
import com.localllm.agent.model.ChatRequest;
import com.localllm.agent.model.ChatResponse;
import com.localllm.agent.model.LlmResponse;
import com.localllm.agent.model.Message;
import com.localllm.agent.resilience.CircuitState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ChatAgentTest {

    private LlmClient llmClient;
    private ConversationMemory memory;
    private ConversationService conversationService;
    private ChatAgent agent;

    @BeforeEach
    void setUp() {
        llmClient = mock(LlmClient.class);
        memory = mock(ConversationMemory.class);
        conversationService = mock(ConversationService.class);
        when(memory.load(anyString())).thenReturn(new ArrayList<>());
        when(llmClient.modelName()).thenReturn("qwen2.5:7b-instruct");

        agent = new ChatAgent(llmClient, memory, conversationService);
        ReflectionTestUtils.setField(agent, "systemPrompt", "You are a test assistant.");
    }

    @Test
    void chat_success_returnsAnswerAndSavesExchange() {
        when(llmClient.chat(anyList(), anyBoolean())).thenReturn(LlmResponse.builder()
                .content("4").model("qwen2.5:7b-instruct").promptTokens(10).completionTokens(1).build());

        ChatResponse response = agent.chat(request("What is 2+2?", "s-1"));

        assertThat(response.getOutcome()).isEqualTo(ChatOutcome.SUCCESS);
        assertThat(response.getAnswer()).isEqualTo("4");
        assertThat(response.getSessionId()).isEqualTo("s-1");
        assertThat(response.getPromptTokens()).isEqualTo(10);
        verify(memory).append(eq("s-1"), argThat(m -> m.getContent().equals("What is 2+2?")),
                argThat(m -> m.getContent().equals("4")));
    }

    @Test
    void chat_buildsPromptFromSystemHistoryAndUserMessage() {
        when(memory.load("s-1")).thenReturn(new ArrayList<>(List.of(
                Message.user("Hi"), Message.assistant("Hello!"))));
        when(llmClient.chat(anyList(), anyBoolean())).thenReturn(LlmResponse.builder().content("ok").build());

        agent.chat(request("And now?", "s-1"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> captor = ArgumentCaptor.forClass(List.class);
        verify(llmClient).chat(captor.capture(), eq(true));
        assertThat(captor.getValue())
                .extracting(Message::getRole)
                .containsExactly(Message.Role.system, Message.Role.user, Message.Role.assistant, Message.Role.user);
        assertThat(captor.getValue().get(0).getContent()).isEqualTo("You are a test assistant.");
        assertThat(captor.getValue().get(3).getContent()).isEqualTo("And now?");
    }

    @Test
    void chat_useCacheFalse_passedToClient() {
        when(llmClient.chat(anyList(), anyBoolean())).thenReturn(LlmResponse.builder().content("ok").build());
        ChatRequest request = request("fresh answer please", "s-1");
        request.setUseCache(false);

        agent.chat(request);

        verify(llmClient).chat(anyList(), eq(false));
    }

    @Test
    void chat_cachedAnswer_flaggedInResponse() {
        when(llmClient.chat(anyList(), anyBoolean()))
                .thenReturn(LlmResponse.builder().content("Paris.").cached(true).build());

        ChatResponse response = agent.chat(request("Capital of France?", "s-1"));

        assertThat(response.isCached()).isTrue();
    }

    @Test
    void chat_permanentFailure_surfacedVerbatim() {
        when(llmClient.chat(anyList(), anyBoolean()))
                .thenThrow(new PermanentFailureException("Model 'qwen' was not found on ollama.", 404));

        ChatResponse response = agent.chat(request("Hi", "s-1"));

        assertThat(response.getOutcome()).isEqualTo(ChatOutcome.REJECTED);
        assertThat(response.getAnswer()).isEqualTo("Model 'qwen' was not found on ollama.");
        verify(memory, never()).append(anyString(), any(), any());
    }

    @Test
    void chat_unavailableKinds_allTranslatedToOneMessage() {
        List<AgentException> unavailable = List.of(
                new RetryExhaustedException(4, new TransientFailureException("connection refused")),
                new CircuitOpenException("Circuit breaker 'llm' is open", CircuitState.OPEN),
                new RateLimitTimeoutException(Duration.ofSeconds(5)));

        for (AgentException error : unavailable) {
            when(llmClient.chat(anyList(), anyBoolean())).thenThrow(error);

            ChatResponse response = agent.chat(request("Hi", "s-1"));

            assertThat(response.getOutcome()).isEqualTo(ChatOutcome.UNAVAILABLE);
            assertThat(response.getAnswer()).isEqualTo(ChatAgent.UNAVAILABLE_MESSAGE);
        }
        verify(memory, never()).append(anyString(), any(), any());
    }

    @Test
    void chat_unexpectedAgentException_reportedAsError() {
        when(llmClient.chat(anyList(), anyBoolean())).thenThrow(new AgentException("ollama returned no choices"));

        ChatResponse response = agent.chat(request("Hi", "s-1"));

        assertThat(response.getOutcome()).isEqualTo(ChatOutcome.ERROR);
        assertThat(response.getAnswer()).contains("no choices");
    }

    @Test
    void chat_alwaysRecordsTurn_evenOnFailure() {
        when(llmClient.chat(anyList(), anyBoolean()))
                .thenThrow(new RetryExhaustedException(4, new TransientFailureException("down")));

        agent.chat(request("Hi", "s-1"));

        ArgumentCaptor<ChatTurn> captor = ArgumentCaptor.forClass(ChatTurn.class);
        verify(conversationService).recordTurn(captor.capture());
        ChatTurn turn = captor.getValue();
        assertThat(turn.getOutcome()).isEqualTo(ChatOutcome.UNAVAILABLE);
        assertThat(turn.getErrorType()).isEqualTo("RetryExhaustedException");
        assertThat(turn.getModel()).isEqualTo("qwen2.5:7b-instruct");
        assertThat(turn.getUserId()).isEqualTo("default");
    }

    @Test
    void chat_noSessionId_generatesOne() {
        when(llmClient.chat(anyList(), anyBoolean())).thenReturn(LlmResponse.builder().content("ok").build());

        ChatResponse response = agent.chat(request("Hi", null));

        assertThat(response.getSessionId()).isNotBlank();
    }

    private ChatRequest request(String message, String sessionId) {
        ChatRequest request = new ChatRequest();
        request.setMessage(message);
        request.setSessionId(sessionId);
        return request;
    }
}
