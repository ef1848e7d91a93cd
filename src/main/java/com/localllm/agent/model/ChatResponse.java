package com.localllm.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String answer;
    private String sessionId;
    private ChatOutcome outcome;
    private boolean cached;
    private long durationMs;
    private int promptTokens;
    private int completionTokens;
}
