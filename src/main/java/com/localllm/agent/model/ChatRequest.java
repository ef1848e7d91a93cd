package com.localllm.agent.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ChatRequest {

    @NotBlank(message = "message must not be blank")
    @Size(max = 32000, message = "message must be at most 32000 characters")
    private String message;

    /**
     * Optional. If provided, the conversation continues in this session.
     * If null, a new session is created.
     */
    private String sessionId;

    /** Optional, defaults to "default". */
    private String userId;

    /** Optional. Set to false to bypass the response cache for this request. */
    private Boolean useCache;

    public boolean cacheRequested() {
        return useCache == null || useCache;
    }
}
