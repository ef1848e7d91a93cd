package com.localllm.agent.llm;

import com.localllm.agent.model.LlmResponse;
import com.localllm.agent.model.Message;

import java.util.List;

public interface LlmClient {

    /**
     * Send the conversation to the model and return its answer.
     *
     * @param messages full conversation so far (system + user + assistant turns)
     */
    LlmResponse chat(List<Message> messages);

    /**
     * Same as {@link #chat(List)}; {@code useCache=false} asks implementations that
     * cache answers to skip the cache for this call.
     */
    default LlmResponse chat(List<Message> messages, boolean useCache) {
        return chat(messages);
    }

    /** Model name requests are sent to. */
    String modelName();

    /** Models the backend currently serves. */
    List<String> listModels();
}
