package com.eainde.athlete.llm;

import dev.langchain4j.data.message.ChatMessage;

import java.util.List;
import java.util.function.Consumer;

/**
 * Language-model access used by the nodes. Implementations pick the model bound to the role and
 * wrap the call in the dependency's circuit breaker.
 */
public interface LlmClient {

    /**
     * Blocking completion.
     *
     * @return the model's text answer
     * @throws com.eainde.athlete.exception.AgentException on failure, breaker-open and timeout included
     */
    String invoke(ModelRole role, List<ChatMessage> messages);

    /**
     * Streaming completion. Every partial response is handed to {@code tokens} as it arrives; the
     * full text is returned once the model completes.
     */
    String stream(ModelRole role, List<ChatMessage> messages, Consumer<String> tokens);
}
