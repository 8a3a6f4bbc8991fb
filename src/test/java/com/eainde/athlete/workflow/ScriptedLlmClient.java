package com.eainde.athlete.workflow;

import com.eainde.athlete.llm.LlmClient;
import com.eainde.athlete.llm.ModelRole;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Answers each role from a queue of canned replies; the last reply of a role repeats once the
 * queue is down to one. Streaming hands the reply over word by word. {@link #chatModel} exposes a
 * role's queue as a {@link ChatModel} for the typed AI services.
 */
class ScriptedLlmClient implements LlmClient {

    private final Map<ModelRole, Deque<String>> replies = new EnumMap<>(ModelRole.class);
    private final Map<ModelRole, Integer> calls = new EnumMap<>(ModelRole.class);

    ScriptedLlmClient reply(ModelRole role, String... texts) {
        replies.computeIfAbsent(role, r -> new ArrayDeque<>()).addAll(List.of(texts));
        return this;
    }

    int calls(ModelRole role) {
        return calls.getOrDefault(role, 0);
    }

    ChatModel chatModel(ModelRole role) {
        return new ChatModel() {
            @Override
            public ChatResponse doChat(ChatRequest chatRequest) {
                return ChatResponse.builder().aiMessage(AiMessage.from(next(role))).build();
            }
        };
    }

    @Override
    public String invoke(ModelRole role, List<ChatMessage> messages) {
        return next(role);
    }

    @Override
    public String stream(ModelRole role, List<ChatMessage> messages, Consumer<String> tokens) {
        String text = next(role);
        for (String word : text.split("(?<= )")) {
            tokens.accept(word);
        }
        return text;
    }

    private String next(ModelRole role) {
        calls.merge(role, 1, Integer::sum);
        Deque<String> queue = replies.get(role);
        if (queue == null || queue.isEmpty()) {
            throw new IllegalStateException("No scripted reply for " + role);
        }
        return queue.size() > 1 ? queue.poll() : queue.peek();
    }
}
