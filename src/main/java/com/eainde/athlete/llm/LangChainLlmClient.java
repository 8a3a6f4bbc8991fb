package com.eainde.athlete.llm;

import com.eainde.athlete.exception.AgentException;
import com.eainde.athlete.exception.LlmException;
import com.eainde.athlete.resilience.DependencyGuard;
import com.eainde.athlete.resilience.RetryExecutor;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link LlmClient} backed by LangChain4j chat models, one per {@link ModelRole}.
 * <p>
 * Blocking calls are retried on transient errors inside the {@code llm} circuit breaker.
 * Streaming calls are not retried: once tokens reached the client a replay would duplicate them.
 */
@Slf4j
public class LangChainLlmClient implements LlmClient {

    private final Map<ModelRole, ChatModel> chatModels;
    private final Map<ModelRole, StreamingChatModel> streamingModels;
    private final DependencyGuard breaker;
    private final RetryExecutor retry;

    public LangChainLlmClient(Map<ModelRole, ChatModel> chatModels,
                              Map<ModelRole, StreamingChatModel> streamingModels,
                              DependencyGuard breaker,
                              RetryExecutor retry) {
        this.chatModels = chatModels;
        this.streamingModels = streamingModels;
        this.breaker = breaker;
        this.retry = retry;
    }

    @Override
    public String invoke(ModelRole role, List<ChatMessage> messages) {
        ChatModel model = chatModels.get(role);
        if (model == null) {
            throw new LlmException("No chat model configured for role " + role, null);
        }
        return breaker.execute(() -> retry.execute(() -> {
            ChatResponse response = model.chat(messages);
            return response.aiMessage().text();
        }));
    }

    @Override
    public String stream(ModelRole role, List<ChatMessage> messages, Consumer<String> tokens) {
        StreamingChatModel model = streamingModels.get(role);
        if (model == null) {
            throw new LlmException("No streaming model configured for role " + role, null);
        }
        return breaker.execute(() -> {
            CompletableFuture<String> done = new CompletableFuture<>();
            AtomicBoolean closed = new AtomicBoolean();
            model.chat(messages, new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                    if (!closed.get() && partialResponse != null && !partialResponse.isEmpty()) {
                        tokens.accept(partialResponse);
                    }
                }

                @Override
                public void onCompleteResponse(ChatResponse completeResponse) {
                    done.complete(completeResponse.aiMessage().text());
                }

                @Override
                public void onError(Throwable error) {
                    done.completeExceptionally(error);
                }
            });
            try {
                return done.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof AgentException agentException) {
                    throw agentException;
                }
                throw new LlmException("Streaming call for " + role + " failed: " + cause.getMessage(), cause);
            } finally {
                // the breaker may have given up on us; drop late tokens
                closed.set(true);
            }
        });
    }
}
