package com.eainde.athlete.llm;

import com.eainde.athlete.resilience.DependencyGuard;
import com.eainde.athlete.resilience.RetryExecutor;
import dev.langchain4j.model.ModelProvider;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;

import java.util.Set;

/**
 * Wraps a {@link ChatModel} so every call runs retried on transient errors inside the
 * {@code llm} circuit breaker. The typed AI services are built on top of this model.
 */
public class GuardedChatModel implements ChatModel {

    private final ChatModel delegate;
    private final DependencyGuard breaker;
    private final RetryExecutor retry;

    public GuardedChatModel(ChatModel delegate, DependencyGuard breaker, RetryExecutor retry) {
        this.delegate = delegate;
        this.breaker = breaker;
        this.retry = retry;
    }

    @Override
    public ChatResponse chat(ChatRequest chatRequest) {
        return breaker.execute(() -> retry.execute(() -> delegate.chat(chatRequest)));
    }

    @Override
    public ChatRequestParameters defaultRequestParameters() {
        return delegate.defaultRequestParameters();
    }

    @Override
    public Set<Capability> supportedCapabilities() {
        return delegate.supportedCapabilities();
    }

    @Override
    public ModelProvider provider() {
        return delegate.provider();
    }
}
