package com.eainde.athlete.memory;

import com.eainde.athlete.llm.LlmClient;
import com.eainde.athlete.llm.ModelRole;
import com.eainde.athlete.prompt.PromptService;
import com.eainde.athlete.resilience.DependencyGuard;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Loads and refreshes the rolling conversation summary.
 * <p>
 * Neither operation can fail a run: store access goes through the {@code summary} breaker with a
 * fallback, and a failed summary generation keeps the previous summary.
 */
@Slf4j
public class ConversationMemory {

    private final ConversationSummaryStore store;
    private final DependencyGuard breaker;
    private final LlmClient llmClient;
    private final PromptService promptService;
    private final Executor executor;
    private final Duration ttl;

    public ConversationMemory(ConversationSummaryStore store, DependencyGuard breaker, LlmClient llmClient,
                              PromptService promptService, Executor executor, Duration ttl) {
        this.store = store;
        this.breaker = breaker;
        this.llmClient = llmClient;
        this.promptService = promptService;
        this.executor = executor;
        this.ttl = ttl;
    }

    public Optional<String> load(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        return breaker.executeWithFallback(() -> store.get(conversationId), Optional::empty);
    }

    /**
     * Folds the latest exchange into the summary in the background.
     *
     * @return completes when the summary has been stored or the update was abandoned
     */
    public CompletableFuture<Void> updateAsync(String conversationId, String previousSummary,
                                               String question, String answer) {
        if (conversationId == null || answer == null || answer.isBlank()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            String summary = summarize(previousSummary, question, answer);
            if (summary == null || summary.isBlank()) {
                return;
            }
            breaker.executeWithFallback(() -> {
                store.upsert(conversationId, summary, ttl);
                return Boolean.TRUE;
            }, () -> Boolean.FALSE);
            log.debug("Conversation summary updated for {}", conversationId);
        }, executor);
    }

    private String summarize(String previousSummary, String question, String answer) {
        try {
            String system = promptService.render("conversation-summary", Map.of(
                    "previousSummary", previousSummary == null ? "(none)" : previousSummary));
            String exchange = "User: " + question + "\n\nAssistant: " + answer;
            return llmClient.invoke(ModelRole.SUMMARY, List.of(SystemMessage.from(system), UserMessage.from(exchange)));
        } catch (RuntimeException e) {
            log.warn("Summary generation failed, keeping previous summary: {}", e.getMessage());
            return previousSummary;
        }
    }
}
