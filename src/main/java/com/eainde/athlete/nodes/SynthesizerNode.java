package com.eainde.athlete.nodes;

import com.eainde.athlete.graph.ActiveRuns;
import com.eainde.athlete.knowledge.EmpathyTemplates;
import com.eainde.athlete.llm.LlmClient;
import com.eainde.athlete.llm.ModelRole;
import com.eainde.athlete.prompt.PromptService;
import com.eainde.athlete.state.DocumentMetadata;
import com.eainde.athlete.state.QualityCheckResult;
import com.eainde.athlete.state.RetrievedDocument;
import com.eainde.athlete.state.RunState;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Writes the answer from the retrieved documents and web results, streaming tokens as they are
 * generated. This is the only node whose tokens reach the client as text.
 * <p>
 * Runs again after a failed quality check with the checker's critique added to its
 * instructions; each such rerun increments {@code qualityRetryCount}. With no evidence at all
 * it returns {@link #NO_EVIDENCE_ANSWER} without calling the model.
 */
@Slf4j
@Component
public class SynthesizerNode implements AsyncNodeAction<RunState> {

    public static final String NO_EVIDENCE_ANSWER = "I couldn't find information about this in the governance "
            + "documents available to me. Please contact the Athlete Ombuds at ombudsman@usathlete.org or "
            + "719-866-5000 for direct help with your question.";

    public static final String ERROR_ANSWER = "I encountered an error while preparing your answer. Please try "
            + "again, or contact the Athlete Ombuds at ombudsman@usathlete.org or 719-866-5000 for direct help.";

    private final LlmClient llmClient;
    private final PromptService promptService;
    private final EmpathyTemplates empathy;
    private final ActiveRuns activeRuns;

    public SynthesizerNode(LlmClient llmClient, PromptService promptService, EmpathyTemplates empathy,
                           ActiveRuns activeRuns) {
        this.llmClient = llmClient;
        this.promptService = promptService;
        this.empathy = empathy;
        this.activeRuns = activeRuns;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RunState state) {
        QualityCheckResult previousCheck = state.getQualityCheckResult();
        boolean retry = previousCheck != null && !previousCheck.passed();
        int retryCount = retry ? state.getQualityRetryCount() + 1 : state.getQualityRetryCount();

        Map<String, Object> patch = new HashMap<>();
        patch.put(RunState.QUALITY_RETRY_COUNT, retryCount);

        if (state.getRetrievedDocuments().isEmpty() && state.getWebSearchResults().isEmpty()) {
            log.info("No evidence available, returning the fixed fallback answer");
            patch.put(RunState.ANSWER, NO_EVIDENCE_ANSWER);
            patch.put(RunState.DISCLAIMER_REQUIRED, false);
            return CompletableFuture.completedFuture(patch);
        }

        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(systemPrompt(state, retry ? previousCheck.critique() : null)));
        messages.add(UserMessage.from(state.getCurrentQuestion()));

        String answer;
        try {
            answer = llmClient.stream(ModelRole.SYNTHESIZER, messages,
                    token -> activeRuns.emitToken(state.getRunId(), NodeId.SYNTHESIZER, token));
            if (answer == null || answer.isBlank()) {
                log.warn("Synthesizer returned an empty answer");
                answer = ERROR_ANSWER;
            }
        } catch (RuntimeException e) {
            log.error("Answer generation failed (attempt {}): {}", retryCount + 1, e.getMessage());
            answer = ERROR_ANSWER;
        }
        patch.put(RunState.ANSWER, answer);
        return CompletableFuture.completedFuture(patch);
    }

    private String systemPrompt(RunState state, String critique) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("documents", formatDocuments(state.getRetrievedDocuments()));
        variables.put("webResults", state.getWebSearchResults().isEmpty()
                ? "(none)" : String.join("\n\n", state.getWebSearchResults()));
        variables.put("history", ConversationContext.formatHistory(state.getMessages()));
        variables.put("summary", Optional.ofNullable(state.getConversationSummary()).orElse(""));
        variables.put("sport", Optional.ofNullable(state.getUserSport()).orElse("unknown"));
        variables.put("tone", empathy.toneGuidance(state.getEmotionalState()));
        variables.put("feedback", critique == null || critique.isBlank() ? ""
                : "A reviewer rejected your previous draft. Address this feedback:\n" + critique);
        return promptService.render("synthesizer", variables);
    }

    static String formatDocuments(List<RetrievedDocument> documents) {
        if (documents.isEmpty()) {
            return "(none)";
        }
        StringBuilder formatted = new StringBuilder();
        for (int i = 0; i < documents.size(); i++) {
            RetrievedDocument document = documents.get(i);
            DocumentMetadata metadata = Optional.ofNullable(document.metadata()).orElse(DocumentMetadata.empty());
            formatted.append('[').append(i + 1).append("] ")
                    .append(Optional.ofNullable(metadata.documentTitle()).orElse("Untitled document"));
            if (metadata.sectionTitle() != null) {
                formatted.append(" / ").append(metadata.sectionTitle());
            }
            if (metadata.sourceUrl() != null) {
                formatted.append(" (").append(metadata.sourceUrl()).append(')');
            }
            if (metadata.authorityLevel() != null) {
                formatted.append(" [authority: ").append(metadata.authorityLevel()).append(']');
            }
            formatted.append('\n').append(document.content()).append("\n\n");
        }
        return formatted.toString().trim();
    }
}
