package com.eainde.athlete.nodes;

import com.eainde.athlete.llm.Classification;
import com.eainde.athlete.llm.QueryClassifier;
import com.eainde.athlete.state.EmotionalState;
import com.eainde.athlete.state.EscalationCategory;
import com.eainde.athlete.state.QueryIntent;
import com.eainde.athlete.state.RunState;
import com.eainde.athlete.state.TopicDomain;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Classifies the question: topic domain, organizations mentioned, intent, urgency signals,
 * whether it must escalate or needs clarification, and the user's emotional state.
 * <p>
 * Fails open: if the model call fails or its JSON cannot be mapped the run continues as a
 * general, non-escalating, neutral question.
 */
@Slf4j
@Component
public class ClassifierNode implements AsyncNodeAction<RunState> {

    private static final String DOMAINS =
            Arrays.stream(TopicDomain.values()).map(TopicDomain::value).collect(Collectors.joining(", "));

    private final QueryClassifier classifier;

    public ClassifierNode(QueryClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RunState state) {
        String question = state.getCurrentQuestion();
        if (question.isBlank()) {
            return CompletableFuture.completedFuture(defaults());
        }

        Classification classification;
        try {
            classification = classifier.classify(question, DOMAINS,
                    ConversationContext.formatHistory(state.getMessages()),
                    Optional.ofNullable(state.getConversationSummary()).orElse(""));
        } catch (RuntimeException e) {
            log.warn("Classification failed, continuing with defaults: {}", e.getMessage());
            return CompletableFuture.completedFuture(defaults());
        }
        if (classification == null) {
            log.warn("Classifier returned nothing, continuing with defaults");
            return CompletableFuture.completedFuture(defaults());
        }
        return CompletableFuture.completedFuture(toPatch(classification));
    }

    private Map<String, Object> toPatch(Classification result) {
        Map<String, Object> patch = defaults();

        TopicDomain.fromValue(result.topicDomain()).ifPresent(d -> patch.put(RunState.TOPIC_DOMAIN, d));

        List<String> orgIds = new ArrayList<>();
        if (result.detectedNgbIds() != null) {
            for (String id : result.detectedNgbIds()) {
                if (id != null && !id.isBlank()) {
                    orgIds.add(id.trim());
                }
            }
        }
        patch.put(RunState.DETECTED_ORG_IDS, List.copyOf(orgIds));

        boolean shouldEscalate = result.shouldEscalate();
        QueryIntent intent = shouldEscalate ? QueryIntent.ESCALATION : QueryIntent.fromValue(result.queryIntent());
        patch.put(RunState.QUERY_INTENT, intent);
        patch.put(RunState.HAS_TIME_CONSTRAINT, result.hasTimeConstraint());

        if (intent == QueryIntent.ESCALATION) {
            String reason = result.escalationReason();
            if (reason != null && !reason.isBlank()) {
                patch.put(RunState.ESCALATION_REASON, reason);
            }
            EscalationCategory.fromValue(result.escalationCategory())
                    .ifPresent(c -> patch.put(RunState.ESCALATION_CATEGORY, c));
        }

        String clarification = result.clarificationQuestion();
        if (result.needsClarification() && clarification != null && !clarification.isBlank()
                && intent != QueryIntent.ESCALATION) {
            patch.put(RunState.NEEDS_CLARIFICATION, true);
            patch.put(RunState.CLARIFICATION_QUESTION, clarification);
        }

        patch.put(RunState.EMOTIONAL_STATE, EmotionalState.fromValue(result.emotionalState()));
        log.info("Classified as domain={} intent={} escalate={} clarify={}",
                patch.get(RunState.TOPIC_DOMAIN), intent, shouldEscalate, patch.get(RunState.NEEDS_CLARIFICATION));
        return patch;
    }

    private static Map<String, Object> defaults() {
        Map<String, Object> patch = new HashMap<>();
        patch.put(RunState.DETECTED_ORG_IDS, List.of());
        patch.put(RunState.QUERY_INTENT, QueryIntent.GENERAL);
        patch.put(RunState.HAS_TIME_CONSTRAINT, false);
        patch.put(RunState.NEEDS_CLARIFICATION, false);
        patch.put(RunState.EMOTIONAL_STATE, EmotionalState.NEUTRAL);
        return patch;
    }
}
