package com.eainde.athlete.nodes;

import com.eainde.athlete.knowledge.EmpathyTemplates;
import com.eainde.athlete.state.RunState;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Answers with the classifier's follow-up question instead of guessing.
 */
@Component
public class ClarifyNode implements AsyncNodeAction<RunState> {

    static final String DEFAULT_QUESTION = "Could you share a bit more detail, such as your sport, "
            + "the organization involved, and what you would like to know?";

    private final EmpathyTemplates empathy;

    public ClarifyNode(EmpathyTemplates empathy) {
        this.empathy = empathy;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RunState state) {
        String question = state.getClarificationQuestion();
        if (question == null || question.isBlank()) {
            question = DEFAULT_QUESTION;
        }
        return CompletableFuture.completedFuture(Map.of(
                RunState.ANSWER, empathy.withPreamble(question, state.getEmotionalState()),
                RunState.DISCLAIMER_REQUIRED, false));
    }
}
