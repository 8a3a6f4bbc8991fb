package com.eainde.athlete.nodes;

import com.eainde.athlete.knowledge.EmpathyTemplates;
import com.eainde.athlete.state.EmotionalState;
import com.eainde.athlete.state.RunState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.eainde.athlete.nodes.NodeFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;

class ClarifyNodeTest {

    private final ClarifyNode node = new ClarifyNode(new EmpathyTemplates());

    @Test
    @DisplayName("answers with the classifier's question and opts out of the disclaimer")
    void asksQuestion() {
        Map<String, Object> patch = node.apply(state("What are the rules?",
                RunState.CLARIFICATION_QUESTION, "Which sport do you compete in?")).join();

        assertThat(patch)
                .containsEntry(RunState.ANSWER, "Which sport do you compete in?")
                .containsEntry(RunState.DISCLAIMER_REQUIRED, false);
    }

    @Test
    @DisplayName("uses a generic question when none was provided, with the empathy preamble")
    void defaultQuestion() {
        Map<String, Object> patch = node.apply(state("Help!", RunState.EMOTIONAL_STATE, EmotionalState.PANICKED)).join();

        assertThat((String) patch.get(RunState.ANSWER))
                .startsWith("I understand this feels overwhelming")
                .endsWith(ClarifyNode.DEFAULT_QUESTION);
    }
}
