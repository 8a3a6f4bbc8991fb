package com.eainde.athlete.nodes;

import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.llm.AnswerReview;
import com.eainde.athlete.llm.AnswerReview.ReviewIssue;
import com.eainde.athlete.llm.AnswerReviewer;
import com.eainde.athlete.state.QualityCheckResult;
import com.eainde.athlete.state.RunState;
import dev.langchain4j.service.output.OutputParsingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.eainde.athlete.nodes.NodeFixtures.document;
import static com.eainde.athlete.nodes.NodeFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QualityCheckerNodeTest {

    @Mock
    private AnswerReviewer reviewer;

    private QualityCheckerNode node;

    @BeforeEach
    void setUp() {
        node = new QualityCheckerNode(reviewer, new AgentProperties());
    }

    private QualityCheckResult check(String answer) {
        RunState state = state("How do I appeal a selection decision?",
                RunState.ANSWER, answer,
                RunState.RETRIEVED_DOCUMENTS, List.of(document("a", "Procedures", "Appeals", "Within 48 hours.", 0.2)));
        return (QualityCheckResult) node.apply(state).join()
                .get(RunState.QUALITY_CHECK_RESULT);
    }

    private void reviews(AnswerReview review) {
        when(reviewer.review(anyString(), anyString(), anyString(), anyString())).thenReturn(review);
    }

    @Test
    @DisplayName("passes a draft scoring at or above the threshold")
    void passes() {
        reviews(new AnswerReview(0.6, List.of(new ReviewIssue("style", "minor", null)), "fine"));

        QualityCheckResult result = check("File within 48 hours [1].");

        assertThat(result.passed()).isTrue();
        assertThat(result.issues()).hasSize(1);
    }

    @Test
    @DisplayName("fails a low-scoring draft and keeps the critique")
    void failsLowScore() {
        reviews(new AnswerReview(0.3, List.of(), "Missing the deadline."));

        QualityCheckResult result = check("You can appeal.");

        assertThat(result.passed()).isFalse();
        assertThat(result.critique()).isEqualTo("Missing the deadline.");
    }

    @Test
    @DisplayName("a critical issue fails the draft regardless of score")
    void criticalIssue() {
        reviews(new AnswerReview(0.95, List.of(new ReviewIssue("hallucination", "critical", "invented deadline")),
                null));

        assertThat(check("Appeal within 90 days.").passed()).isFalse();
    }

    @Test
    @DisplayName("passes the draft when the check cannot run")
    void failOpen() {
        when(reviewer.review(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("timeout"));

        assertThat(check("Any draft.").passed()).isTrue();
    }

    @Test
    @DisplayName("passes unreadable checker output")
    void unreadable() {
        when(reviewer.review(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new OutputParsingException("Looks good to me!", null));

        assertThat(check("Any draft.").passed()).isTrue();
    }

    @Test
    @DisplayName("fixed answers are not reviewed")
    void fixedAnswers() {
        assertThat(check(SynthesizerNode.NO_EVIDENCE_ANSWER).passed()).isTrue();
        assertThat(check(SynthesizerNode.ERROR_ANSWER).passed()).isTrue();
        verifyNoInteractions(reviewer);
    }

    @Test
    @DisplayName("a review without a score counts as a full score")
    void missingScore() {
        reviews(new AnswerReview(null, null, null));

        QualityCheckResult result = check("File within 48 hours [1].");

        assertThat(result.passed()).isTrue();
        assertThat(result.score()).isEqualTo(1.0);
        assertThat(result.critique()).isEmpty();
    }

    @Test
    @DisplayName("sends the question, draft and numbered evidence to the reviewer")
    void reviewInputs() {
        reviews(new AnswerReview(0.9, List.of(), ""));

        check("File within 48 hours [1].");

        verify(reviewer).review(eq("How do I appeal a selection decision?"), eq("File within 48 hours [1]."),
                contains("[1] Procedures / Appeals"), eq(""));
    }
}
