package com.eainde.athlete.nodes;

import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.llm.AnswerReview;
import com.eainde.athlete.llm.AnswerReviewer;
import com.eainde.athlete.state.QualityCheckResult;
import com.eainde.athlete.state.QualityIssue;
import com.eainde.athlete.state.RunState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Scores the draft answer against the evidence. A draft passes when its score reaches the
 * configured threshold and no issue is critical.
 * <p>
 * Fails open: when the check itself cannot run the draft passes, since a possibly imperfect
 * answer is preferred over none. The fixed fallback answers pass without a model call.
 */
@Slf4j
@Component
public class QualityCheckerNode implements AsyncNodeAction<RunState> {

    private final AnswerReviewer reviewer;
    private final AgentProperties.Quality settings;

    public QualityCheckerNode(AnswerReviewer reviewer, AgentProperties properties) {
        this.reviewer = reviewer;
        this.settings = properties.getQuality();
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RunState state) {
        String answer = state.getAnswer();
        if (answer == null || answer.isBlank()
                || SynthesizerNode.NO_EVIDENCE_ANSWER.equals(answer)
                || SynthesizerNode.ERROR_ANSWER.equals(answer)) {
            return done(QualityCheckResult.pass("Fixed answer, not reviewed"));
        }

        try {
            AnswerReview review = reviewer.review(state.getCurrentQuestion(), answer,
                    SynthesizerNode.formatDocuments(state.getRetrievedDocuments()),
                    String.join("\n\n", state.getWebSearchResults()));
            if (review == null) {
                log.warn("Quality checker returned nothing, passing the draft");
                return done(QualityCheckResult.pass("Quality check output unreadable"));
            }
            QualityCheckResult result = evaluate(review);
            log.info("Quality check: passed={} score={} issues={} (attempt {})",
                    result.passed(), result.score(), result.issues().size(), state.getQualityRetryCount() + 1);
            return done(result);
        } catch (RuntimeException e) {
            log.warn("Quality check failed, passing the draft: {}", e.getMessage());
            return done(QualityCheckResult.pass("Quality check unavailable"));
        }
    }

    QualityCheckResult evaluate(AnswerReview review) {
        double score = review.score() == null ? 1.0 : review.score();
        List<QualityIssue> issues = new ArrayList<>();
        if (review.issues() != null) {
            for (AnswerReview.ReviewIssue issue : review.issues()) {
                if (issue == null) {
                    continue;
                }
                issues.add(new QualityIssue(
                        Objects.requireNonNullElse(issue.type(), "other"),
                        Objects.requireNonNullElse(issue.severity(), "minor"),
                        Objects.requireNonNullElse(issue.description(), "")));
            }
        }
        boolean critical = issues.stream().anyMatch(QualityIssue::isCritical);
        boolean passed = score >= settings.getPassThreshold() && !critical;
        return new QualityCheckResult(passed, score, List.copyOf(issues),
                Objects.requireNonNullElse(review.critique(), ""));
    }

    private static CompletableFuture<Map<String, Object>> done(QualityCheckResult result) {
        return CompletableFuture.completedFuture(Map.of(RunState.QUALITY_CHECK_RESULT, result));
    }
}
