package com.eainde.athlete.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Reviewer output. {@code score} is nullable: a review without one counts as a full score.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnswerReview(Double score, List<ReviewIssue> issues, String critique) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReviewIssue(String type, String severity, String description) {
    }
}
