package com.eainde.athlete.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Raw classifier verdict. Enum-like fields stay strings here and are mapped by the node, so an
 * unknown value degrades to a default instead of failing the whole parse.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Classification(
        String topicDomain,
        List<String> detectedNgbIds,
        String queryIntent,
        boolean shouldEscalate,
        boolean hasTimeConstraint,
        String escalationReason,
        String escalationCategory,
        boolean needsClarification,
        String clarificationQuestion,
        String emotionalState) {
}
