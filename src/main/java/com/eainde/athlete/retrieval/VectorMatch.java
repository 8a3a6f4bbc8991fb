package com.eainde.athlete.retrieval;

import com.eainde.athlete.state.DocumentMetadata;

public record VectorMatch(String id, String content, DocumentMetadata metadata, double distance) {
}
