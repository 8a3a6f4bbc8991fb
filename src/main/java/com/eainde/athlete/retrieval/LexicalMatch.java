package com.eainde.athlete.retrieval;

import com.eainde.athlete.state.DocumentMetadata;

public record LexicalMatch(String id, String content, DocumentMetadata metadata, double score) {
}
