package com.eainde.athlete.retrieval;

import com.eainde.athlete.state.RetrievedDocument;

import java.util.List;

public record RetrievalResult(List<RetrievedDocument> documents, double confidence) {

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), 0.0);
    }
}
