package com.eainde.athlete.state;

import java.io.Serializable;

/**
 * A fused retrieval hit.
 *
 * @param id       chunk id of the first copy seen
 * @param content  chunk text, the fusion and deduplication key
 * @param metadata chunk metadata
 * @param score    fused RRF score
 * @param distance raw vector distance, null when the chunk only came from lexical search
 */
public record RetrievedDocument(
        String id,
        String content,
        DocumentMetadata metadata,
        double score,
        Double distance) implements Serializable {
}
