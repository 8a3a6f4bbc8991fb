package com.eainde.athlete.retrieval;

import java.util.List;

/**
 * Similarity search over embedded chunks, nearest first.
 */
public interface VectorSearch {

    List<VectorMatch> similaritySearch(String query, int k, SearchFilter filter);
}
