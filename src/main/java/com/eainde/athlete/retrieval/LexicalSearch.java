package com.eainde.athlete.retrieval;

import java.util.List;

/**
 * Keyword search over chunk text, best match first.
 */
public interface LexicalSearch {

    List<LexicalMatch> search(String query, int k, SearchFilter filter);
}
