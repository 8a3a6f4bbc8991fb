package com.eainde.athlete.research;

import com.eainde.athlete.state.WebSearchResult;

import java.util.List;

public interface WebSearchClient {

    /**
     * @param includeDomains restrict results to these domains, empty for no restriction
     */
    List<WebSearchResult> search(String query, int maxResults, List<String> includeDomains);
}
