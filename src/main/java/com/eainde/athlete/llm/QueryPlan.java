package com.eainde.athlete.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryPlan(@JsonProperty("isComplex") boolean isComplex, List<PlannedQuery> subQueries) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlannedQuery(String query, String domain, List<String> ngbIds) {
    }
}
