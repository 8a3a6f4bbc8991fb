package com.eainde.athlete.nodes;

/**
 * Every step of the answer graph. Routing tables are keyed by these constants, so a missing or
 * misspelled target is caught when the graph is compiled.
 */
public enum NodeId {
    CLASSIFIER,
    CLARIFY,
    QUERY_PLANNER,
    RETRIEVER,
    RETRIEVAL_EXPANDER,
    RESEARCHER,
    SYNTHESIZER,
    QUALITY_CHECKER,
    ESCALATE,
    CITATION_BUILDER,
    DISCLAIMER_GUARD
}
