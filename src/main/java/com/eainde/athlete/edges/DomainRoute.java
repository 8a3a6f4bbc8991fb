package com.eainde.athlete.edges;

/** Outcomes of the post-classification router. */
public enum DomainRoute {
    CLARIFY,
    ESCALATE,
    PLAN
}
