package com.eainde.athlete.edges;

/** Outcomes of the evidence-sufficiency router. */
public enum EvidenceRoute {
    SYNTHESIZE,
    EXPAND,
    RESEARCH
}
