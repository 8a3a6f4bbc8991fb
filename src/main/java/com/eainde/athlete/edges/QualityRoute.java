package com.eainde.athlete.edges;

/** Outcomes of the quality-loop router. */
public enum QualityRoute {
    ACCEPT,
    RETRY
}
