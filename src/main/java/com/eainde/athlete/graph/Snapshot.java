package com.eainde.athlete.graph;

import org.bsc.langgraph4j.state.AgentState;

/**
 * Merged state after {@code node} completed.
 */
public record Snapshot<N extends Enum<N>, S extends AgentState>(N node, int step, S state)
        implements StreamChunk<N, S> {
}
