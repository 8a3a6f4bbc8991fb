package com.eainde.athlete.graph;

import org.bsc.langgraph4j.state.AgentState;

/**
 * One item of a streamed run: either a {@link Snapshot} after a node completed, or a
 * {@link TokenFragment} produced while a node was generating text.
 */
public interface StreamChunk<N extends Enum<N>, S extends AgentState> {

    N node();
}
