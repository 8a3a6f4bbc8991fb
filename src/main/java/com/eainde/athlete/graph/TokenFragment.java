package com.eainde.athlete.graph;

import org.bsc.langgraph4j.state.AgentState;

public record TokenFragment<N extends Enum<N>, S extends AgentState>(N node, String text)
        implements StreamChunk<N, S> {
}
