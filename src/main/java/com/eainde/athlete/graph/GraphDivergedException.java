package com.eainde.athlete.graph;

import com.eainde.athlete.exception.AgentException;

public class GraphDivergedException extends AgentException {

    public GraphDivergedException(int maxSteps, String lastNode) {
        super("GRAPH_DIVERGED", "Run exceeded " + maxSteps + " steps without reaching END (last node: " + lastNode + ")");
    }
}
