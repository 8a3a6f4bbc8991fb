package com.eainde.athlete.graph;

import com.eainde.athlete.exception.AgentException;

import java.time.Duration;

public class GraphTimeoutException extends AgentException {

    public GraphTimeoutException(Duration timeout, String where) {
        super("GRAPH_TIMEOUT", "Run deadline of " + timeout.toMillis() + "ms exceeded " + where);
    }
}
