package com.eainde.athlete.graph;

import com.eainde.athlete.exception.AgentException;

public class NodeExecutionException extends AgentException {

    private final String node;

    public NodeExecutionException(String node, Throwable cause) {
        super("NODE_FAILED", "Node " + node + " failed: " + cause.getMessage(), cause);
        this.node = node;
    }

    public String getNode() {
        return node;
    }
}
