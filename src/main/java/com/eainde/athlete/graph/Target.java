package com.eainde.athlete.graph;

/**
 * Destination of an edge: a node, or the terminal marker when {@code node} is null.
 */
public record Target<N extends Enum<N>>(N node) {

    public static <N extends Enum<N>> Target<N> of(N node) {
        if (node == null) {
            throw new IllegalArgumentException("Use Target.end() for the terminal marker");
        }
        return new Target<>(node);
    }

    public static <N extends Enum<N>> Target<N> end() {
        return new Target<>(null);
    }

    public boolean isEnd() {
        return node == null;
    }

    @Override
    public String toString() {
        return isEnd() ? "END" : node.name();
    }
}
