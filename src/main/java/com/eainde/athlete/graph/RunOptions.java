package com.eainde.athlete.graph;

import java.time.Duration;

/**
 * Per-run limits.
 *
 * @param timeout  wall-clock budget, checked at every step boundary
 * @param maxSteps node executions allowed before the run is declared diverged
 * @param threadId run id and checkpoint thread id, generated when null
 */
public record RunOptions(Duration timeout, int maxSteps, String threadId) {

    public RunOptions {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Run timeout must be positive");
        }
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be positive");
        }
    }

    public static RunOptions of(Duration timeout, int maxSteps) {
        return new RunOptions(timeout, maxSteps, null);
    }

    public RunOptions withThreadId(String threadId) {
        return new RunOptions(timeout, maxSteps, threadId);
    }
}
