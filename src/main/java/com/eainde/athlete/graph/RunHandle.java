package com.eainde.athlete.graph;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.BooleanSupplier;

/**
 * Limits and token sink of one run. Limits are only checked at step boundaries: a node that
 * is already running is never interrupted.
 */
final class RunHandle {

    private final String runId;
    private final RunOptions options;
    private final Instant deadline;
    private final Clock clock;
    private final BooleanSupplier cancelled;
    private final BiConsumer<String, String> tokenSink;
    private final AtomicInteger steps = new AtomicInteger();

    RunHandle(String runId, RunOptions options, Clock clock, BooleanSupplier cancelled,
              BiConsumer<String, String> tokenSink) {
        this.runId = runId;
        this.options = options;
        this.deadline = clock.instant().plus(options.timeout());
        this.clock = clock;
        this.cancelled = cancelled;
        this.tokenSink = tokenSink;
    }

    String getRunId() {
        return runId;
    }

    Instant getDeadline() {
        return deadline;
    }

    void beforeNode(String node) {
        checkBoundary("before " + node);
        if (steps.incrementAndGet() > options.maxSteps()) {
            throw new GraphDivergedException(options.maxSteps(), node);
        }
    }

    void checkBoundary(String where) {
        if (cancelled.getAsBoolean()) {
            throw new CancellationException("Stream closed " + where);
        }
        if (!clock.instant().isBefore(deadline)) {
            throw new GraphTimeoutException(options.timeout(), where);
        }
    }

    void emitToken(String node, String text) {
        if (tokenSink != null) {
            tokenSink.accept(node, text);
        }
    }
}
