package com.eainde.athlete.graph;

import com.eainde.athlete.exception.AgentException;
import org.bsc.langgraph4j.state.AgentState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single ordered source of {@link StreamChunk}s for one streamed run.
 * <p>
 * The run produces snapshots and token fragments into one queue, so their relative order is the
 * order in which they happened. The consumer side checks the stream deadline before every chunk:
 * once it has passed, {@link #hasNext()} throws {@link GraphTimeoutException}, the producer is
 * asked to stop, and no further chunks are delivered. A failed run rethrows its error from
 * {@link #hasNext()}.
 */
public final class GraphStream<N extends Enum<N>, S extends AgentState>
        implements Iterator<StreamChunk<N, S>>, AutoCloseable {

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final Instant deadline;
    private final Duration timeout;
    private final Clock clock;

    private volatile boolean cancelled;
    private StreamChunk<N, S> lookahead;
    private boolean finished;
    private S finalState;

    GraphStream(Instant deadline, Duration timeout, Clock clock) {
        this.deadline = deadline;
        this.timeout = timeout;
        this.clock = clock;
    }

    // ---------------------------------------------------------------- producer side

    void emit(StreamChunk<N, S> chunk) {
        if (!cancelled) {
            queue.add(chunk);
        }
    }

    void complete(S state) {
        queue.add(new Completed<>(state));
    }

    void fail(RuntimeException error) {
        queue.add(new Failed(error));
    }

    boolean isCancelled() {
        return cancelled;
    }

    // ---------------------------------------------------------------- consumer side

    @Override
    @SuppressWarnings("unchecked")
    public boolean hasNext() {
        if (lookahead != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        Object item = take();
        if (item instanceof StreamChunk<?, ?> chunk) {
            lookahead = (StreamChunk<N, S>) chunk;
            return true;
        }
        finished = true;
        if (item instanceof Completed<?> completed) {
            finalState = (S) completed.state();
            return false;
        }
        throw ((Failed) item).error();
    }

    @Override
    public StreamChunk<N, S> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        StreamChunk<N, S> chunk = lookahead;
        lookahead = null;
        return chunk;
    }

    /** Final state, present once the stream has been drained after a successful run. */
    public Optional<S> getFinalState() {
        return Optional.ofNullable(finalState);
    }

    /** Stops the producer at its next step boundary. Safe to call more than once. */
    @Override
    public void close() {
        cancelled = true;
        finished = true;
        lookahead = null;
        queue.clear();
    }

    private Object take() {
        long remaining = Duration.between(clock.instant(), deadline).toNanos();
        if (remaining <= 0) {
            throw timedOut();
        }
        try {
            Object item = queue.poll(remaining, TimeUnit.NANOSECONDS);
            if (item == null) {
                throw timedOut();
            }
            return item;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled = true;
            finished = true;
            throw new AgentException("INTERRUPTED", "Interrupted while waiting for the next chunk", e);
        }
    }

    private GraphTimeoutException timedOut() {
        cancelled = true;
        finished = true;
        queue.clear();
        return new GraphTimeoutException(timeout, "while streaming");
    }

    private record Completed<S>(S state) {
    }

    private record Failed(RuntimeException error) {
    }
}
