package com.eainde.athlete.graph;

import com.eainde.athlete.exception.AgentException;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.NodeOutput;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.state.AgentState;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Runs a compiled langgraph4j graph either to completion on the caller's thread or as a
 * {@link GraphStream} produced on the stream executor.
 * <p>
 * The run id (the thread id of {@link RunOptions}, or a random one) is written into the input
 * state under {@link ActiveRuns#RUN_ID} and used as the checkpoint thread id.
 */
@Slf4j
public class EnumCompiledGraph<N extends Enum<N>, S extends AgentState> {

    private final Class<N> nodeType;
    private final CompiledGraph<S> graph;
    private final ActiveRuns activeRuns;
    private final Executor streamExecutor;
    private final Clock clock;

    EnumCompiledGraph(Class<N> nodeType, CompiledGraph<S> graph, ActiveRuns activeRuns, Executor streamExecutor,
                      Clock clock) {
        this.nodeType = nodeType;
        this.graph = graph;
        this.activeRuns = activeRuns;
        this.streamExecutor = streamExecutor;
        this.clock = clock;
        graph.setMaxIterations(Integer.MAX_VALUE);
    }

    /**
     * Runs to completion.
     *
     * @throws GraphTimeoutException  if the deadline passes at a step boundary
     * @throws GraphDivergedException if the step budget is spent before END
     * @throws AgentException         for node failures
     */
    public S invoke(Map<String, Object> input, RunOptions options) {
        return drain(input, options, runId(options), null);
    }

    /**
     * Starts the run on the stream executor. Closing the returned stream stops the run at its
     * next step boundary.
     */
    public GraphStream<N, S> stream(Map<String, Object> input, RunOptions options) {
        String runId = runId(options);
        GraphStream<N, S> stream = new GraphStream<>(clock.instant().plus(options.timeout()),
                options.timeout(), clock);
        try {
            streamExecutor.execute(() -> {
                try {
                    stream.complete(drain(input, options, runId, stream));
                } catch (RuntimeException e) {
                    log.debug("Streamed run {} ended with {}", runId, e.toString());
                    stream.fail(e);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new AgentException("OVERLOADED", "No capacity to start a streamed run", e);
        }
        return stream;
    }

    private S drain(Map<String, Object> input, RunOptions options, String runId, GraphStream<N, S> stream) {
        Map<String, Object> inputs = new HashMap<>(input);
        inputs.put(ActiveRuns.RUN_ID, runId);
        RunnableConfig config = RunnableConfig.builder().threadId(runId).build();

        RunHandle handle = activeRuns.open(runId, options, clock,
                stream == null ? () -> false : stream::isCancelled,
                stream == null ? null : (node, text) -> stream.emit(new TokenFragment<>(node(node), text)));
        try {
            S last = null;
            int step = 0;
            for (NodeOutput<S> output : graph.stream(inputs, config)) {
                last = output.state();
                String node = output.node();
                if (START.equals(node) || END.equals(node)) {
                    continue;
                }
                step++;
                if (stream != null) {
                    stream.emit(new Snapshot<>(node(node), step, last));
                }
                handle.checkBoundary("after " + node);
            }
            if (last == null) {
                throw new AgentException("GRAPH_FAILED", "Graph produced no state");
            }
            return last;
        } catch (RuntimeException e) {
            throw unwrap(e);
        } finally {
            activeRuns.close(handle);
        }
    }

    private N node(String name) {
        return Enum.valueOf(nodeType, name);
    }

    private static String runId(RunOptions options) {
        return options.threadId() != null ? options.threadId() : UUID.randomUUID().toString();
    }

    /** Finds the agent failure or cancellation behind the engine's wrapping exceptions. */
    static RuntimeException unwrap(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof AgentException agent) {
                return agent;
            }
            if (cause instanceof CancellationException cancelled) {
                return cancelled;
            }
        }
        return new AgentException("GRAPH_FAILED", "Graph execution failed: " + error.getMessage(), error);
    }
}
