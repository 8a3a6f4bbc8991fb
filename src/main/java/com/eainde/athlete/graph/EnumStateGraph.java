package com.eainde.athlete.graph;

import com.eainde.athlete.exception.AgentException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.AgentStateFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * A langgraph4j {@link StateGraph} whose nodes are named by an enum.
 * <p>
 * Every node is wrapped so that, when it runs as part of a registered run, the run's deadline,
 * cancellation and step budget are checked before it starts. Node failures other than
 * {@link AgentException} surface as {@link NodeExecutionException}. With a meter registry each
 * node execution is timed as {@code agent.node.duration}.
 *
 * @param <N> node identifiers
 * @param <S> state type
 */
@Slf4j
public class EnumStateGraph<N extends Enum<N>, S extends AgentState> {

    static final String NODE_TIMER = "agent.node.duration";

    private final Class<N> nodeType;
    private final StateGraph<S> graph;
    private final ActiveRuns activeRuns;
    private final MeterRegistry meterRegistry;

    public EnumStateGraph(Class<N> nodeType, AgentStateFactory<S> stateFactory, ActiveRuns activeRuns,
                          MeterRegistry meterRegistry) {
        this.nodeType = nodeType;
        this.graph = new StateGraph<>(stateFactory);
        this.activeRuns = activeRuns;
        this.meterRegistry = meterRegistry;
    }

    public EnumStateGraph<N, S> addNode(N id, AsyncNodeAction<S> action) throws GraphStateException {
        graph.addNode(id.name(), instrument(id, action));
        return this;
    }

    public EnumStateGraph<N, S> setEntryPoint(N id) throws GraphStateException {
        graph.addEdge(START, id.name());
        return this;
    }

    public EnumStateGraph<N, S> addEdge(N from, N to) throws GraphStateException {
        return addEdge(from, Target.of(to));
    }

    public EnumStateGraph<N, S> addEdge(N from, Target<N> to) throws GraphStateException {
        graph.addEdge(from.name(), name(to));
        return this;
    }

    /**
     * Routes on the name of the enum returned by {@code router}; every value the router can
     * return must have a target.
     */
    public <R extends Enum<R>> EnumStateGraph<N, S> addConditionalEdges(N from, AsyncEdgeAction<S> router,
                                                                       Map<R, Target<N>> routes)
            throws GraphStateException {
        Map<String, String> mappings = new HashMap<>();
        routes.forEach((route, target) -> mappings.put(route.name(), name(target)));
        graph.addConditionalEdges(from.name(), router, mappings);
        return this;
    }

    /**
     * @param saver          checkpoint saver, null to run without checkpoints
     * @param streamExecutor runs streamed graphs
     */
    public EnumCompiledGraph<N, S> compile(BaseCheckpointSaver saver, Executor streamExecutor, Clock clock)
            throws GraphStateException {
        CompileConfig.Builder config = CompileConfig.builder();
        if (saver != null) {
            config.checkpointSaver(saver);
        }
        CompiledGraph<S> compiled = graph.compile(config.build());
        return new EnumCompiledGraph<>(nodeType, compiled, activeRuns, streamExecutor, clock);
    }

    private AsyncNodeAction<S> instrument(N id, AsyncNodeAction<S> action) {
        Timer timer = meterRegistry == null ? null : Timer.builder(NODE_TIMER)
                .tag("node", id.name())
                .register(meterRegistry);
        return state -> {
            String runId = state.<String>value(ActiveRuns.RUN_ID).orElse(null);
            long started = System.nanoTime();
            CompletableFuture<Map<String, Object>> result;
            try {
                activeRuns.beforeNode(runId, id);
                log.debug("Executing node {}", id);
                result = action.apply(state);
            } catch (RuntimeException e) {
                result = CompletableFuture.failedFuture(e);
            }
            return result.handle((patch, error) -> {
                if (timer != null) {
                    timer.record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
                }
                if (error == null) {
                    return patch;
                }
                throw translate(id, error);
            });
        };
    }

    private RuntimeException translate(N id, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof AgentException agent) {
            return agent;
        }
        if (cause instanceof CancellationException cancelled) {
            return cancelled;
        }
        log.error("Node {} failed", id, cause);
        return new NodeExecutionException(id.name(), cause);
    }

    private static String name(Target<?> target) {
        return target.isEnd() ? END : target.node().name();
    }
}
