package com.eainde.athlete.graph;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.BooleanSupplier;

/**
 * Runs currently executing through an {@link EnumCompiledGraph}, keyed by run id.
 * <p>
 * The run id travels in the graph state under {@link #RUN_ID}, which is how node wrappers find
 * the limits of their run and how a node streams tokens to the run's consumer. Nodes executed
 * outside a registered run are neither limited nor streamed.
 */
@Component
public class ActiveRuns {

    public static final String RUN_ID = "runId";

    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();

    RunHandle open(String runId, RunOptions options, Clock clock, BooleanSupplier cancelled,
                   BiConsumer<String, String> tokenSink) {
        RunHandle handle = new RunHandle(runId, options, clock, cancelled, tokenSink);
        runs.put(runId, handle);
        return handle;
    }

    void close(RunHandle handle) {
        runs.remove(handle.getRunId(), handle);
    }

    void beforeNode(String runId, Enum<?> node) {
        RunHandle handle = runId == null ? null : runs.get(runId);
        if (handle != null) {
            handle.beforeNode(node.name());
        }
    }

    /** Forwards generated text to the run's stream; dropped for blocking or unknown runs. */
    public void emitToken(String runId, Enum<?> node, String text) {
        if (runId == null || text == null || text.isEmpty()) {
            return;
        }
        RunHandle handle = runs.get(runId);
        if (handle != null) {
            handle.emitToken(node.name(), text);
        }
    }

    public boolean isActive(String runId) {
        return runId != null && runs.containsKey(runId);
    }
}
