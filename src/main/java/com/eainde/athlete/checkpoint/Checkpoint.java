package com.eainde.athlete.checkpoint;

import java.time.Instant;
import java.util.Map;

/**
 * State persisted after one step of a run.
 *
 * @param threadId     run id the checkpoint belongs to
 * @param step         position within the run, starting at 1
 * @param checkpointId id assigned by the graph engine
 * @param node         node that produced the state
 * @param nextNode     node the run continues with, null at the end
 */
public record Checkpoint(String threadId, int step, String checkpointId, String node, String nextNode,
                         Map<String, Object> state, Instant createdAt) {
}
