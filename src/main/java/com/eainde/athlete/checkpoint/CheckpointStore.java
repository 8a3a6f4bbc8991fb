package com.eainde.athlete.checkpoint;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-step state persistence keyed by thread id. The graph engine reaches it through
 * {@link CheckpointStoreSaver}, which treats writes as best-effort: a failing {@link #save} is
 * logged and never aborts a run.
 */
public interface CheckpointStore {

    /** Creates whatever storage the store needs. Safe to call repeatedly. */
    void setup();

    void save(String threadId, int step, String checkpointId, String node, String nextNode, Map<String, Object> state);

    Optional<Checkpoint> latest(String threadId);

    List<Checkpoint> list(String threadId);

    /** @return number of checkpoints removed */
    int purgeOlderThan(Instant cutoff);
}
