package com.eainde.athlete.checkpoint;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Keeps checkpoints in process memory, ordered by step within each thread.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, NavigableMap<Integer, Checkpoint>> storage = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCheckpointStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCheckpointStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void setup() {
        // nothing to create
    }

    @Override
    public void save(String threadId, int step, String checkpointId, String node, String nextNode,
                     Map<String, Object> state) {
        if (threadId == null) {
            throw new IllegalArgumentException("Thread ID is required");
        }
        storage.computeIfAbsent(threadId, k -> new ConcurrentSkipListMap<>())
                .put(step, new Checkpoint(threadId, step, checkpointId, node, nextNode,
                        Map.copyOf(state), clock.instant()));
    }

    @Override
    public Optional<Checkpoint> latest(String threadId) {
        NavigableMap<Integer, Checkpoint> threadCheckpoints = storage.get(threadId);
        if (threadCheckpoints == null || threadCheckpoints.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(threadCheckpoints.lastEntry().getValue());
    }

    @Override
    public List<Checkpoint> list(String threadId) {
        NavigableMap<Integer, Checkpoint> threadCheckpoints = storage.get(threadId);
        return threadCheckpoints == null ? List.of() : new ArrayList<>(threadCheckpoints.values());
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        int removed = 0;
        for (NavigableMap<Integer, Checkpoint> threadCheckpoints : storage.values()) {
            List<Integer> stale = threadCheckpoints.values().stream()
                    .filter(c -> c.createdAt().isBefore(cutoff))
                    .map(Checkpoint::step)
                    .sorted(Comparator.naturalOrder())
                    .toList();
            stale.forEach(threadCheckpoints::remove);
            removed += stale.size();
        }
        storage.values().removeIf(Map::isEmpty);
        return removed;
    }
}
