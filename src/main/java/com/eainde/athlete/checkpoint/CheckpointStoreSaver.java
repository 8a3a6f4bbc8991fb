package com.eainde.athlete.checkpoint;

import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Adapts a {@link CheckpointStore} to langgraph4j's saver contract.
 * <p>
 * Every node completion becomes one row, numbered by step within the run's thread id. A store
 * failure is logged and swallowed so a broken database never aborts a run; reads that fail
 * behave as if nothing was stored.
 */
@Slf4j
public class CheckpointStoreSaver implements BaseCheckpointSaver {

    private final CheckpointStore store;

    public CheckpointStoreSaver(CheckpointStore store) {
        this.store = store;
    }

    public CheckpointStore getStore() {
        return store;
    }

    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        String threadId = config.threadId().orElse(null);
        if (threadId == null) {
            return List.of();
        }
        try {
            return store.list(threadId).stream()
                    .sorted(Comparator.comparingInt(com.eainde.athlete.checkpoint.Checkpoint::step).reversed())
                    .map(CheckpointStoreSaver::toGraphCheckpoint)
                    .toList();
        } catch (RuntimeException e) {
            log.warn("Failed to list checkpoints for thread {}: {}", threadId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        String threadId = config.threadId().orElse(null);
        if (threadId == null) {
            return Optional.empty();
        }
        try {
            if (config.checkPointId().isPresent()) {
                String id = config.checkPointId().get();
                return store.list(threadId).stream()
                        .filter(c -> id.equals(c.checkpointId()))
                        .findFirst()
                        .map(CheckpointStoreSaver::toGraphCheckpoint);
            }
            return store.latest(threadId).map(CheckpointStoreSaver::toGraphCheckpoint);
        } catch (RuntimeException e) {
            log.warn("Failed to read checkpoint for thread {}: {}", threadId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) {
        String threadId = config.threadId().orElseThrow(() ->
                new IllegalArgumentException("Thread ID is required"));
        try {
            store.save(threadId, stepFor(threadId, checkpoint.getId()), checkpoint.getId(),
                    checkpoint.getNodeId(), checkpoint.getNextNodeId(), checkpoint.getState());
        } catch (RuntimeException e) {
            log.warn("Checkpoint write failed for thread {} at node {}: {}",
                    threadId, checkpoint.getNodeId(), e.getMessage());
        }
        return RunnableConfig.builder()
                .threadId(threadId)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) throws Exception {
        String threadId = config.threadId().orElseThrow(() ->
                new IllegalArgumentException("Thread ID is required"));
        return new Tag(threadId, list(config));
    }

    /** Rewrites keep their step; new checkpoints follow the latest one. */
    private int stepFor(String threadId, String checkpointId) {
        List<com.eainde.athlete.checkpoint.Checkpoint> existing = store.list(threadId);
        return existing.stream()
                .filter(c -> checkpointId.equals(c.checkpointId()))
                .mapToInt(com.eainde.athlete.checkpoint.Checkpoint::step)
                .findFirst()
                .orElseGet(() -> existing.stream()
                        .mapToInt(com.eainde.athlete.checkpoint.Checkpoint::step)
                        .max()
                        .orElse(0) + 1);
    }

    private static Checkpoint toGraphCheckpoint(com.eainde.athlete.checkpoint.Checkpoint stored) {
        return Checkpoint.builder()
                .id(stored.checkpointId())
                .nodeId(stored.node())
                .nextNodeId(stored.nextNode())
                .state(stored.state())
                .build();
    }
}
