package com.eainde.athlete.checkpoint;

import com.eainde.athlete.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Removes checkpoints older than {@code agent.checkpoint.retention}. Registered only when a
 * checkpoint store is configured.
 */
@Slf4j
public class CheckpointRetentionJob {

    private final CheckpointStore store;
    private final Duration retention;
    private final Clock clock;

    public CheckpointRetentionJob(CheckpointStore store, AgentProperties properties, Clock clock) {
        this.store = store;
        this.retention = properties.getCheckpoint().getRetention();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${agent.checkpoint.purge-interval:PT1H}", initialDelayString = "PT5M")
    public void purge() {
        purgeExpired();
    }

    int purgeExpired() {
        Instant cutoff = clock.instant().minus(retention);
        try {
            int removed = store.purgeOlderThan(cutoff);
            if (removed > 0) {
                log.info("Purged {} checkpoints older than {}", removed, cutoff);
            }
            return removed;
        } catch (RuntimeException e) {
            log.warn("Checkpoint purge failed: {}", e.getMessage());
            return 0;
        }
    }
}
