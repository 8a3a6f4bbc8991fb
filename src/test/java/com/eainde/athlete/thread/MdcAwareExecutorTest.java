package com.eainde.athlete.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class MdcAwareExecutorTest {

    private final MdcAwareExecutor executor = new MdcAwareExecutor("test-pool");

    @AfterEach
    void tearDown() {
        MDC.clear();
        executor.shutdownNow();
    }

    @Test
    @DisplayName("workers see the submitter's MDC")
    void propagates() {
        MDC.put("runId", "run-42");

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("runId"), executor).join();

        assertThat(seen).isEqualTo("run-42");
    }

    @Test
    @DisplayName("workers do not keep MDC from an earlier task")
    void restores() {
        MDC.put("runId", "run-1");
        CompletableFuture.runAsync(() -> { }, executor).join();
        MDC.clear();

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("runId"), executor).join();

        assertThat(seen).isNull();
    }
}
