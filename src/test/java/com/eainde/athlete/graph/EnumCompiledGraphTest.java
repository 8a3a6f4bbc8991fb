package com.eainde.athlete.graph;

import com.eainde.athlete.checkpoint.Checkpoint;
import com.eainde.athlete.checkpoint.CheckpointStore;
import com.eainde.athlete.checkpoint.CheckpointStoreSaver;
import com.eainde.athlete.checkpoint.InMemoryCheckpointStore;
import com.eainde.athlete.support.MutableClock;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EnumCompiledGraphTest {

    private enum Loop { AGAIN, DONE }

    private static final RunOptions OPTIONS = RunOptions.of(Duration.ofSeconds(30), 10);

    private final ActiveRuns activeRuns = new ActiveRuns();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static AsyncNodeAction<TestState> patch(Map<String, Object> patch) {
        return state -> CompletableFuture.completedFuture(patch);
    }

    private static AsyncNodeAction<TestState> increment() {
        return state -> CompletableFuture.completedFuture(Map.of("counter", state.counter() + 1));
    }

    private EnumStateGraph<Step, TestState> graph() {
        return new EnumStateGraph<>(Step.class, TestState::new, activeRuns, null);
    }

    /** START -> LOOP, LOOP loops until counter reaches {@code until}, then FINISH -> END. */
    private EnumStateGraph<Step, TestState> loopGraph(int until) throws Exception {
        return graph()
                .addNode(Step.START, patch(Map.of("started", true)))
                .addNode(Step.LOOP, increment())
                .addNode(Step.FINISH, patch(Map.of("finished", true)))
                .setEntryPoint(Step.START)
                .addEdge(Step.START, Step.LOOP)
                .addConditionalEdges(Step.LOOP,
                        state -> CompletableFuture.completedFuture(
                                (state.counter() >= until ? Loop.DONE : Loop.AGAIN).name()),
                        Map.of(Loop.AGAIN, Target.of(Step.LOOP), Loop.DONE, Target.of(Step.FINISH)))
                .addEdge(Step.FINISH, Target.end());
    }

    private EnumCompiledGraph<Step, TestState> compile(EnumStateGraph<Step, TestState> graph) throws Exception {
        return graph.compile(null, executor, Clock.systemUTC());
    }

    // =========================================================================
    //  invoke
    // =========================================================================

    @Nested
    @DisplayName("invoke")
    class Invoke {

        @Test
        @DisplayName("merges every patch into the final state")
        void mergesPatches() throws Exception {
            TestState result = compile(loopGraph(3)).invoke(Map.of("question", "q"), OPTIONS);

            assertThat(result.data())
                    .containsEntry("question", "q")
                    .containsEntry("started", true)
                    .containsEntry("counter", 3)
                    .containsEntry("finished", true);
        }

        @Test
        @DisplayName("places the run id in the state")
        void exposesRunId() throws Exception {
            TestState result = compile(loopGraph(1)).invoke(Map.of(), OPTIONS.withThreadId("run-9"));

            assertThat(result.data()).containsEntry(ActiveRuns.RUN_ID, "run-9");
            assertThat(activeRuns.isActive("run-9")).isFalse();
        }

        @Test
        @DisplayName("fails with GRAPH_DIVERGED when maxSteps is reached before END")
        void diverges() throws Exception {
            EnumCompiledGraph<Step, TestState> graph = compile(loopGraph(100));

            assertThatThrownBy(() -> graph.invoke(Map.of(), RunOptions.of(Duration.ofSeconds(30), 5)))
                    .isInstanceOf(GraphDivergedException.class)
                    .hasFieldOrPropertyWithValue("code", "GRAPH_DIVERGED");
        }

        @Test
        @DisplayName("fails with GRAPH_TIMEOUT once the deadline has passed at a step boundary")
        void timesOut() throws Exception {
            MutableClock clock = MutableClock.atEpoch();
            EnumCompiledGraph<Step, TestState> graph = graph()
                    .addNode(Step.START, state -> {
                        clock.advance(Duration.ofSeconds(31));
                        return CompletableFuture.completedFuture(Map.of());
                    })
                    .setEntryPoint(Step.START)
                    .addEdge(Step.START, Target.end())
                    .compile(null, executor, clock);

            assertThatThrownBy(() -> graph.invoke(Map.of(), OPTIONS))
                    .isInstanceOf(GraphTimeoutException.class)
                    .hasMessageContaining("after START");
        }

        @Test
        @DisplayName("wraps node failures with the node name")
        void nodeFailure() throws Exception {
            EnumCompiledGraph<Step, TestState> graph = compile(graph()
                    .addNode(Step.START, state -> CompletableFuture.failedFuture(new IllegalStateException("bad")))
                    .setEntryPoint(Step.START)
                    .addEdge(Step.START, Target.end()));

            assertThatThrownBy(() -> graph.invoke(Map.of(), OPTIONS))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasFieldOrPropertyWithValue("node", "START")
                    .hasRootCauseMessage("bad");
        }

        @Test
        @DisplayName("a node throwing instead of returning a failed future is wrapped the same way")
        void nodeThrows() throws Exception {
            EnumCompiledGraph<Step, TestState> graph = compile(graph()
                    .addNode(Step.START, state -> {
                        throw new IllegalArgumentException("thrown");
                    })
                    .setEntryPoint(Step.START)
                    .addEdge(Step.START, Target.end()));

            assertThatThrownBy(() -> graph.invoke(Map.of(), OPTIONS))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasRootCauseMessage("thrown");
        }
    }

    // =========================================================================
    //  checkpoints
    // =========================================================================

    @Nested
    @DisplayName("checkpoints")
    class Checkpoints {

        @Test
        @DisplayName("saves state after every node under the run id")
        void savesEachStep() throws Exception {
            InMemoryCheckpointStore store = new InMemoryCheckpointStore();
            BaseCheckpointSaver saver = new CheckpointStoreSaver(store);

            loopGraph(1).compile(saver, executor, Clock.systemUTC()).invoke(Map.of(), OPTIONS.withThreadId("run-1"));

            List<Checkpoint> saved = store.list("run-1");
            assertThat(saved).extracting(Checkpoint::node).containsSubsequence("START", "LOOP", "FINISH");
            assertThat(saved).extracting(Checkpoint::step).isSorted().doesNotHaveDuplicates();
            assertThat(store.latest("run-1")).get()
                    .satisfies(latest -> assertThat(latest.state()).containsEntry("finished", true));
        }

        @Test
        @DisplayName("a failing store does not abort the run")
        void storeFailureIsNonFatal() throws Exception {
            CheckpointStore store = mock(CheckpointStore.class);
            when(store.list(anyString())).thenReturn(List.of());
            doThrow(new IllegalStateException("db down")).when(store)
                    .save(anyString(), anyInt(), anyString(), anyString(), any(), any());

            TestState result = loopGraph(1)
                    .compile(new CheckpointStoreSaver(store), executor, Clock.systemUTC())
                    .invoke(Map.of(), OPTIONS.withThreadId("run-2"));

            assertThat(result.data()).containsEntry("finished", true);
        }
    }

    // =========================================================================
    //  stream
    // =========================================================================

    @Nested
    @DisplayName("stream")
    class Streaming {

        @Test
        @DisplayName("interleaves tokens and snapshots in the order they happened")
        void interleaves() throws Exception {
            EnumCompiledGraph<Step, TestState> graph = compile(graph()
                    .addNode(Step.START, patch(Map.of("a", 1)))
                    .addNode(Step.FINISH, state -> {
                        String runId = state.<String>value(ActiveRuns.RUN_ID).orElse(null);
                        activeRuns.emitToken(runId, Step.FINISH, "Hel");
                        activeRuns.emitToken(runId, Step.FINISH, "lo");
                        return CompletableFuture.completedFuture(Map.of("answer", "Hello"));
                    })
                    .setEntryPoint(Step.START)
                    .addEdge(Step.START, Step.FINISH)
                    .addEdge(Step.FINISH, Target.end()));

            List<String> seen = new ArrayList<>();
            try (GraphStream<Step, TestState> stream = graph.stream(Map.of(), OPTIONS)) {
                while (stream.hasNext()) {
                    StreamChunk<Step, TestState> chunk = stream.next();
                    if (chunk instanceof TokenFragment<Step, TestState> token) {
                        seen.add("token:" + token.text());
                    } else if (chunk instanceof Snapshot<Step, TestState> snapshot) {
                        seen.add("snapshot:" + snapshot.node() + "#" + snapshot.step());
                    }
                }
                assertThat(stream.getFinalState()).get()
                        .extracting(state -> state.data().get("answer")).isEqualTo("Hello");
            }

            assertThat(seen).containsExactly("snapshot:START#1", "token:Hel", "token:lo", "snapshot:FINISH#2");
        }

        @Test
        @DisplayName("tokens emitted outside a streamed run are dropped")
        void tokensWithoutStreamAreDropped() throws Exception {
            EnumCompiledGraph<Step, TestState> graph = compile(graph()
                    .addNode(Step.START, state -> {
                        activeRuns.emitToken(state.<String>value(ActiveRuns.RUN_ID).orElse(null), Step.START, "x");
                        return CompletableFuture.completedFuture(Map.of("done", true));
                    })
                    .setEntryPoint(Step.START)
                    .addEdge(Step.START, Target.end()));

            assertThat(graph.invoke(Map.of(), OPTIONS).data()).containsEntry("done", true);
        }

        @Test
        @DisplayName("rethrows a run failure from hasNext")
        void rethrowsFailure() throws Exception {
            EnumCompiledGraph<Step, TestState> graph = compile(graph()
                    .addNode(Step.START, state -> CompletableFuture.failedFuture(new IllegalStateException("bad")))
                    .setEntryPoint(Step.START)
                    .addEdge(Step.START, Target.end()));

            try (GraphStream<Step, TestState> stream = graph.stream(Map.of(), OPTIONS)) {
                assertThatThrownBy(stream::hasNext).isInstanceOf(NodeExecutionException.class);
                assertThat(stream.hasNext()).isFalse();
            }
        }
    }
}
