package com.eainde.athlete.stream;

import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.graph.GraphTimeoutException;
import com.eainde.athlete.graph.Snapshot;
import com.eainde.athlete.graph.StreamChunk;
import com.eainde.athlete.graph.TokenFragment;
import com.eainde.athlete.nodes.NodeId;
import com.eainde.athlete.state.Citation;
import com.eainde.athlete.state.EscalationCategory;
import com.eainde.athlete.state.EscalationInfo;
import com.eainde.athlete.state.EscalationUrgency;
import com.eainde.athlete.state.QualityCheckResult;
import com.eainde.athlete.state.QualityIssue;
import com.eainde.athlete.state.RunState;
import com.eainde.athlete.stream.AgentStreamEvent.EventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class StreamAdapterTest {

    private static final QualityCheckResult FAILED = new QualityCheckResult(false, 0.3,
            List.of(new QualityIssue("unsupported_claim", "major", "cites nothing")), "ground the claims");
    private static final QualityCheckResult PASSED = QualityCheckResult.pass("ok");

    private AgentProperties properties;
    private int step;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getQuality().setMaxRetries(1);
        step = 0;
    }

    private static TokenFragment<NodeId, RunState> token(String text) {
        return new TokenFragment<>(NodeId.SYNTHESIZER, text);
    }

    private Snapshot<NodeId, RunState> snapshot(NodeId node, Object... keyValues) {
        Map<String, Object> data = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new Snapshot<>(node, ++step, new RunState(data));
    }

    /** Chunks in order; a RuntimeException in the list is thrown from hasNext() when reached. */
    private static Iterator<StreamChunk<NodeId, RunState>> source(Object... items) {
        return new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                if (index < items.length && items[index] instanceof RuntimeException error) {
                    index++;
                    throw error;
                }
                return index < items.length;
            }

            @Override
            @SuppressWarnings("unchecked")
            public StreamChunk<NodeId, RunState> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return (StreamChunk<NodeId, RunState>) items[index++];
            }
        };
    }

    private List<AgentStreamEvent> run(Object... items) {
        try (Stream<AgentStreamEvent> events = new StreamAdapter(properties).adapt(source(items), () -> { }, state -> { })) {
            return events.collect(Collectors.toList());
        }
    }

    private static List<EventType> types(List<AgentStreamEvent> events) {
        return events.stream().map(AgentStreamEvent::type).toList();
    }

    private static String text(List<AgentStreamEvent> events) {
        StringBuilder visible = new StringBuilder();
        for (AgentStreamEvent event : events) {
            if (event.type() == EventType.ANSWER_RESET) {
                visible.setLength(0);
            } else if (event.type() == EventType.TEXT_DELTA) {
                visible.append(event.data());
            }
        }
        return visible.toString();
    }

    // =========================================================================
    //  quality gate
    // =========================================================================

    @Nested
    @DisplayName("quality gate")
    class QualityGate {

        @Test
        @DisplayName("holds synthesizer tokens until the checker passes the draft")
        void flushesOnPass() {
            List<AgentStreamEvent> events = run(
                    token("Hel"), token("lo"),
                    snapshot(NodeId.SYNTHESIZER, RunState.ANSWER, "Hello"),
                    snapshot(NodeId.QUALITY_CHECKER, RunState.ANSWER, "Hello", RunState.QUALITY_CHECK_RESULT, PASSED));

            assertThat(events).extracting(AgentStreamEvent::type, AgentStreamEvent::data).containsExactly(
                    tuple(EventType.STATUS, StreamAdapter.statusLabel(NodeId.SYNTHESIZER)),
                    tuple(EventType.STATUS, StreamAdapter.statusLabel(NodeId.QUALITY_CHECKER)),
                    tuple(EventType.TEXT_DELTA, "Hel"),
                    tuple(EventType.TEXT_DELTA, "lo"),
                    tuple(EventType.DONE, null));
        }

        @Test
        @DisplayName("silently discards a rejected draft that never reached the client")
        void discardsWithoutReset() {
            List<AgentStreamEvent> events = run(
                    token("A"), token("B"),
                    snapshot(NodeId.SYNTHESIZER, RunState.ANSWER, "AB"),
                    snapshot(NodeId.QUALITY_CHECKER, RunState.ANSWER, "AB", RunState.QUALITY_CHECK_RESULT, FAILED),
                    token("C"), token("D"),
                    snapshot(NodeId.SYNTHESIZER, RunState.ANSWER, "CD", RunState.QUALITY_RETRY_COUNT, 1,
                            RunState.QUALITY_CHECK_RESULT, FAILED),
                    snapshot(NodeId.QUALITY_CHECKER, RunState.ANSWER, "CD", RunState.QUALITY_RETRY_COUNT, 1,
                            RunState.QUALITY_CHECK_RESULT, FAILED));

            assertThat(types(events)).doesNotContain(EventType.ANSWER_RESET);
            assertThat(text(events)).isEqualTo("CD");
            assertThat(events.stream().filter(e -> e.type() == EventType.TEXT_DELTA).map(AgentStreamEvent::data))
                    .containsExactly("C", "D");
        }

        @Test
        @DisplayName("sends answer-reset when a rejected draft follows visible text")
        void resetsVisibleText() {
            properties.getQuality().setMaxRetries(2);

            List<AgentStreamEvent> events = run(
                    token("A"), token("B"),
                    snapshot(NodeId.SYNTHESIZER, RunState.ANSWER, "AB"),
                    snapshot(NodeId.QUALITY_CHECKER, RunState.ANSWER, "AB", RunState.QUALITY_CHECK_RESULT, PASSED),
                    token("C"), token("D"),
                    snapshot(NodeId.SYNTHESIZER, RunState.ANSWER, "CD", RunState.QUALITY_RETRY_COUNT, 1),
                    snapshot(NodeId.QUALITY_CHECKER, RunState.ANSWER, "CD", RunState.QUALITY_RETRY_COUNT, 1,
                            RunState.QUALITY_CHECK_RESULT, FAILED),
                    token("E"), token("F"),
                    snapshot(NodeId.SYNTHESIZER, RunState.ANSWER, "EF", RunState.QUALITY_RETRY_COUNT, 2),
                    snapshot(NodeId.QUALITY_CHECKER, RunState.ANSWER, "EF", RunState.QUALITY_RETRY_COUNT, 2,
                            RunState.QUALITY_CHECK_RESULT, PASSED));

            assertThat(types(events)).containsExactly(
                    EventType.STATUS, EventType.STATUS,
                    EventType.TEXT_DELTA, EventType.TEXT_DELTA,
                    EventType.ANSWER_RESET,
                    EventType.STATUS, EventType.STATUS,
                    EventType.TEXT_DELTA, EventType.TEXT_DELTA,
                    EventType.DONE);
            assertThat(text(events)).isEqualTo("EF");
        }

        @Test
        @DisplayName("uses the synthesizer's final answer when it differs from its tokens")
        void finalAnswerWins() {
            List<AgentStreamEvent> events = run(
                    token("partial"),
                    snapshot(NodeId.SYNTHESIZER, RunState.ANSWER, "fallback text"),
                    snapshot(NodeId.CITATION_BUILDER, RunState.ANSWER, "fallback text"));

            assertThat(text(events)).isEqualTo("fallback text");
        }
    }

    // =========================================================================
    //  other nodes
    // =========================================================================

    @Nested
    @DisplayName("answers from other nodes")
    class OtherNodes {

        @Test
        @DisplayName("sends the appended disclaimer as a suffix delta")
        void disclaimerSuffix() {
            List<AgentStreamEvent> events = run(
                    token("Answer"),
                    snapshot(NodeId.SYNTHESIZER, RunState.ANSWER, "Answer"),
                    snapshot(NodeId.QUALITY_CHECKER, RunState.ANSWER, "Answer", RunState.QUALITY_CHECK_RESULT, PASSED),
                    snapshot(NodeId.CITATION_BUILDER, RunState.ANSWER, "Answer"),
                    snapshot(NodeId.DISCLAIMER_GUARD, RunState.ANSWER, "Answer\n\n---\n\nNot legal advice."));

            assertThat(events.stream().filter(e -> e.type() == EventType.TEXT_DELTA).map(AgentStreamEvent::data))
                    .containsExactly("Answer", "\n\n---\n\nNot legal advice.");
        }

        @Test
        @DisplayName("sends a clarification question as the whole answer")
        void clarification() {
            List<AgentStreamEvent> events = run(
                    snapshot(NodeId.CLASSIFIER, RunState.NEEDS_CLARIFICATION, true),
                    snapshot(NodeId.CLARIFY, RunState.ANSWER, "Which sport do you compete in?"));

            assertThat(events).extracting(AgentStreamEvent::type, AgentStreamEvent::data).containsExactly(
                    tuple(EventType.STATUS, StreamAdapter.statusLabel(NodeId.CLASSIFIER)),
                    tuple(EventType.TEXT_DELTA, "Which sport do you compete in?"),
                    tuple(EventType.DONE, null));
        }

        @Test
        @DisplayName("sends citations, escalation and discovered urls once each")
        void onceOnly() {
            List<Citation> citations = List.of(new Citation("Bylaws", "https://x", "Art. 1", "snip", null, null,
                    Citation.Source.DOCUMENT));
            EscalationInfo escalation = new EscalationInfo("safesport_center", "U.S. Center for SafeSport", null,
                    "833-5US-SAFE (833-587-7233)", null, "abuse", EscalationCategory.NON_IMMINENT_MISCONDUCT,
                    EscalationUrgency.IMMEDIATE);

            List<AgentStreamEvent> events = run(
                    snapshot(NodeId.ESCALATE, RunState.ANSWER, "Contact SafeSport", RunState.ESCALATION, escalation),
                    snapshot(NodeId.CITATION_BUILDER, RunState.ANSWER, "Contact SafeSport", RunState.ESCALATION, escalation,
                            RunState.CITATIONS, citations),
                    snapshot(NodeId.DISCLAIMER_GUARD, RunState.ANSWER, "Contact SafeSport", RunState.ESCALATION, escalation,
                            RunState.CITATIONS, citations));

            assertThat(types(events).stream().filter(t -> t == EventType.ESCALATION)).hasSize(1);
            assertThat(types(events).stream().filter(t -> t == EventType.CITATIONS)).hasSize(1);
            assertThat(events).filteredOn(e -> e.type() == EventType.CITATIONS)
                    .singleElement().extracting(AgentStreamEvent::data).isEqualTo(citations);
        }
    }

    // =========================================================================
    //  termination
    // =========================================================================

    @Nested
    @DisplayName("termination")
    class Termination {

        @Test
        @DisplayName("a timeout ends with an error and a single done")
        void timeout() {
            List<AgentStreamEvent> events = run(
                    snapshot(NodeId.CLASSIFIER),
                    new GraphTimeoutException(Duration.ofSeconds(120), "while streaming"));

            assertThat(types(events)).containsExactly(EventType.STATUS, EventType.ERROR, EventType.DONE);
            assertThat(events.get(1).data()).isEqualTo(new ErrorPayload(StreamAdapter.TIMEOUT_MESSAGE, "GRAPH_TIMEOUT"));
        }

        @Test
        @DisplayName("an unexpected failure is reported as GRAPH_ERROR")
        void unexpectedFailure() {
            List<AgentStreamEvent> events = run(new IllegalStateException("boom"));

            assertThat(events).extracting(AgentStreamEvent::type).containsExactly(EventType.ERROR, EventType.DONE);
            assertThat(events.get(0).data()).isEqualTo(new ErrorPayload(StreamAdapter.FAILURE_MESSAGE, "GRAPH_ERROR"));
        }

        @Test
        @DisplayName("runs the completion hook with the final state before done, and closes the source")
        void completionHook() {
            AtomicReference<RunState> completed = new AtomicReference<>();
            AtomicBoolean closed = new AtomicBoolean();
            List<AgentStreamEvent> events = new ArrayList<>();

            try (Stream<AgentStreamEvent> stream = new StreamAdapter(properties).adapt(
                    source(snapshot(NodeId.CLARIFY, RunState.ANSWER, "Which sport?")),
                    () -> closed.set(true),
                    completed::set)) {
                stream.forEach(events::add);
            }

            assertThat(completed.get().getAnswer()).isEqualTo("Which sport?");
            assertThat(closed).isTrue();
            assertThat(events).last().extracting(AgentStreamEvent::type).isEqualTo(EventType.DONE);
        }

        @Test
        @DisplayName("a failing completion hook does not prevent done")
        void failingHook() {
            List<AgentStreamEvent> events;
            try (Stream<AgentStreamEvent> stream = new StreamAdapter(properties).adapt(
                    source(snapshot(NodeId.CLARIFY, RunState.ANSWER, "Which sport?")), () -> { },
                    state -> {
                        throw new IllegalStateException("memory down");
                    })) {
                events = stream.toList();
            }

            assertThat(types(events)).endsWith(EventType.DONE).doesNotContain(EventType.ERROR);
        }
    }
}
