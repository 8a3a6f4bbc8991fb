package com.eainde.athlete.stream;

import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.exception.AgentException;
import com.eainde.athlete.graph.GraphTimeoutException;
import com.eainde.athlete.graph.Snapshot;
import com.eainde.athlete.graph.StreamChunk;
import com.eainde.athlete.graph.TokenFragment;
import com.eainde.athlete.nodes.NodeId;
import com.eainde.athlete.state.QualityCheckResult;
import com.eainde.athlete.state.RunState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Turns the chunk stream of a graph run into the ordered client event stream.
 * <p>
 * Only synthesizer tokens become text, and they are held back until the quality checker has
 * accepted the draft: a rejected draft is discarded, with an {@code answer-reset} first when
 * earlier text already reached the client. Answer text produced by other nodes (clarification,
 * referral, disclaimer) is sent as the difference against what the client already shows.
 * Citations, escalation and discovered urls are sent once each. Every stream ends with exactly
 * one {@code done}, after an {@code error} when the run failed.
 */
@Slf4j
@Component
public class StreamAdapter {

    static final String TIMEOUT_MESSAGE = "The request took too long to complete. Please try again.";
    static final String FAILURE_MESSAGE = "An error occurred while preparing your answer. Please try again.";

    private static final Map<NodeId, String> STATUS_LABELS = new EnumMap<>(NodeId.class);

    static {
        STATUS_LABELS.put(NodeId.CLASSIFIER, "Understanding your question...");
        STATUS_LABELS.put(NodeId.QUERY_PLANNER, "Planning search strategy...");
        STATUS_LABELS.put(NodeId.RETRIEVER, "Searching governance documents...");
        STATUS_LABELS.put(NodeId.RETRIEVAL_EXPANDER, "Broadening search...");
        STATUS_LABELS.put(NodeId.RESEARCHER, "Searching the web...");
        STATUS_LABELS.put(NodeId.SYNTHESIZER, "Preparing your answer...");
        STATUS_LABELS.put(NodeId.ESCALATE, "Preparing your answer...");
        STATUS_LABELS.put(NodeId.QUALITY_CHECKER, "Reviewing answer quality...");
    }

    private final int maxRetries;

    public StreamAdapter(AgentProperties properties) {
        this.maxRetries = properties.getQuality().getMaxRetries();
    }

    /**
     * @param source      chunks of one run, in production order
     * @param onClose     invoked when the returned stream is closed, typically to cancel the run
     * @param onCompleted invoked with the final state after a successful run, before {@code done}
     */
    public Stream<AgentStreamEvent> adapt(Iterator<StreamChunk<NodeId, RunState>> source,
                                          Runnable onClose,
                                          Consumer<RunState> onCompleted) {
        Iterator<AgentStreamEvent> events = new EventIterator(source, onCompleted);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(events, Spliterator.ORDERED), false)
                .onClose(onClose);
    }

    static String statusLabel(NodeId node) {
        return STATUS_LABELS.get(node);
    }

    private final class EventIterator implements Iterator<AgentStreamEvent> {

        private final Iterator<StreamChunk<NodeId, RunState>> source;
        private final Consumer<RunState> onCompleted;
        private final Deque<AgentStreamEvent> pending = new ArrayDeque<>();

        private final List<String> buffer = new ArrayList<>();
        private boolean textVisible;
        private String visibleAnswer = "";
        private NodeId lastStatusNode;
        private boolean citationsSent;
        private boolean escalationSent;
        private boolean urlsSent;
        private RunState lastState;
        private boolean finished;

        private EventIterator(Iterator<StreamChunk<NodeId, RunState>> source, Consumer<RunState> onCompleted) {
            this.source = source;
            this.onCompleted = onCompleted;
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && !finished) {
                pull();
            }
            return !pending.isEmpty();
        }

        @Override
        public AgentStreamEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }

        private void pull() {
            StreamChunk<NodeId, RunState> chunk;
            try {
                if (!source.hasNext()) {
                    complete();
                    return;
                }
                chunk = source.next();
            } catch (RuntimeException e) {
                fail(e);
                return;
            }
            if (chunk instanceof TokenFragment<NodeId, RunState> token) {
                onToken(token);
            } else if (chunk instanceof Snapshot<NodeId, RunState> snapshot) {
                onSnapshot(snapshot);
            }
        }

        private void onToken(TokenFragment<NodeId, RunState> token) {
            status(token.node());
            if (token.node() == NodeId.SYNTHESIZER) {
                buffer.add(token.text());
            }
        }

        private void onSnapshot(Snapshot<NodeId, RunState> snapshot) {
            NodeId node = snapshot.node();
            RunState state = snapshot.state();
            lastState = state;
            status(node);

            if (node == NodeId.SYNTHESIZER) {
                alignBufferWithAnswer(state.getAnswer());
            } else if (node == NodeId.QUALITY_CHECKER) {
                QualityCheckResult result = state.getQualityCheckResult();
                if (result == null || result.passed() || state.getQualityRetryCount() >= maxRetries) {
                    flush();
                } else {
                    discardDraft();
                }
            } else {
                flush();
                sendAnswerDifference(state.getAnswer());
            }

            onceOnlyEvents(state);
        }

        // The synthesizer's final answer wins over its tokens, e.g. when it fell back to fixed text.
        private void alignBufferWithAnswer(String answer) {
            if (answer == null || String.join("", buffer).equals(answer)) {
                return;
            }
            buffer.clear();
            if (!answer.isEmpty()) {
                buffer.add(answer);
            }
        }

        private void discardDraft() {
            log.debug("Draft rejected, discarding {} buffered fragments", buffer.size());
            buffer.clear();
            if (textVisible) {
                pending.add(AgentStreamEvent.answerReset());
                textVisible = false;
                visibleAnswer = "";
                lastStatusNode = null;
            }
        }

        private void flush() {
            if (buffer.isEmpty()) {
                return;
            }
            for (String fragment : buffer) {
                pending.add(AgentStreamEvent.textDelta(fragment));
                visibleAnswer = visibleAnswer + fragment;
            }
            buffer.clear();
            textVisible = true;
        }

        private void sendAnswerDifference(String answer) {
            if (answer == null || answer.isEmpty() || answer.equals(visibleAnswer)) {
                return;
            }
            if (answer.startsWith(visibleAnswer)) {
                pending.add(AgentStreamEvent.textDelta(answer.substring(visibleAnswer.length())));
            } else {
                if (textVisible) {
                    pending.add(AgentStreamEvent.answerReset());
                }
                pending.add(AgentStreamEvent.textDelta(answer));
            }
            visibleAnswer = answer;
            textVisible = true;
        }

        private void status(NodeId node) {
            String label = STATUS_LABELS.get(node);
            if (label == null || textVisible || node == lastStatusNode) {
                return;
            }
            lastStatusNode = node;
            pending.add(AgentStreamEvent.status(label));
        }

        private void onceOnlyEvents(RunState state) {
            if (!citationsSent && !state.getCitations().isEmpty()) {
                citationsSent = true;
                pending.add(new AgentStreamEvent(AgentStreamEvent.EventType.CITATIONS,
                        Collections.unmodifiableList(state.getCitations())));
            }
            if (!escalationSent && state.getEscalation() != null) {
                escalationSent = true;
                pending.add(new AgentStreamEvent(AgentStreamEvent.EventType.ESCALATION, state.getEscalation()));
            }
            if (!urlsSent && !state.getWebSearchResultUrls().isEmpty()) {
                urlsSent = true;
                pending.add(new AgentStreamEvent(AgentStreamEvent.EventType.DISCOVERED_URLS,
                        Collections.unmodifiableList(state.getWebSearchResultUrls())));
            }
        }

        private void complete() {
            flush();
            if (lastState != null && onCompleted != null) {
                try {
                    onCompleted.accept(lastState);
                } catch (RuntimeException e) {
                    log.warn("Completion hook failed: {}", e.getMessage());
                }
            }
            pending.add(AgentStreamEvent.done());
            finished = true;
        }

        private void fail(RuntimeException error) {
            flush();
            String code;
            String message;
            if (error instanceof GraphTimeoutException timeout) {
                code = timeout.getCode();
                message = TIMEOUT_MESSAGE;
            } else if (error instanceof AgentException agentException) {
                code = agentException.getCode();
                message = FAILURE_MESSAGE;
            } else {
                code = "GRAPH_ERROR";
                message = FAILURE_MESSAGE;
            }
            log.error("Streamed run failed [{}]: {}", code, error.getMessage(), error);
            pending.add(AgentStreamEvent.error(message, code));
            pending.add(AgentStreamEvent.done());
            finished = true;
        }
    }
}
