package com.eainde.athlete.workflow;

import com.eainde.athlete.checkpoint.Checkpoint;
import com.eainde.athlete.checkpoint.CheckpointStore;
import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.exception.AgentException;
import com.eainde.athlete.graph.EnumCompiledGraph;
import com.eainde.athlete.graph.GraphStream;
import com.eainde.athlete.graph.RunOptions;
import com.eainde.athlete.memory.ConversationMemory;
import com.eainde.athlete.nodes.NodeId;
import com.eainde.athlete.state.ConversationMessage;
import com.eainde.athlete.state.RunState;
import com.eainde.athlete.state.TopicDomain;
import com.eainde.athlete.stream.AgentStreamEvent;
import com.eainde.athlete.stream.StreamAdapter;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Entry point for answering questions, in blocking or streaming form.
 * <p>
 * Each run gets a fresh id that doubles as the checkpoint thread id, and both the run id and the
 * conversation id are placed in the logging MDC for the duration of the call. Worker pools copy
 * the MDC, so node logs carry the same keys.
 * <p>
 * After a successful run the conversation summary is refreshed in the background; a failure
 * there never affects the answer already produced.
 */
@Log4j2
@Service
public class AgentRunner {

    static final String MDC_RUN_ID = "runId";
    static final String MDC_CONVERSATION_ID = "conversationId";

    private final EnumCompiledGraph<NodeId, RunState> workflow;
    private final ConversationMemory memory;
    private final StreamAdapter streamAdapter;
    private final ObjectProvider<CheckpointStore> checkpointStore;
    private final AgentProperties properties;

    public AgentRunner(@Qualifier("answerWorkflow") EnumCompiledGraph<NodeId, RunState> workflow,
                       ConversationMemory memory,
                       StreamAdapter streamAdapter,
                       ObjectProvider<CheckpointStore> checkpointStore,
                       AgentProperties properties) {
        this.workflow = workflow;
        this.memory = memory;
        this.streamAdapter = streamAdapter;
        this.checkpointStore = checkpointStore;
        this.properties = properties;
    }

    /**
     * Runs the pipeline to completion within {@code agent.deadlines.invoke}.
     *
     * @throws AgentException with code {@code INVALID_REQUEST} for a blank message, or whatever
     *                        the run raised (timeout, divergence, node failure)
     */
    public AgentResponse invoke(AgentRequest request) {
        validate(request);
        String runId = UUID.randomUUID().toString();
        putMdc(runId, request.conversationId());
        try {
            Optional<String> summary = memory.load(request.conversationId());
            log.info("Starting run for message of {} chars", request.message().length());

            RunOptions options = new RunOptions(properties.getDeadlines().getInvoke(),
                    properties.getGraph().getMaxSteps(), runId);
            RunState result = workflow.invoke(initialState(request, summary.orElse(null)), options);

            log.info("Run finished: domain={}, escalated={}, citations={}",
                    result.getTopicDomain(), result.getEscalation() != null, result.getCitations().size());
            refreshMemory(request, summary.orElse(null), result);
            return toResponse(runId, result);
        } finally {
            clearMdc();
        }
    }

    /**
     * Starts the pipeline within {@code agent.deadlines.stream} and returns its client events.
     * Closing the returned stream cancels the run.
     */
    public Stream<AgentStreamEvent> stream(AgentRequest request) {
        validate(request);
        String runId = UUID.randomUUID().toString();
        putMdc(runId, request.conversationId());
        try {
            Optional<String> summary = memory.load(request.conversationId());
            log.info("Starting streamed run for message of {} chars", request.message().length());

            RunOptions options = new RunOptions(properties.getDeadlines().getStream(),
                    properties.getGraph().getMaxSteps(), runId);
            GraphStream<NodeId, RunState> chunks =
                    workflow.stream(initialState(request, summary.orElse(null)), options);
            return streamAdapter.adapt(chunks, chunks::close,
                    finalState -> refreshMemory(request, summary.orElse(null), finalState));
        } finally {
            clearMdc();
        }
    }

    /** Latest checkpoint of a run, empty when checkpointing is off or the run is unknown. */
    public Optional<Checkpoint> latestCheckpoint(String runId) {
        CheckpointStore store = checkpointStore.getIfAvailable();
        return store == null ? Optional.empty() : store.latest(runId);
    }

    private void validate(AgentRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            throw new AgentException("INVALID_REQUEST", "Message must not be blank");
        }
    }

    static Map<String, Object> initialState(AgentRequest request, String summary) {
        List<ConversationMessage> messages = new ArrayList<>(request.historyOrEmpty());
        messages.add(ConversationMessage.user(request.message()));

        Map<String, Object> state = new HashMap<>();
        state.put(RunState.MESSAGES, List.copyOf(messages));
        if (request.conversationId() != null) {
            state.put(RunState.CONVERSATION_ID, request.conversationId());
        }
        if (summary != null) {
            state.put(RunState.CONVERSATION_SUMMARY, summary);
        }
        if (request.userSport() != null) {
            state.put(RunState.USER_SPORT, request.userSport());
        }
        return state;
    }

    private void refreshMemory(AgentRequest request, String previousSummary, RunState result) {
        memory.updateAsync(request.conversationId(), previousSummary, request.message(), result.getAnswer())
                .exceptionally(e -> {
                    log.warn("Conversation summary update failed: {}", e.getMessage());
                    return null;
                });
    }

    private static AgentResponse toResponse(String runId, RunState state) {
        TopicDomain domain = state.getTopicDomain();
        return new AgentResponse(runId, state.getAnswer(), state.getCitations(), state.getEscalation(),
                domain == null ? null : domain.value(), state.getRetrievalConfidence());
    }

    private static void putMdc(String runId, String conversationId) {
        MDC.put(MDC_RUN_ID, runId);
        if (conversationId != null) {
            MDC.put(MDC_CONVERSATION_ID, conversationId);
        }
    }

    private static void clearMdc() {
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_CONVERSATION_ID);
    }
}
