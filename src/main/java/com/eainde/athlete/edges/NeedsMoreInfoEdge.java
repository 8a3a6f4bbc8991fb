package com.eainde.athlete.edges;

import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.state.RunState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Decides whether the evidence gathered so far is enough to answer.
 * Expansion is tried at most once per run; after that the web is the last resort.
 */
@Slf4j
@Component
public class NeedsMoreInfoEdge implements AsyncEdgeAction<RunState> {

    private final AgentProperties.Retrieval settings;

    public NeedsMoreInfoEdge(AgentProperties properties) {
        this.settings = properties.getRetrieval();
    }

    @Override
    public CompletableFuture<String> apply(RunState state) {
        return CompletableFuture.completedFuture(route(state).name());
    }

    public EvidenceRoute route(RunState state) {
        EvidenceRoute route;
        if (state.getRetrievalConfidence() >= settings.getConfidenceThreshold()) {
            route = EvidenceRoute.SYNTHESIZE;
        } else if (!state.getWebSearchResults().isEmpty()) {
            route = EvidenceRoute.SYNTHESIZE;
        } else if (settings.isExpansionEnabled() && !state.isExpansionAttempted()) {
            route = EvidenceRoute.EXPAND;
        } else {
            route = EvidenceRoute.RESEARCH;
        }
        log.debug("confidence {} -> {}", state.getRetrievalConfidence(), route);
        return route;
    }
}
