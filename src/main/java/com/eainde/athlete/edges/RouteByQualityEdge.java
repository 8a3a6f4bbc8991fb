package com.eainde.athlete.edges;

import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.state.QualityCheckResult;
import com.eainde.athlete.state.RunState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Sends a failed draft back to the synthesizer until the retry budget is spent. The budget
 * counts reruns, so the synthesizer runs at most {@code maxRetries + 1} times.
 */
@Slf4j
@Component
public class RouteByQualityEdge implements AsyncEdgeAction<RunState> {

    private final int maxRetries;

    public RouteByQualityEdge(AgentProperties properties) {
        this.maxRetries = properties.getQuality().getMaxRetries();
    }

    @Override
    public CompletableFuture<String> apply(RunState state) {
        return CompletableFuture.completedFuture(route(state).name());
    }

    public QualityRoute route(RunState state) {
        QualityCheckResult result = state.getQualityCheckResult();
        if (result == null || result.passed()) {
            return QualityRoute.ACCEPT;
        }
        if (state.getQualityRetryCount() >= maxRetries) {
            log.info("Quality retries exhausted ({}), accepting the last draft", maxRetries);
            return QualityRoute.ACCEPT;
        }
        return QualityRoute.RETRY;
    }
}
