package com.eainde.athlete.nodes;

import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.llm.QueryPlan;
import com.eainde.athlete.llm.QueryPlanner;
import com.eainde.athlete.state.RunState;
import com.eainde.athlete.state.SubQuery;
import com.eainde.athlete.state.TopicDomain;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Splits multi-part questions into focused sub-queries that the retriever searches separately.
 * Anything short of two usable sub-queries is treated as a simple question.
 */
@Slf4j
@Component
public class QueryPlannerNode implements AsyncNodeAction<RunState> {

    private static final Map<String, Object> SIMPLE = Map.of(
            RunState.IS_COMPLEX_QUERY, false,
            RunState.SUB_QUERIES, List.of());

    private final QueryPlanner planner;
    private final AgentProperties properties;

    public QueryPlannerNode(QueryPlanner planner, AgentProperties properties) {
        this.planner = planner;
        this.properties = properties;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RunState state) {
        String question = state.getCurrentQuestion();
        if (question.isBlank()) {
            return CompletableFuture.completedFuture(SIMPLE);
        }
        int maxSubQueries = properties.getPlanner().getMaxSubQueries();
        try {
            QueryPlan plan = planner.plan(question, maxSubQueries,
                    state.getTopicDomain() == null ? "unknown" : state.getTopicDomain().value(),
                    String.join(", ", state.getDetectedOrgIds()));
            if (plan == null || !plan.isComplex() || plan.subQueries() == null) {
                return CompletableFuture.completedFuture(SIMPLE);
            }

            List<SubQuery> subQueries = new ArrayList<>();
            for (QueryPlan.PlannedQuery item : plan.subQueries()) {
                String query = item == null || item.query() == null ? "" : item.query().trim();
                if (query.isEmpty()) {
                    continue;
                }
                TopicDomain domain = TopicDomain.fromValue(item.domain()).orElse(null);
                List<String> orgIds = item.ngbIds() == null ? List.of()
                        : item.ngbIds().stream().filter(Objects::nonNull).toList();
                subQueries.add(new SubQuery(query, domain, orgIds));
                if (subQueries.size() == maxSubQueries) {
                    break;
                }
            }
            if (subQueries.size() < 2) {
                return CompletableFuture.completedFuture(SIMPLE);
            }
            log.info("Planned {} sub-queries", subQueries.size());
            return CompletableFuture.completedFuture(Map.of(
                    RunState.IS_COMPLEX_QUERY, true,
                    RunState.SUB_QUERIES, List.copyOf(subQueries)));
        } catch (RuntimeException e) {
            log.warn("Query planning failed, treating as simple query: {}", e.getMessage());
            return CompletableFuture.completedFuture(SIMPLE);
        }
    }
}
