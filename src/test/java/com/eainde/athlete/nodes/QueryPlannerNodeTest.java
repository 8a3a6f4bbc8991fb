package com.eainde.athlete.nodes;

import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.llm.QueryPlan;
import com.eainde.athlete.llm.QueryPlan.PlannedQuery;
import com.eainde.athlete.llm.QueryPlanner;
import com.eainde.athlete.state.RunState;
import com.eainde.athlete.state.SubQuery;
import com.eainde.athlete.state.TopicDomain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.eainde.athlete.nodes.NodeFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryPlannerNodeTest {

    @Mock
    private QueryPlanner planner;

    private AgentProperties properties;
    private QueryPlannerNode node;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        node = new QueryPlannerNode(planner, properties);
    }

    private Map<String, Object> plan() {
        return node.apply(state("How is the team picked and how do I appeal if I'm left off?")).join();
    }

    private void answers(QueryPlan plan) {
        when(planner.plan(anyString(), anyInt(), anyString(), anyString())).thenReturn(plan);
    }

    private static PlannedQuery query(String text) {
        return new PlannedQuery(text, null, null);
    }

    @Test
    @DisplayName("turns a complex plan into sub-queries")
    void complex() {
        answers(new QueryPlan(true, List.of(
                new PlannedQuery("team selection criteria", "team_selection", List.of("usa_fencing")),
                new PlannedQuery("selection appeal process", "dispute_resolution", null),
                query("  "))));

        Map<String, Object> patch = plan();

        assertThat(patch).containsEntry(RunState.IS_COMPLEX_QUERY, true);
        assertThat(patch.get(RunState.SUB_QUERIES)).isEqualTo(List.of(
                new SubQuery("team selection criteria", TopicDomain.TEAM_SELECTION, List.of("usa_fencing")),
                new SubQuery("selection appeal process", TopicDomain.DISPUTE_RESOLUTION, List.of())));
    }

    @Test
    @DisplayName("sends the configured cap and an unknown domain marker")
    void promptVariables() {
        answers(new QueryPlan(false, List.of()));

        plan();

        verify(planner).plan(anyString(), eq(properties.getPlanner().getMaxSubQueries()), eq("unknown"), eq(""));
    }

    @Test
    @DisplayName("caps the number of sub-queries")
    void capsSubQueries() {
        properties.getPlanner().setMaxSubQueries(2);
        answers(new QueryPlan(true, List.of(query("a"), query("b"), query("c"))));

        assertThat(plan().get(RunState.SUB_QUERIES)).asList().hasSize(2);
    }

    @Test
    @DisplayName("a single usable sub-query is treated as a simple question")
    void singleSubQuery() {
        answers(new QueryPlan(true, List.of(query("only one"))));

        assertThat(plan()).containsEntry(RunState.IS_COMPLEX_QUERY, false).containsEntry(RunState.SUB_QUERIES, List.of());
    }

    @Test
    @DisplayName("a complex flag without sub-queries is treated as a simple question")
    void missingSubQueries() {
        answers(new QueryPlan(true, null));

        assertThat(plan()).containsEntry(RunState.IS_COMPLEX_QUERY, false);
    }

    @Test
    @DisplayName("planning failures fall back to a simple question")
    void failure() {
        when(planner.plan(anyString(), anyInt(), anyString(), anyString())).thenThrow(new IllegalStateException("quota"));

        assertThat(plan()).containsEntry(RunState.IS_COMPLEX_QUERY, false);
    }
}
