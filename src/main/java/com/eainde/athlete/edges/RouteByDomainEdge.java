package com.eainde.athlete.edges;

import com.eainde.athlete.state.QueryIntent;
import com.eainde.athlete.state.RunState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class RouteByDomainEdge implements AsyncEdgeAction<RunState> {

    @Override
    public CompletableFuture<String> apply(RunState state) {
        return CompletableFuture.completedFuture(route(state).name());
    }

    public DomainRoute route(RunState state) {
        DomainRoute route;
        if (state.needsClarification()) {
            route = DomainRoute.CLARIFY;
        } else if (state.getQueryIntent() == QueryIntent.ESCALATION) {
            route = DomainRoute.ESCALATE;
        } else {
            route = DomainRoute.PLAN;
        }
        return route;
    }
}
