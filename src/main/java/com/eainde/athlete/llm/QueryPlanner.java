package com.eainde.athlete.llm;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface QueryPlanner {

    @SystemMessage(fromResource = "/prompts/query-planner.txt")
    QueryPlan plan(@UserMessage String question,
                   @V("maxSubQueries") int maxSubQueries,
                   @V("domain") String domain,
                   @V("orgIds") String orgIds);
}
