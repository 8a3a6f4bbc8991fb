package com.eainde.athlete.llm;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Rewrites a question into alternative search queries for a second retrieval pass.
 */
public interface QueryExpander {

    @SystemMessage(fromResource = "/prompts/retrieval-expander.txt")
    ExpandedQueries expand(@UserMessage String question,
                           @V("count") int count,
                           @V("existingTitles") String existingTitles);
}
