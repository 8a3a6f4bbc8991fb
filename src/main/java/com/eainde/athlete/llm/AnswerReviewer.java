package com.eainde.athlete.llm;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Reviews a draft answer against the evidence it was written from.
 */
public interface AnswerReviewer {

    @SystemMessage(fromResource = "/prompts/quality-checker.txt")
    @UserMessage("""
            Question:
            {{question}}

            Draft answer:
            {{draft}}""")
    AnswerReview review(@V("question") String question,
                        @V("draft") String draft,
                        @V("documents") String documents,
                        @V("webResults") String webResults);
}
