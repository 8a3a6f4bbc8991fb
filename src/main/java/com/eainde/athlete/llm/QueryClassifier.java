package com.eainde.athlete.llm;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Classifies an athlete's question. Implemented by LangChain4j {@code AiServices}.
 */
public interface QueryClassifier {

    @SystemMessage(fromResource = "/prompts/classifier.txt")
    Classification classify(@UserMessage String question,
                            @V("domains") String domains,
                            @V("history") String history,
                            @V("summary") String summary);
}
