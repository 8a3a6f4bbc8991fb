package com.eainde.athlete.nodes;

import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.research.WebSearchClient;
import com.eainde.athlete.resilience.DependencyGuard;
import com.eainde.athlete.resilience.DependencyGuardRegistry;
import com.eainde.athlete.state.RunState;
import com.eainde.athlete.state.TopicDomain;
import com.eainde.athlete.state.WebSearchResult;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Searches trusted governance websites when the document index could not answer confidently.
 * Fails open to no web results.
 */
@Slf4j
@Component
public class ResearcherNode implements AsyncNodeAction<RunState> {

    private final WebSearchClient webSearch;
    private final DependencyGuard breaker;
    private final AgentProperties.Research settings;

    public ResearcherNode(WebSearchClient webSearch, DependencyGuardRegistry breakers, AgentProperties properties) {
        this.webSearch = webSearch;
        this.breaker = breakers.get(DependencyGuardRegistry.WEB);
        this.settings = properties.getResearch();
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RunState state) {
        String question = state.getCurrentQuestion();
        if (question.isBlank()) {
            return CompletableFuture.completedFuture(empty());
        }
        TopicDomain domain = state.getTopicDomain();
        String query = domain == null ? question : domain.label() + ": " + question;

        List<WebSearchResult> results = breaker.executeWithFallback(
                () -> webSearch.search(query, settings.getMaxResults(), settings.getTrustedDomains()),
                List::of);
        List<WebSearchResult> limited = results.stream()
                .filter(r -> r.url() != null && !r.url().isBlank())
                .limit(settings.getMaxResults())
                .toList();
        log.info("Web search returned {} results", limited.size());

        List<String> formatted = limited.stream()
                .map(r -> "[" + r.title() + "](" + r.url() + ")\n" + r.content())
                .toList();
        return CompletableFuture.completedFuture(Map.of(
                RunState.WEB_SEARCH_RESULTS, formatted,
                RunState.WEB_SEARCH_RESULT_URLS, limited));
    }

    private static Map<String, Object> empty() {
        return Map.of(RunState.WEB_SEARCH_RESULTS, List.of(), RunState.WEB_SEARCH_RESULT_URLS, List.of());
    }
}
