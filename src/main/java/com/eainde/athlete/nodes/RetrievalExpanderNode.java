package com.eainde.athlete.nodes;

import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.llm.ExpandedQueries;
import com.eainde.athlete.llm.QueryExpander;
import com.eainde.athlete.retrieval.ConfidenceScorer;
import com.eainde.athlete.retrieval.DocumentMerger;
import com.eainde.athlete.retrieval.HybridRetriever;
import com.eainde.athlete.retrieval.SearchFilter;
import com.eainde.athlete.state.RetrievedDocument;
import com.eainde.athlete.state.RunState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Second retrieval pass for low-confidence results: a fast model rewrites the question into a
 * few alternative queries, each is searched concurrently, and documents with unseen content are
 * added to the existing ones. Documents already accepted keep their scores and distances.
 * <p>
 * Always marks {@code expansionAttempted}. When reformulation or every search fails the node
 * returns only that flag, so routing moves on instead of trying again.
 */
@Slf4j
@Component
public class RetrievalExpanderNode implements AsyncNodeAction<RunState> {

    static final int MIN_QUERIES = 2;
    static final int MAX_QUERIES = 4;

    private final QueryExpander expander;
    private final HybridRetriever retriever;
    private final AgentProperties.Retrieval settings;
    private final Executor executor;

    public RetrievalExpanderNode(QueryExpander expander, HybridRetriever retriever, AgentProperties properties,
                                 @Qualifier("searchExecutor") Executor searchExecutor) {
        this.expander = expander;
        this.retriever = retriever;
        this.settings = properties.getRetrieval();
        this.executor = searchExecutor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RunState state) {
        String question = state.getCurrentQuestion();
        List<String> queries = reformulate(question, state.getRetrievedDocuments());
        if (queries.isEmpty()) {
            return CompletableFuture.completedFuture(Map.of(RunState.EXPANSION_ATTEMPTED, true));
        }

        SearchFilter filter = SearchFilter.broaden(state.getDetectedOrgIds());
        List<CompletableFuture<List<RetrievedDocument>>> searches = queries.stream()
                .map(query -> CompletableFuture.supplyAsync(
                        () -> retriever.retrieve(query, settings.getExpansionTopK(), filter).documents(), executor))
                .toList();

        List<List<RetrievedDocument>> found = new ArrayList<>();
        for (CompletableFuture<List<RetrievedDocument>> search : searches) {
            try {
                found.add(search.join());
            } catch (CompletionException e) {
                log.warn("Expansion search failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            }
        }
        if (found.isEmpty()) {
            log.warn("All {} expansion searches failed", queries.size());
            return CompletableFuture.completedFuture(Map.of(
                    RunState.EXPANSION_ATTEMPTED, true,
                    RunState.REFORMULATED_QUERIES, queries));
        }

        List<RetrievedDocument> merged = DocumentMerger.extend(state.getRetrievedDocuments(), found);
        double confidence = ConfidenceScorer.score(merged, settings.getTopK());
        log.info("Expansion with {} queries: {} -> {} documents, confidence {} -> {}",
                queries.size(), state.getRetrievedDocuments().size(), merged.size(),
                String.format("%.3f", state.getRetrievalConfidence()), String.format("%.3f", confidence));

        return CompletableFuture.completedFuture(Map.of(
                RunState.RETRIEVED_DOCUMENTS, merged,
                RunState.RETRIEVAL_CONFIDENCE, confidence,
                RunState.EXPANSION_ATTEMPTED, true,
                RunState.REFORMULATED_QUERIES, queries));
    }

    private List<String> reformulate(String question, List<RetrievedDocument> existing) {
        if (question.isBlank()) {
            return List.of();
        }
        String titles = existing.stream()
                .map(d -> d.metadata() == null ? null : d.metadata().documentTitle())
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.joining("\n- ", "- ", ""));
        try {
            ExpandedQueries expanded = expander.expand(question, MAX_QUERIES - 1,
                    existing.isEmpty() ? "(none)" : titles);
            if (expanded == null || expanded.queries() == null) {
                log.warn("Expander returned no usable query list");
                return List.of();
            }
            Set<String> queries = new LinkedHashSet<>();
            for (String item : expanded.queries()) {
                String query = item == null ? "" : item.trim();
                if (!query.isEmpty() && !query.equalsIgnoreCase(question.trim())) {
                    queries.add(query);
                }
            }
            List<String> result = queries.stream().limit(MAX_QUERIES).toList();
            if (result.size() < MIN_QUERIES) {
                log.warn("Expander produced {} distinct queries, need at least {}", result.size(), MIN_QUERIES);
                return List.of();
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Query reformulation failed: {}", e.getMessage());
            return List.of();
        }
    }
}
