package com.eainde.athlete.nodes;

import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.retrieval.ConfidenceScorer;
import com.eainde.athlete.retrieval.DocumentMerger;
import com.eainde.athlete.retrieval.HybridRetriever;
import com.eainde.athlete.retrieval.RetrievalResult;
import com.eainde.athlete.retrieval.SearchFilter;
import com.eainde.athlete.state.RetrievalStatus;
import com.eainde.athlete.state.RetrievedDocument;
import com.eainde.athlete.state.RunState;
import com.eainde.athlete.state.SubQuery;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Retrieves governance documents for the question.
 * <p>
 * Simple questions search with a narrow filter (detected organizations and domain) and broaden
 * to organization-or-universal documents in any domain when too few results come back. Planned
 * sub-queries are searched concurrently, each with its own filter, and merged.
 * A retrieval failure is not fatal: the node reports status {@code error} with no documents.
 */
@Slf4j
@Component
public class RetrieverNode implements AsyncNodeAction<RunState> {

    private final HybridRetriever retriever;
    private final AgentProperties.Retrieval settings;
    private final Executor executor;

    public RetrieverNode(HybridRetriever retriever, AgentProperties properties,
                         @Qualifier("searchExecutor") Executor searchExecutor) {
        this.retriever = retriever;
        this.settings = properties.getRetrieval();
        this.executor = searchExecutor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RunState state) {
        try {
            List<RetrievedDocument> documents = state.isComplexQuery() && state.getSubQueries().size() >= 2
                    ? retrieveSubQueries(state)
                    : retrieveSingle(state);
            double confidence = ConfidenceScorer.score(documents, settings.getTopK());
            log.info("Retrieved {} documents, confidence {}", documents.size(), String.format("%.3f", confidence));
            return CompletableFuture.completedFuture(Map.of(
                    RunState.RETRIEVED_DOCUMENTS, documents,
                    RunState.RETRIEVAL_CONFIDENCE, confidence,
                    RunState.RETRIEVAL_STATUS, RetrievalStatus.SUCCESS));
        } catch (RuntimeException e) {
            log.error("Retrieval failed: {}", e.getMessage());
            return CompletableFuture.completedFuture(Map.of(
                    RunState.RETRIEVED_DOCUMENTS, List.of(),
                    RunState.RETRIEVAL_CONFIDENCE, 0.0,
                    RunState.RETRIEVAL_STATUS, RetrievalStatus.ERROR));
        }
    }

    private List<RetrievedDocument> retrieveSingle(RunState state) {
        String query = ConversationContext.contextualQuery(
                state.getCurrentQuestion(), state.getMessages(), settings.getContextCharLimit());
        SearchFilter narrow = SearchFilter.narrow(state.getDetectedOrgIds(), state.getTopicDomain());
        RetrievalResult narrowResult = retriever.retrieve(query, settings.getNarrowTopK(), narrow);

        SearchFilter broad = SearchFilter.broaden(state.getDetectedOrgIds());
        boolean canBroaden = state.getTopicDomain() != null || !state.getDetectedOrgIds().isEmpty();
        if (narrowResult.documents().size() >= settings.getBroadenMinResults() || !canBroaden) {
            return narrowResult.documents();
        }
        log.debug("Narrow search returned {} results, broadening", narrowResult.documents().size());
        RetrievalResult broadResult = retriever.retrieve(query, settings.getTopK(), broad);
        return DocumentMerger.merge(List.of(narrowResult.documents(), broadResult.documents()), settings.getTopK());
    }

    private List<RetrievedDocument> retrieveSubQueries(RunState state) {
        List<CompletableFuture<List<RetrievedDocument>>> searches = new ArrayList<>();
        for (SubQuery subQuery : state.getSubQueries()) {
            List<String> orgIds = subQuery.organizationIds().isEmpty()
                    ? state.getDetectedOrgIds() : subQuery.organizationIds();
            SearchFilter filter = SearchFilter.narrow(orgIds, subQuery.domain());
            searches.add(CompletableFuture.supplyAsync(
                    () -> retriever.retrieve(subQuery.query(), settings.getNarrowTopK(), filter).documents(),
                    executor));
        }
        List<List<RetrievedDocument>> results = new ArrayList<>();
        RuntimeException lastError = null;
        for (CompletableFuture<List<RetrievedDocument>> search : searches) {
            try {
                results.add(search.join());
            } catch (CompletionException e) {
                lastError = e.getCause() instanceof RuntimeException runtime ? runtime : e;
                log.warn("Sub-query search failed: {}", lastError.getMessage());
            }
        }
        if (results.isEmpty() && lastError != null) {
            throw lastError;
        }
        return DocumentMerger.merge(results, settings.getTopK());
    }
}
