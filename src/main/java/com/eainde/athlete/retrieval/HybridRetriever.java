package com.eainde.athlete.retrieval;

import com.eainde.athlete.exception.RetrievalException;
import com.eainde.athlete.resilience.DependencyGuard;
import com.eainde.athlete.state.RetrievedDocument;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs vector and lexical search concurrently against the same filter, fuses the two ranked
 * lists with {@link RrfFusion} and scores the accepted set with {@link ConfidenceScorer}.
 * <p>
 * Each side goes through its own circuit breaker. If one side fails the other side's results
 * are used alone; only when both fail is a {@link RetrievalException} raised.
 */
@Slf4j
public class HybridRetriever {

    private final VectorSearch vectorSearch;
    private final LexicalSearch lexicalSearch;
    private final DependencyGuard vectorBreaker;
    private final DependencyGuard lexicalBreaker;
    private final RrfFusion fusion;
    private final Executor executor;

    public HybridRetriever(VectorSearch vectorSearch,
                           LexicalSearch lexicalSearch,
                           DependencyGuard vectorBreaker,
                           DependencyGuard lexicalBreaker,
                           RrfFusion fusion,
                           Executor executor) {
        this.vectorSearch = vectorSearch;
        this.lexicalSearch = lexicalSearch;
        this.vectorBreaker = vectorBreaker;
        this.lexicalBreaker = lexicalBreaker;
        this.fusion = fusion;
        this.executor = executor;
    }

    public RetrievalResult retrieve(String query, int k, SearchFilter filter) {
        CompletableFuture<SideResult<VectorMatch>> vector = CompletableFuture
                .supplyAsync(() -> vectorBreaker.execute(() -> vectorSearch.similaritySearch(query, k, filter)), executor)
                .handle(SideResult::of);
        CompletableFuture<SideResult<LexicalMatch>> lexical = CompletableFuture
                .supplyAsync(() -> lexicalBreaker.execute(() -> lexicalSearch.search(query, k, filter)), executor)
                .handle(SideResult::of);

        SideResult<VectorMatch> vectorResult = vector.join();
        SideResult<LexicalMatch> lexicalResult = lexical.join();

        if (vectorResult.failed() && lexicalResult.failed()) {
            throw new RetrievalException("Both vector and lexical search failed for query", vectorResult.error());
        }
        if (vectorResult.failed()) {
            log.warn("Vector search failed, using lexical results only: {}", vectorResult.error().getMessage());
        }
        if (lexicalResult.failed()) {
            log.warn("Lexical search failed, using vector results only: {}", lexicalResult.error().getMessage());
        }

        List<RetrievedDocument> fused = fusion.fuse(vectorResult.matches(), lexicalResult.matches(), k);
        double confidence = ConfidenceScorer.score(fused, k);
        log.debug("Retrieved {} vector + {} lexical -> {} fused, confidence {}",
                vectorResult.matches().size(), lexicalResult.matches().size(), fused.size(),
                String.format("%.3f", confidence));
        return new RetrievalResult(fused, confidence);
    }

    private record SideResult<T>(List<T> matches, Throwable error) {

        static <T> SideResult<T> of(List<T> matches, Throwable error) {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                return new SideResult<>(List.of(), cause);
            }
            return new SideResult<>(matches == null ? List.of() : matches, null);
        }

        boolean failed() {
            return error != null;
        }
    }
}
