package com.eainde.athlete.config;

import com.eainde.athlete.research.TavilyWebSearchClient;
import com.eainde.athlete.research.WebSearchClient;
import com.eainde.athlete.resilience.DependencyGuardRegistry;
import com.eainde.athlete.retrieval.HybridRetriever;
import com.eainde.athlete.retrieval.LexicalSearch;
import com.eainde.athlete.retrieval.PgLexicalSearch;
import com.eainde.athlete.retrieval.PgVectorSearch;
import com.eainde.athlete.retrieval.RrfFusion;
import com.eainde.athlete.retrieval.VectorSearch;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.embedding.EmbeddingModel;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

@Configuration
public class RetrievalConfig {

    @Bean
    public VectorSearch vectorSearch(NamedParameterJdbcTemplate jdbcTemplate, EmbeddingModel embeddingModel,
                                     ObjectMapper objectMapper) {
        return new PgVectorSearch(jdbcTemplate, embeddingModel, objectMapper);
    }

    @Bean
    public LexicalSearch lexicalSearch(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new PgLexicalSearch(jdbcTemplate, objectMapper);
    }

    @Bean
    public RrfFusion rrfFusion(AgentProperties properties) {
        return new RrfFusion(properties.getRetrieval().getRrfK(), properties.getRetrieval().getVectorWeight());
    }

    @Bean
    public HybridRetriever hybridRetriever(VectorSearch vectorSearch,
                                           LexicalSearch lexicalSearch,
                                           DependencyGuardRegistry breakers,
                                           RrfFusion fusion,
                                           @Qualifier("searchExecutor") ExecutorService searchExecutor) {
        return new HybridRetriever(vectorSearch, lexicalSearch,
                breakers.get(DependencyGuardRegistry.VECTOR),
                breakers.get(DependencyGuardRegistry.LEXICAL),
                fusion, searchExecutor);
    }

    @Bean
    public OkHttpClient webSearchHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(Duration.ofSeconds(15))
                .build();
    }

    @Bean
    public WebSearchClient webSearchClient(OkHttpClient webSearchHttpClient, ObjectMapper objectMapper,
                                           AgentProperties properties) {
        AgentProperties.Research research = properties.getResearch();
        return new TavilyWebSearchClient(webSearchHttpClient, objectMapper, research.getBaseUrl(),
                research.getApiKey());
    }
}
