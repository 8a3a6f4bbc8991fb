package com.eainde.athlete.config;

import com.eainde.athlete.llm.AnswerReviewer;
import com.eainde.athlete.llm.GuardedChatModel;
import com.eainde.athlete.llm.LangChainLlmClient;
import com.eainde.athlete.llm.LlmClient;
import com.eainde.athlete.llm.ModelRole;
import com.eainde.athlete.llm.QueryClassifier;
import com.eainde.athlete.llm.QueryExpander;
import com.eainde.athlete.llm.QueryPlanner;
import com.eainde.athlete.resilience.DependencyGuard;
import com.eainde.athlete.resilience.RetryExecutor;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.vertexai.VertexAiEmbeddingModel;
import dev.langchain4j.model.vertexai.VertexAiGeminiChatModel;
import dev.langchain4j.model.vertexai.VertexAiGeminiStreamingChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Vertex AI Gemini models, one blocking and one streaming model per {@link ModelRole}, plus the
 * embedding model used by vector search.
 * <p>
 * Roles that answer with structured JSON are exposed as typed {@link AiServices} interfaces;
 * free-text roles go through {@link LlmClient}. Both share the {@code llm} breaker and retry.
 */
@Slf4j
@Configuration
public class ModelConfig {

    private static final Set<ModelRole> FREE_TEXT_ROLES =
            EnumSet.of(ModelRole.SYNTHESIZER, ModelRole.ESCALATION, ModelRole.SUMMARY);

    @Bean
    public LlmClient llmClient(AgentProperties properties,
                               @Qualifier("llmBreaker") DependencyGuard llmBreaker,
                               RetryExecutor llmRetry) {
        AgentProperties.Vertex vertex = properties.getVertex();
        Map<ModelRole, ChatModel> chatModels = new EnumMap<>(ModelRole.class);
        Map<ModelRole, StreamingChatModel> streamingModels = new EnumMap<>(ModelRole.class);
        for (ModelRole role : FREE_TEXT_ROLES) {
            chatModels.put(role, vertexModel(properties, role));
        }
        AgentProperties.Model synthesizer = properties.model(ModelRole.SYNTHESIZER);
        streamingModels.put(ModelRole.SYNTHESIZER, VertexAiGeminiStreamingChatModel.builder()
                .project(vertex.getProject())
                .location(vertex.getLocation())
                .modelName(synthesizer.getName())
                .temperature((float) synthesizer.getTemperature())
                .maxOutputTokens(synthesizer.getMaxOutputTokens())
                .build());
        return new LangChainLlmClient(chatModels, streamingModels, llmBreaker, llmRetry);
    }

    @Bean
    public QueryClassifier queryClassifier(AgentProperties properties,
                                           @Qualifier("llmBreaker") DependencyGuard llmBreaker,
                                           RetryExecutor llmRetry) {
        return AiServices.builder(QueryClassifier.class)
                .chatModel(guarded(properties, ModelRole.CLASSIFIER, llmBreaker, llmRetry))
                .build();
    }

    @Bean
    public QueryPlanner queryPlanner(AgentProperties properties,
                                     @Qualifier("llmBreaker") DependencyGuard llmBreaker,
                                     RetryExecutor llmRetry) {
        return AiServices.builder(QueryPlanner.class)
                .chatModel(guarded(properties, ModelRole.PLANNER, llmBreaker, llmRetry))
                .build();
    }

    @Bean
    public QueryExpander queryExpander(AgentProperties properties,
                                       @Qualifier("llmBreaker") DependencyGuard llmBreaker,
                                       RetryExecutor llmRetry) {
        return AiServices.builder(QueryExpander.class)
                .chatModel(guarded(properties, ModelRole.EXPANDER, llmBreaker, llmRetry))
                .build();
    }

    @Bean
    public AnswerReviewer answerReviewer(AgentProperties properties,
                                         @Qualifier("llmBreaker") DependencyGuard llmBreaker,
                                         RetryExecutor llmRetry) {
        return AiServices.builder(AnswerReviewer.class)
                .chatModel(guarded(properties, ModelRole.QUALITY, llmBreaker, llmRetry))
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(AgentProperties properties) {
        AgentProperties.Vertex vertex = properties.getVertex();
        return VertexAiEmbeddingModel.builder()
                .endpoint(vertex.getLocation() + "-aiplatform.googleapis.com:443")
                .project(vertex.getProject())
                .location(vertex.getLocation())
                .publisher("google")
                .modelName(vertex.getEmbeddingModel())
                .build();
    }

    private static ChatModel guarded(AgentProperties properties, ModelRole role,
                                     DependencyGuard breaker, RetryExecutor retry) {
        return new GuardedChatModel(vertexModel(properties, role), breaker, retry);
    }

    private static ChatModel vertexModel(AgentProperties properties, ModelRole role) {
        AgentProperties.Vertex vertex = properties.getVertex();
        AgentProperties.Model model = properties.model(role);
        log.info("Model for {}: {} (temperature {}, max tokens {})",
                role, model.getName(), model.getTemperature(), model.getMaxOutputTokens());
        return VertexAiGeminiChatModel.builder()
                .project(vertex.getProject())
                .location(vertex.getLocation())
                .modelName(model.getName())
                .temperature((float) model.getTemperature())
                .maxOutputTokens(model.getMaxOutputTokens())
                .build();
    }
}
