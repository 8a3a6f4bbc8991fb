package com.eainde.athlete.config;

import com.eainde.athlete.checkpoint.CheckpointRetentionJob;
import com.eainde.athlete.checkpoint.CheckpointStore;
import com.eainde.athlete.checkpoint.CheckpointStoreSaver;
import com.eainde.athlete.checkpoint.InMemoryCheckpointStore;
import com.eainde.athlete.checkpoint.JdbcCheckpointStore;
import com.eainde.athlete.llm.LlmClient;
import com.eainde.athlete.memory.ConversationMemory;
import com.eainde.athlete.memory.ConversationSummaryStore;
import com.eainde.athlete.memory.InMemoryConversationSummaryStore;
import com.eainde.athlete.memory.JdbcConversationSummaryStore;
import com.eainde.athlete.prompt.PromptService;
import com.eainde.athlete.resilience.DependencyGuardRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Chooses the checkpoint and conversation-summary stores from {@code agent.checkpoint.store}
 * and {@code agent.memory.store}. The checkpoint store is handed to the graph engine through a
 * {@link CheckpointStoreSaver}. With {@code agent.checkpoint.store=none} runs are not
 * checkpointed and no retention job is scheduled.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    @ConditionalOnProperty(prefix = "agent.checkpoint", name = "store", havingValue = "memory", matchIfMissing = true)
    public CheckpointStore inMemoryCheckpointStore(Clock clock) {
        return new InMemoryCheckpointStore(clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.checkpoint", name = "store", havingValue = "jdbc")
    public CheckpointStore jdbcCheckpointStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        JdbcCheckpointStore store = new JdbcCheckpointStore(jdbcTemplate, objectMapper, clock);
        store.setup();
        return store;
    }

    @Bean
    @ConditionalOnExpression("'${agent.checkpoint.store:memory}' != 'none'")
    public BaseCheckpointSaver checkpointSaver(CheckpointStore store) {
        return new CheckpointStoreSaver(store);
    }

    @Bean
    @ConditionalOnExpression("'${agent.checkpoint.store:memory}' != 'none'")
    public CheckpointRetentionJob checkpointRetentionJob(CheckpointStore store, AgentProperties properties,
                                                         Clock clock) {
        return new CheckpointRetentionJob(store, properties, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.memory", name = "store", havingValue = "jdbc")
    public ConversationSummaryStore jdbcSummaryStore(JdbcTemplate jdbcTemplate, Clock clock) {
        JdbcConversationSummaryStore store = new JdbcConversationSummaryStore(jdbcTemplate, clock);
        store.setup();
        return store;
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.memory", name = "store", havingValue = "memory", matchIfMissing = true)
    public ConversationSummaryStore inMemorySummaryStore(Clock clock) {
        return new InMemoryConversationSummaryStore(clock);
    }

    @Bean
    public ConversationMemory conversationMemory(ConversationSummaryStore store,
                                                 DependencyGuardRegistry breakers,
                                                 LlmClient llmClient,
                                                 PromptService promptService,
                                                 @Qualifier("memoryExecutor") ExecutorService memoryExecutor,
                                                 AgentProperties properties) {
        return new ConversationMemory(store, breakers.get(DependencyGuardRegistry.SUMMARY), llmClient,
                promptService, memoryExecutor, properties.getMemory().getTtl());
    }
}
