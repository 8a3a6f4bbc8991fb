package com.eainde.athlete.config;

import com.eainde.athlete.resilience.DependencyGuard;
import com.eainde.athlete.resilience.DependencyGuardRegistry;
import com.eainde.athlete.resilience.RetryExecutor;
import com.eainde.athlete.thread.MdcAwareExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

/**
 * Worker pools, Resilience4j-backed dependency guards and the retry policy. Every pool propagates
 * the caller's MDC.
 */
@Configuration
public class ResilienceConfig {

    @Bean("breakerExecutor")
    public ExecutorService breakerExecutor() {
        return new MdcAwareExecutor("breaker");
    }

    @Bean("searchExecutor")
    public ExecutorService searchExecutor() {
        return new MdcAwareExecutor("search");
    }

    @Bean("graphExecutor")
    public ExecutorService graphExecutor() {
        return new MdcAwareExecutor("graph");
    }

    @Bean("sseExecutor")
    public ExecutorService sseExecutor() {
        return new MdcAwareExecutor("sse");
    }

    @Bean("memoryExecutor")
    public ExecutorService memoryExecutor() {
        return new MdcAwareExecutor("memory");
    }

    @Bean
    public DependencyGuardRegistry dependencyGuardRegistry(AgentProperties properties,
                                                           @Qualifier("breakerExecutor") ExecutorService executor) {
        return new DependencyGuardRegistry(properties, executor);
    }

    @Bean("llmBreaker")
    public DependencyGuard llmBreaker(DependencyGuardRegistry registry) {
        return registry.get(DependencyGuardRegistry.LLM);
    }

    @Bean
    public RetryExecutor llmRetry(AgentProperties properties) {
        AgentProperties.Retry retry = properties.getRetry();
        return new RetryExecutor("llm", retry.getMaxAttempts(), retry.getInitialInterval(),
                retry.getMultiplier(), retry.getRandomization());
    }
}
