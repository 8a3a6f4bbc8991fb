package com.eainde.athlete.resilience;

import com.eainde.athlete.config.AgentProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Holds one {@link DependencyGuard} per external dependency, created lazily from
 * {@code agent.breakers.<name>} settings. The underlying breakers and time limiters live in the
 * Resilience4j registries, so they can be looked up by name elsewhere.
 */
public class DependencyGuardRegistry {

    public static final String LLM = "llm";
    public static final String VECTOR = "vector";
    public static final String LEXICAL = "lexical";
    public static final String WEB = "web";
    public static final String SUMMARY = "summary";

    private final AgentProperties properties;
    private final ExecutorService executor;
    private final CircuitBreakerRegistry circuitBreakers = CircuitBreakerRegistry.ofDefaults();
    private final TimeLimiterRegistry timeLimiters = TimeLimiterRegistry.ofDefaults();
    private final Map<String, DependencyGuard> guards = new ConcurrentHashMap<>();

    public DependencyGuardRegistry(AgentProperties properties, ExecutorService executor) {
        this.properties = properties;
        this.executor = executor;
    }

    public DependencyGuard get(String name) {
        return guards.computeIfAbsent(name, this::create);
    }

    public Collection<DependencyGuardMetrics> metrics() {
        return guards.values().stream().map(DependencyGuard::getMetrics).toList();
    }

    public List<String> names() {
        return List.copyOf(guards.keySet());
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    private DependencyGuard create(String name) {
        AgentProperties.Breaker settings = properties.breaker(name);
        return new DependencyGuard(
                circuitBreakers.circuitBreaker(name, DependencyGuard.breakerConfig(
                        settings.getFailureThreshold(), settings.getResetTimeout(),
                        settings.getSuccessThreshold(), error -> true)),
                timeLimiters.timeLimiter(name, DependencyGuard.timeLimiterConfig(settings.getRequestTimeout())),
                executor);
    }
}
