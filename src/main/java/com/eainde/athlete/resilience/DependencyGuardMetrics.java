package com.eainde.athlete.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

import java.time.Instant;

/**
 * Point-in-time view of a guard. {@code failureRate} is the breaker's sliding-window rate
 * ({@code -1} until the window has enough calls); the totals count since startup.
 * {@code lastFailureTime} is null until the first failure.
 */
public record DependencyGuardMetrics(
        String name,
        CircuitBreaker.State state,
        int consecutiveFailures,
        float failureRate,
        long totalRequests,
        long totalFailures,
        long totalTimeouts,
        long totalRejections,
        Instant lastFailureTime) {
}
