package com.eainde.athlete.resilience;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries transient failures with exponential backoff and jitter.
 * Runs inside a {@link DependencyGuard} call, so a retried sequence counts as one breaker request.
 */
@Slf4j
public class RetryExecutor {

    private final Retry retry;

    public RetryExecutor(String name, int maxAttempts, Duration initialInterval,
                         double multiplier, double randomization) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        initialInterval, multiplier, randomization))
                .retryOnException(TransientErrors::isTransient)
                .build();
        this.retry = Retry.of(name, config);
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "[{}] transient failure, retry #{}: {}",
                name,
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    public <T> T execute(Supplier<T> supplier) {
        return retry.executeSupplier(supplier);
    }
}
