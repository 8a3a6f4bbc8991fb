package com.eainde.athlete.resilience;

import com.eainde.athlete.exception.AgentException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Resilience4j circuit breaker and time limiter for one external dependency.
 * <p>
 * The breaker uses a count-based window as long as the failure threshold with a 100% failure
 * rate, so it opens after {@code failureThreshold} consecutive failures. After
 * {@code resetTimeout} it moves to half-open on its own and lets {@code successThreshold} trial
 * calls through; a failed trial reopens it straight away. Every call is raced against
 * {@code requestTimeout} on the given executor and a timeout is recorded as a failure.
 */
@Slf4j
public class DependencyGuard {

    private final String name;
    private final CircuitBreaker circuitBreaker;
    private final TimeLimiter timeLimiter;
    private final Duration requestTimeout;
    private final ExecutorService executor;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<Instant> lastFailureTime = new AtomicReference<>();
    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder totalFailures = new LongAdder();
    private final LongAdder totalTimeouts = new LongAdder();
    private final LongAdder totalRejections = new LongAdder();

    public DependencyGuard(CircuitBreaker circuitBreaker, TimeLimiter timeLimiter, ExecutorService executor) {
        this.name = circuitBreaker.getName();
        this.circuitBreaker = circuitBreaker;
        this.timeLimiter = timeLimiter;
        this.requestTimeout = timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
        this.executor = executor;

        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("[{}] circuit {} -> {}", name,
                        event.getStateTransition().getFromState(), event.getStateTransition().getToState()))
                .onSuccess(event -> consecutiveFailures.set(0))
                .onError(event -> {
                    consecutiveFailures.incrementAndGet();
                    totalFailures.increment();
                    lastFailureTime.set(event.getCreationTime().toInstant());
                })
                .onCallNotPermitted(event -> totalRejections.increment());
        timeLimiter.getEventPublisher().onTimeout(event -> totalTimeouts.increment());
    }

    public static DependencyGuard create(String name, int failureThreshold, Duration resetTimeout,
                                         Duration requestTimeout, int successThreshold, ExecutorService executor) {
        return new DependencyGuard(
                CircuitBreaker.of(name, breakerConfig(failureThreshold, resetTimeout, successThreshold, error -> true)),
                TimeLimiter.of(name, timeLimiterConfig(requestTimeout)),
                executor);
    }

    public static DependencyGuard withDefaults(String name, ExecutorService executor) {
        return create(name, 5, Duration.ofSeconds(30), Duration.ofSeconds(10), 2, executor);
    }

    static CircuitBreakerConfig breakerConfig(int failureThreshold, Duration resetTimeout, int successThreshold,
                                              Predicate<Throwable> recordFailure) {
        if (failureThreshold < 1 || successThreshold < 1) {
            throw new IllegalArgumentException("Breaker thresholds must be positive");
        }
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(resetTimeout)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .permittedNumberOfCallsInHalfOpenState(successThreshold)
                .recordException(recordFailure)
                .build();
    }

    static TimeLimiterConfig timeLimiterConfig(Duration requestTimeout) {
        return TimeLimiterConfig.custom()
                .timeoutDuration(requestTimeout)
                .cancelRunningFuture(true)
                .build();
    }

    /**
     * Executes the call through the breaker and the time limiter.
     *
     * @throws CircuitBreakerOpenException if the circuit is open, without invoking {@code call}
     * @throws RequestTimeoutException     if the call does not finish within {@code requestTimeout}
     */
    public <T> T execute(Callable<T> call) {
        totalRequests.increment();
        CircuitBreaker.State before = circuitBreaker.getState();
        Callable<T> timed = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> CompletableFuture.supplyAsync(() -> invoke(call), executor));
        Callable<T> guarded = CircuitBreaker.decorateCallable(circuitBreaker, timed);
        try {
            return guarded.call();
        } catch (CallNotPermittedException e) {
            throw new CircuitBreakerOpenException(name);
        } catch (TimeoutException e) {
            reopenAfterFailedTrial(before, e);
            throw new RequestTimeoutException(name, requestTimeout);
        } catch (RejectedExecutionException e) {
            reopenAfterFailedTrial(before, e);
            throw new AgentException("DEPENDENCY_FAILED", "Executor rejected call for '" + name + "'", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException("INTERRUPTED", "Interrupted while calling '" + name + "'", e);
        } catch (Exception e) {
            reopenAfterFailedTrial(before, e);
            throw propagate(e);
        }
    }

    /**
     * Executes the call and returns {@code fallback} on any failure, breaker-open included.
     * Meant for side effects that must never abort the primary flow.
     */
    public <T> T executeWithFallback(Callable<T> call, Supplier<T> fallback) {
        try {
            return execute(call);
        } catch (RuntimeException e) {
            log.warn("[{}] call failed, using fallback: {}", name, e.getMessage());
            return fallback.get();
        }
    }

    public CircuitBreaker.State getState() {
        return circuitBreaker.getState();
    }

    public DependencyGuardMetrics getMetrics() {
        CircuitBreaker.Metrics window = circuitBreaker.getMetrics();
        return new DependencyGuardMetrics(name, circuitBreaker.getState(), consecutiveFailures.get(),
                window.getFailureRate(), totalRequests.sum(), totalFailures.sum(), totalTimeouts.sum(),
                totalRejections.sum(), lastFailureTime.get());
    }

    public String getName() {
        return name;
    }

    /** Forces the circuit closed and clears the window. Lifetime totals are kept. */
    public void reset() {
        log.info("[{}] circuit manually reset", name);
        circuitBreaker.reset();
        consecutiveFailures.set(0);
    }

    /** Forces the circuit open as if the failure threshold had just been reached. */
    public void trip() {
        log.warn("[{}] circuit manually tripped", name);
        circuitBreaker.transitionToOpenState();
    }

    private void reopenAfterFailedTrial(CircuitBreaker.State before, Throwable error) {
        if (before == CircuitBreaker.State.HALF_OPEN
                && circuitBreaker.getCircuitBreakerConfig().getRecordExceptionPredicate().test(error)
                && circuitBreaker.getState() != CircuitBreaker.State.OPEN) {
            circuitBreaker.transitionToOpenState();
        }
    }

    private static <T> T invoke(Callable<T> call) {
        try {
            return call.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new AgentException("DEPENDENCY_FAILED", cause.getMessage(), cause);
    }
}
