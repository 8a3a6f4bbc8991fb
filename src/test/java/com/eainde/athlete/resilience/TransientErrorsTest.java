package com.eainde.athlete.resilience;

import com.eainde.athlete.research.WebSearchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class TransientErrorsTest {

    @ParameterizedTest
    @ValueSource(ints = {408, 429, 500, 502, 503, 504, 529})
    @DisplayName("retryable HTTP statuses are transient")
    void retryableStatuses(int status) {
        assertThat(TransientErrors.isTransient(new WebSearchException(status, "status " + status))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 403, 404, 422})
    @DisplayName("client errors are not transient")
    void clientErrors(int status) {
        assertThat(TransientErrors.isTransient(new WebSearchException(status, "status " + status))).isFalse();
    }

    @Test
    @DisplayName("I/O errors and timeouts are transient, also when wrapped")
    void ioAndTimeouts() {
        assertThat(TransientErrors.isTransient(new IOException("socket closed"))).isTrue();
        assertThat(TransientErrors.isTransient(new TimeoutException())).isTrue();
        assertThat(TransientErrors.isTransient(new RequestTimeoutException("llm", Duration.ofSeconds(1)))).isTrue();
        assertThat(TransientErrors.isTransient(new RuntimeException(new IOException("reset")))).isTrue();
    }

    @Test
    @DisplayName("status codes and throttling wording in messages are recognised")
    void messageHeuristics() {
        assertThat(TransientErrors.isTransient(new RuntimeException("HTTP 503 Service Unavailable"))).isTrue();
        assertThat(TransientErrors.isTransient(new RuntimeException("Rate limit exceeded"))).isTrue();
        assertThat(TransientErrors.isTransient(new RuntimeException("model overloaded"))).isTrue();
        assertThat(TransientErrors.isTransient(new IllegalArgumentException("bad prompt"))).isFalse();
    }

    @Test
    @DisplayName("an open circuit is never retried")
    void openCircuitNotTransient() {
        assertThat(TransientErrors.isTransient(new CircuitBreakerOpenException("llm"))).isFalse();
    }
}
