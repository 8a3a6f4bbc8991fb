package com.eainde.athlete.resilience;

import com.eainde.athlete.exception.AgentException;

/**
 * Raised without touching the wrapped dependency while the breaker is open
 * (or once the half-open trial calls are used up).
 */
public class CircuitBreakerOpenException extends AgentException {

    private final String breakerName;

    public CircuitBreakerOpenException(String breakerName) {
        super("CIRCUIT_OPEN", "Circuit breaker '" + breakerName + "' is open");
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
