package com.eainde.athlete.resilience;

import com.eainde.athlete.exception.AgentException;

import java.time.Duration;

public class RequestTimeoutException extends AgentException {

    public RequestTimeoutException(String breakerName, Duration timeout) {
        super("REQUEST_TIMEOUT", "Call through '" + breakerName + "' timed out after " + timeout.toMillis() + "ms");
    }
}
