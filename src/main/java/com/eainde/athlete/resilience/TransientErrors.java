package com.eainde.athlete.resilience;

import java.io.IOException;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether an error from an external dependency is worth retrying.
 * Network failures, timeouts, throttling and server-side errors are; everything else is not.
 */
public final class TransientErrors {

    private static final Set<Integer> TRANSIENT_STATUS = Set.of(408, 429, 500, 502, 503, 504, 529);
    private static final Pattern STATUS_IN_MESSAGE = Pattern.compile("\\b(408|429|500|502|503|504|529)\\b");
    private static final Pattern TRANSIENT_WORDING = Pattern.compile(
            "(?i)rate.?limit|overloaded|temporarily unavailable|connection reset|timed? ?out");

    private TransientErrors() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 8) {
            if (current instanceof CircuitBreakerOpenException) {
                return false;
            }
            if (current instanceof HttpStatusAware statusAware && statusAware.getStatusCode() > 0) {
                return TRANSIENT_STATUS.contains(statusAware.getStatusCode());
            }
            if (current instanceof IOException
                    || current instanceof java.util.concurrent.TimeoutException
                    || current instanceof RequestTimeoutException) {
                return true;
            }
            if (current.getMessage() != null && messageLooksTransient(current.getMessage())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean messageLooksTransient(String message) {
        Matcher status = STATUS_IN_MESSAGE.matcher(message);
        return status.find() || TRANSIENT_WORDING.matcher(message).find();
    }
}
