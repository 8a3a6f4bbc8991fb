package com.eainde.athlete.resilience;

/**
 * Implemented by client exceptions that know the HTTP status of the failed call.
 */
public interface HttpStatusAware {

    int getStatusCode();
}
