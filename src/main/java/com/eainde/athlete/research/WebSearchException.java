package com.eainde.athlete.research;

import com.eainde.athlete.exception.AgentException;
import com.eainde.athlete.resilience.HttpStatusAware;

public class WebSearchException extends AgentException implements HttpStatusAware {

    private final int statusCode;

    public WebSearchException(int statusCode, String message) {
        super("WEB_SEARCH_FAILED", message);
        this.statusCode = statusCode;
    }

    public WebSearchException(String message, Throwable cause) {
        super("WEB_SEARCH_FAILED", message, cause);
        this.statusCode = -1;
    }

    @Override
    public int getStatusCode() {
        return statusCode;
    }
}
