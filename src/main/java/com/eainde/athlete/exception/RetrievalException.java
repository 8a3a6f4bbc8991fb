package com.eainde.athlete.exception;

public class RetrievalException extends AgentException {

    public RetrievalException(String message, Throwable cause) {
        super("RETRIEVAL_FAILED", message, cause);
    }
}
