package com.eainde.athlete.exception;

public class LlmException extends AgentException {

    public LlmException(String message, Throwable cause) {
        super("LLM_FAILED", message, cause);
    }
}
