package com.eainde.athlete.exception;

/**
 * Base unchecked exception for every failure the agent surfaces to callers.
 * <p>
 * The {@code code} is stable and is what streaming clients receive in an {@code error} event,
 * so callers can branch on it without parsing messages.
 */
public class AgentException extends RuntimeException {

    private final String code;

    public AgentException(String code, String message) {
        super(message);
        this.code = code;
    }

    public AgentException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
