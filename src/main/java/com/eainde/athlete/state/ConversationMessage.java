package com.eainde.athlete.state;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

/**
 * One turn of the conversation as supplied by the caller.
 */
public record ConversationMessage(Role role, String content) implements Serializable {

    public enum Role {
        USER("user"),
        ASSISTANT("assistant");

        private final String value;

        Role(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(Role.USER, content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(Role.ASSISTANT, content);
    }
}
