package com.eainde.athlete.state;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum QueryIntent {
    FACTUAL("factual"),
    PROCEDURAL("procedural"),
    DEADLINE("deadline"),
    ESCALATION("escalation"),
    GENERAL("general");

    private final String value;

    QueryIntent(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Unknown or missing values map to {@link #GENERAL}. */
    public static QueryIntent fromValue(String value) {
        if (value == null) {
            return GENERAL;
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values()).filter(i -> i.value.equals(normalized)).findFirst().orElse(GENERAL);
    }
}
