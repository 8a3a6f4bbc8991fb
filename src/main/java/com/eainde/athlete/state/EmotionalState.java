package com.eainde.athlete.state;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum EmotionalState {
    NEUTRAL("neutral"),
    DISTRESSED("distressed"),
    PANICKED("panicked"),
    FEARFUL("fearful");

    private final String value;

    EmotionalState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static EmotionalState fromValue(String value) {
        if (value == null) {
            return NEUTRAL;
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values()).filter(e -> e.value.equals(normalized)).findFirst().orElse(NEUTRAL);
    }
}
