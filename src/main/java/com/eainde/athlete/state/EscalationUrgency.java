package com.eainde.athlete.state;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EscalationUrgency {
    IMMEDIATE("immediate"),
    STANDARD("standard");

    private final String value;

    EscalationUrgency(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
