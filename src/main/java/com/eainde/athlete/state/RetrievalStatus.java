package com.eainde.athlete.state;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RetrievalStatus {
    SUCCESS("success"),
    ERROR("error");

    private final String value;

    RetrievalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
