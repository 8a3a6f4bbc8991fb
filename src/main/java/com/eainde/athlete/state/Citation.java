package com.eainde.athlete.state;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

public record Citation(
        String title,
        String url,
        String section,
        String snippet,
        String effectiveDate,
        String authorityLevel,
        Source source) implements Serializable {

    public enum Source {
        DOCUMENT("document"),
        WEB("web");

        private final String value;

        Source(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }
}
