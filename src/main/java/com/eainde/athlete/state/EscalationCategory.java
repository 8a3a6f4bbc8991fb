package com.eainde.athlete.state;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Why a question escalates. Kept separate from urgency: only {@link #IMMINENT_DANGER} allows
 * the referral to point at emergency services.
 */
public enum EscalationCategory {
    IMMINENT_DANGER("imminent_danger"),
    NON_IMMINENT_MISCONDUCT("non_imminent_misconduct"),
    PROCEDURAL_DEADLINE("procedural_deadline");

    private final String value;

    EscalationCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<EscalationCategory> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values()).filter(c -> c.value.equals(normalized)).findFirst();
    }
}
