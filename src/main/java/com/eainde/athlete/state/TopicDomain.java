package com.eainde.athlete.state;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Governance topic areas the classifier can assign. Safety-critical domains always escalate with
 * immediate urgency.
 */
public enum TopicDomain {
    TEAM_SELECTION("team_selection", "team selection", false),
    DISPUTE_RESOLUTION("dispute_resolution", "dispute resolution", false),
    SAFESPORT("safesport", "SafeSport abuse and misconduct", true),
    ANTI_DOPING("anti_doping", "anti-doping", true),
    ELIGIBILITY("eligibility", "eligibility", false),
    GOVERNANCE("governance", "governance", false),
    ATHLETE_RIGHTS("athlete_rights", "athlete rights", false),
    ATHLETE_SAFETY("athlete_safety", "athlete safety", true),
    FINANCIAL_ASSISTANCE("financial_assistance", "financial assistance", false);

    private final String value;
    private final String label;
    private final boolean safetyCritical;

    TopicDomain(String value, String label, boolean safetyCritical) {
        this.value = value;
        this.label = label;
        this.safetyCritical = safetyCritical;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String label() {
        return label;
    }

    public boolean isSafetyCritical() {
        return safetyCritical;
    }

    public static Optional<TopicDomain> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values()).filter(d -> d.value.equals(normalized)).findFirst();
    }
}
