package com.eainde.athlete.state;

import java.io.Serializable;

public record QualityIssue(String type, String severity, String description) implements Serializable {

    public boolean isCritical() {
        return "critical".equalsIgnoreCase(severity);
    }
}
