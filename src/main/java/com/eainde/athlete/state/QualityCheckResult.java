package com.eainde.athlete.state;

import java.io.Serializable;
import java.util.List;

public record QualityCheckResult(boolean passed, double score, List<QualityIssue> issues, String critique)
        implements Serializable {

    public static QualityCheckResult pass(String critique) {
        return new QualityCheckResult(true, 1.0, List.of(), critique);
    }
}
