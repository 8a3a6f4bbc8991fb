package com.eainde.athlete.retrieval;

import com.eainde.athlete.state.RetrievedDocument;

import java.util.List;
import java.util.Objects;

/**
 * Retrieval confidence from raw cosine distances of the closest matches.
 * <p>
 * Each distance {@code d} maps to {@code clamp(1 - d, 0, 1)}; the result blends the best match
 * (60%) with the mean of the {@code topN} closest (40%). Chunks without a vector distance
 * (lexical-only hits) do not contribute. No distances means zero confidence.
 */
public final class ConfidenceScorer {

    static final double BEST_WEIGHT = 0.6;
    static final double AVERAGE_WEIGHT = 0.4;

    private ConfidenceScorer() {
    }

    public static double score(List<RetrievedDocument> documents, int topN) {
        List<Double> distances = documents.stream()
                .map(RetrievedDocument::distance)
                .filter(Objects::nonNull)
                .toList();
        return fromDistances(distances, topN);
    }

    public static double fromDistances(List<Double> distances, int topN) {
        List<Double> closest = distances.stream().sorted().limit(Math.max(1, topN)).toList();
        if (closest.isEmpty()) {
            return 0.0;
        }
        double best = similarity(closest.get(0));
        double average = closest.stream().mapToDouble(ConfidenceScorer::similarity).average().orElse(0.0);
        return clamp(BEST_WEIGHT * best + AVERAGE_WEIGHT * average);
    }

    private static double similarity(double distance) {
        return clamp(1.0 - distance);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
