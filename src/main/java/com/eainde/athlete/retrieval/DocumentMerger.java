package com.eainde.athlete.retrieval;

import com.eainde.athlete.state.RetrievedDocument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges result lists from concurrent searches. Documents with the exact same content collapse
 * into one, keeping the better-scored copy, and the output is sorted by score then content so
 * the order in which the searches finished never changes the result.
 * <p>
 * Scores from separate searches are only compared inside {@link #merge}; {@link #extend} adds
 * follow-up results to an accepted set without replacing anything already in it.
 */
public final class DocumentMerger {

    private static final Comparator<RetrievedDocument> RANKING = Comparator
            .comparingDouble(RetrievedDocument::score).reversed()
            .thenComparing(RetrievedDocument::content, Comparator.nullsLast(Comparator.naturalOrder()));

    private DocumentMerger() {
    }

    public static List<RetrievedDocument> merge(Collection<List<RetrievedDocument>> lists, int limit) {
        Map<String, RetrievedDocument> byContent = new HashMap<>();
        for (List<RetrievedDocument> list : lists) {
            for (RetrievedDocument document : list) {
                byContent.merge(document.content(), document, DocumentMerger::better);
            }
        }
        List<RetrievedDocument> merged = new ArrayList<>(byContent.values());
        merged.sort(RANKING);
        return merged.size() > limit ? List.copyOf(merged.subList(0, limit)) : merged;
    }

    /**
     * Adds the documents from {@code additions} whose content is not already in {@code existing}.
     * Existing documents are kept as they are, so their distances never change.
     */
    public static List<RetrievedDocument> extend(List<RetrievedDocument> existing,
                                                 Collection<List<RetrievedDocument>> additions) {
        Set<String> known = new HashSet<>();
        List<RetrievedDocument> extended = new ArrayList<>(existing);
        existing.forEach(document -> known.add(document.content()));
        for (RetrievedDocument candidate : merge(additions, Integer.MAX_VALUE)) {
            if (known.add(candidate.content())) {
                extended.add(candidate);
            }
        }
        extended.sort(RANKING);
        return extended;
    }

    private static RetrievedDocument better(RetrievedDocument a, RetrievedDocument b) {
        if (a.score() != b.score()) {
            return a.score() > b.score() ? a : b;
        }
        double distanceA = a.distance() == null ? Double.MAX_VALUE : a.distance();
        double distanceB = b.distance() == null ? Double.MAX_VALUE : b.distance();
        return distanceA <= distanceB ? a : b;
    }
}
