package com.eainde.athlete.retrieval;

import com.eainde.athlete.state.DocumentMetadata;
import com.eainde.athlete.state.RetrievedDocument;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weighted reciprocal rank fusion of a vector list and a lexical list.
 * <p>
 * {@code score(doc) = w / (rrfK + vectorRank) + (1 - w) / (rrfK + lexicalRank)} with 1-based ranks;
 * a list that does not contain the document contributes nothing. Documents are identified by
 * content, so chunks stored twice under different ids fuse into one and only the best rank of
 * each list counts. Results are sorted by score, descending; ties keep first-seen order (vector
 * list first, then lexical).
 */
public class RrfFusion {

    private final int rrfK;
    private final double vectorWeight;

    public RrfFusion(int rrfK, double vectorWeight) {
        if (vectorWeight < 0 || vectorWeight > 1) {
            throw new IllegalArgumentException("vectorWeight must be within [0,1]: " + vectorWeight);
        }
        this.rrfK = rrfK;
        this.vectorWeight = vectorWeight;
    }

    public List<RetrievedDocument> fuse(List<VectorMatch> vector, List<LexicalMatch> lexical, int k) {
        Map<String, Candidate> candidates = new LinkedHashMap<>();

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < vector.size(); i++) {
            VectorMatch match = vector.get(i);
            String key = key(match.id(), match.content());
            Candidate candidate = candidates.computeIfAbsent(key,
                    ignored -> new Candidate(match.id(), match.content(), match.metadata()));
            if (seen.add(key)) {
                candidate.score += vectorWeight / (rrfK + i + 1);
            }
            if (candidate.distance == null || match.distance() < candidate.distance) {
                candidate.distance = match.distance();
            }
        }
        seen.clear();
        for (int i = 0; i < lexical.size(); i++) {
            LexicalMatch match = lexical.get(i);
            String key = key(match.id(), match.content());
            Candidate candidate = candidates.computeIfAbsent(key,
                    ignored -> new Candidate(match.id(), match.content(), match.metadata()));
            if (seen.add(key)) {
                candidate.score += (1 - vectorWeight) / (rrfK + i + 1);
            }
        }

        // List.sort is stable, so equal scores stay in first-seen order
        List<Candidate> ranked = new ArrayList<>(candidates.values());
        ranked.sort(Comparator.comparingDouble((Candidate c) -> c.score).reversed());

        return ranked.stream()
                .limit(k)
                .map(c -> new RetrievedDocument(c.id, c.content, c.metadata, c.score, c.distance))
                .toList();
    }

    private static String key(String id, String content) {
        return content != null ? content : "id:" + id;
    }

    private static final class Candidate {
        private final String id;
        private final String content;
        private final DocumentMetadata metadata;
        private double score;
        private Double distance;

        private Candidate(String id, String content, DocumentMetadata metadata) {
            this.id = id;
            this.content = content;
            this.metadata = metadata;
        }
    }
}
