package com.eainde.athlete.retrieval;

import com.eainde.athlete.state.DocumentMetadata;
import com.eainde.athlete.state.RetrievedDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RrfFusionTest {

    private final RrfFusion fusion = new RrfFusion(60, 0.5);

    private static VectorMatch vector(String id, double distance) {
        return new VectorMatch(id, "content " + id, DocumentMetadata.empty(), distance);
    }

    private static LexicalMatch lexical(String id) {
        return new LexicalMatch(id, "content " + id, DocumentMetadata.empty(), 1.0);
    }

    @Test
    @DisplayName("a document found by both searches outranks single-list hits")
    void bothListsWin() {
        List<RetrievedDocument> fused = fusion.fuse(
                List.of(vector("a", 0.1), vector("b", 0.2)),
                List.of(lexical("c"), lexical("b")),
                10);

        assertThat(fused).extracting(RetrievedDocument::id).containsExactly("b", "a", "c");
        assertThat(fused.get(0).score()).isCloseTo(0.5 / 62 + 0.5 / 62, within(1e-12));
    }

    @Test
    @DisplayName("equal scores keep first-seen order, vector list first")
    void tiesKeepFirstSeenOrder() {
        List<RetrievedDocument> fused = fusion.fuse(List.of(vector("v", 0.3)), List.of(lexical("l")), 10);

        assertThat(fused).extracting(RetrievedDocument::id).containsExactly("v", "l");
    }

    @Test
    @DisplayName("keeps the vector distance and leaves it null for lexical-only hits")
    void distances() {
        List<RetrievedDocument> fused = fusion.fuse(List.of(vector("v", 0.25)), List.of(lexical("l")), 10);

        assertThat(fused.get(0).distance()).isEqualTo(0.25);
        assertThat(fused.get(1).distance()).isNull();
    }

    @Test
    @DisplayName("returns at most k documents")
    void limitsToK() {
        List<RetrievedDocument> fused = fusion.fuse(
                List.of(vector("a", 0.1), vector("b", 0.2), vector("c", 0.3)), List.of(), 2);

        assertThat(fused).hasSize(2);
    }

    @Test
    @DisplayName("weight 1.0 ignores lexical ranks")
    void vectorOnlyWeight() {
        RrfFusion vectorOnly = new RrfFusion(60, 1.0);

        List<RetrievedDocument> fused = vectorOnly.fuse(List.of(vector("a", 0.1)), List.of(lexical("b")), 10);

        assertThat(fused.get(1).score()).isZero();
    }

    @Test
    @DisplayName("disjoint lists of sizes m and n fuse into m + n documents")
    void disjointListsKeepEveryDocument() {
        List<RetrievedDocument> fused = fusion.fuse(
                List.of(vector("v1", 0.1), vector("v2", 0.2), vector("v3", 0.3)),
                List.of(lexical("l1"), lexical("l2")),
                5);

        assertThat(fused).hasSize(5).doesNotHaveDuplicates();
        assertThat(fused).extracting(RetrievedDocument::id)
                .containsExactlyInAnyOrder("v1", "v2", "v3", "l1", "l2");
    }

    @Test
    @DisplayName("a document ranked differently by each search sums both weighted reciprocal ranks")
    void exactScoreAcrossDifferentRanks() {
        List<RetrievedDocument> fused = fusion.fuse(
                List.of(vector("a", 0.1), vector("b", 0.2), vector("shared", 0.3)),
                List.of(lexical("shared"), lexical("c")),
                10);

        RetrievedDocument shared = fused.stream().filter(d -> d.id().equals("shared")).findFirst().orElseThrow();
        assertThat(shared.score()).isCloseTo(0.5 / (60 + 3) + 0.5 / (60 + 1), within(1e-12));
        assertThat(fused.get(0)).isSameAs(shared);
    }

    @Test
    @DisplayName("chunks with identical content under different ids fuse into one document")
    void identicalContentFusesAcrossIds() {
        List<RetrievedDocument> fused = fusion.fuse(
                List.of(new VectorMatch("c1", "same clause", DocumentMetadata.empty(), 0.3),
                        new VectorMatch("c2", "same clause", DocumentMetadata.empty(), 0.2)),
                List.of(new LexicalMatch("c2", "same clause", DocumentMetadata.empty(), 1.0)),
                10);

        assertThat(fused).singleElement().satisfies(document -> {
            assertThat(document.id()).isEqualTo("c1");
            assertThat(document.distance()).isEqualTo(0.2);
            assertThat(document.score()).isCloseTo(0.5 / 61 + 0.5 / 61, within(1e-12));
        });
        assertThat(fused).extracting(RetrievedDocument::content).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("rejects weights outside [0,1]")
    void rejectsBadWeight() {
        assertThatThrownBy(() -> new RrfFusion(60, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
