package com.eainde.athlete.nodes;

import com.eainde.athlete.state.Citation;
import com.eainde.athlete.state.DocumentMetadata;
import com.eainde.athlete.state.RetrievedDocument;
import com.eainde.athlete.state.RunState;
import com.eainde.athlete.state.WebSearchResult;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Builds citations from the evidence present in state: retrieved documents first, one per
 * distinct source section, then web results.
 */
@Slf4j
@Component
public class CitationBuilderNode implements AsyncNodeAction<RunState> {

    static final int SNIPPET_LENGTH = 200;

    @Override
    public CompletableFuture<Map<String, Object>> apply(RunState state) {
        List<Citation> citations = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (RetrievedDocument document : state.getRetrievedDocuments()) {
            DocumentMetadata metadata = Optional.ofNullable(document.metadata()).orElse(DocumentMetadata.empty());
            String key = Objects.toString(metadata.sourceUrl(), "") + "|"
                    + Objects.toString(metadata.sectionTitle(), "") + "|"
                    + Objects.toString(metadata.documentTitle(), "");
            if (!seen.add(key)) {
                continue;
            }
            citations.add(new Citation(
                    Optional.ofNullable(metadata.documentTitle()).orElse("Unknown Document"),
                    metadata.sourceUrl(),
                    metadata.sectionTitle(),
                    snippet(document.content()),
                    metadata.effectiveDate(),
                    metadata.authorityLevel(),
                    Citation.Source.DOCUMENT));
        }

        for (WebSearchResult result : state.getWebSearchResultUrls()) {
            if (result.url() == null || !seen.add(result.url())) {
                continue;
            }
            citations.add(new Citation(
                    Optional.ofNullable(result.title()).filter(t -> !t.isBlank()).orElse(result.url()),
                    result.url(),
                    null,
                    snippet(result.content()),
                    null,
                    null,
                    Citation.Source.WEB));
        }

        log.info("Built {} citations", citations.size());
        return CompletableFuture.completedFuture(Map.of(RunState.CITATIONS, List.copyOf(citations)));
    }

    static String snippet(String content) {
        if (content == null) {
            return "";
        }
        return content.length() > SNIPPET_LENGTH ? content.substring(0, SNIPPET_LENGTH) + "..." : content;
    }
}
