package com.eainde.athlete.retrieval;

import com.eainde.athlete.state.DocumentMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.ArrayList;
import java.util.List;

/**
 * SQL fragments and metadata decoding shared by the Postgres search adapters over the
 * {@code document_chunks} table.
 */
@Slf4j
final class ChunkSql {

    private ChunkSql() {
    }

    /** Appends the filter conditions to {@code params} and returns them as a WHERE suffix. */
    static String filterConditions(SearchFilter filter, MapSqlParameterSource params) {
        List<String> conditions = new ArrayList<>();
        if (!filter.organizationIds().isEmpty()) {
            params.addValue("orgIds", filter.organizationIds());
            conditions.add(filter.includeUniversal()
                    ? "(ngb_id IN (:orgIds) OR ngb_id IS NULL)"
                    : "ngb_id IN (:orgIds)");
        }
        if (filter.domain() != null) {
            params.addValue("domain", filter.domain().value());
            conditions.add("topic_domain = :domain");
        }
        return conditions.isEmpty() ? "" : " AND " + String.join(" AND ", conditions);
    }

    static DocumentMetadata metadata(String json, ObjectMapper objectMapper) {
        if (json == null || json.isBlank()) {
            return DocumentMetadata.empty();
        }
        try {
            return objectMapper.readValue(json, DocumentMetadata.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable chunk metadata, ignoring: {}", e.getOriginalMessage());
            return DocumentMetadata.empty();
        }
    }
}
