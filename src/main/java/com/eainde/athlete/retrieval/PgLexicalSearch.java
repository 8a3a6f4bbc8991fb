package com.eainde.athlete.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;

/**
 * Postgres full-text search ranked with {@code ts_rank_cd}.
 */
public class PgLexicalSearch implements LexicalSearch {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public PgLexicalSearch(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<LexicalMatch> search(String query, int k, SearchFilter filter) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("query", query)
                .addValue("k", k);
        String sql = """
                SELECT id, content, metadata::text AS metadata,
                       ts_rank_cd(to_tsvector('english', content), plainto_tsquery('english', :query)) AS score
                FROM document_chunks
                WHERE to_tsvector('english', content) @@ plainto_tsquery('english', :query)"""
                + ChunkSql.filterConditions(filter, params) + """

                ORDER BY score DESC
                LIMIT :k
                """;
        return jdbcTemplate.query(sql, params, (rs, rowNum) -> new LexicalMatch(
                rs.getString("id"),
                rs.getString("content"),
                ChunkSql.metadata(rs.getString("metadata"), objectMapper),
                rs.getDouble("score")));
    }
}
