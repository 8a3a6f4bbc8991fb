package com.eainde.athlete.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;

/**
 * Cosine-distance search with pgvector. The query is embedded with the configured LangChain4j
 * {@link EmbeddingModel}; {@code <=>} returns the raw distance used for confidence scoring.
 */
public class PgVectorSearch implements VectorSearch {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final EmbeddingModel embeddingModel;
    private final ObjectMapper objectMapper;

    public PgVectorSearch(NamedParameterJdbcTemplate jdbcTemplate, EmbeddingModel embeddingModel,
                          ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.embeddingModel = embeddingModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<VectorMatch> similaritySearch(String query, int k, SearchFilter filter) {
        Embedding embedding = embeddingModel.embed(query).content();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("embedding", toVectorLiteral(embedding.vector()))
                .addValue("k", k);
        String sql = """
                SELECT id, content, metadata::text AS metadata,
                       embedding <=> CAST(:embedding AS vector) AS distance
                FROM document_chunks
                WHERE embedding IS NOT NULL""" + ChunkSql.filterConditions(filter, params) + """

                ORDER BY distance
                LIMIT :k
                """;
        return jdbcTemplate.query(sql, params, (rs, rowNum) -> new VectorMatch(
                rs.getString("id"),
                rs.getString("content"),
                ChunkSql.metadata(rs.getString("metadata"), objectMapper),
                rs.getDouble("distance")));
    }

    static String toVectorLiteral(float[] vector) {
        StringBuilder literal = new StringBuilder("[");
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                literal.append(',');
            }
            literal.append(vector[i]);
        }
        return literal.append(']').toString();
    }
}
