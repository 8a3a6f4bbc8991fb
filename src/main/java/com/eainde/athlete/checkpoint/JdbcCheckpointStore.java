package com.eainde.athlete.checkpoint;

import com.eainde.athlete.exception.AgentException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores checkpoints in the {@code graph_checkpoints} table with the state as a JSON document.
 * <p>
 * State is written with the application's {@link ObjectMapper}; reading it back yields plain
 * JSON values (maps, lists, strings, numbers), not the typed records the run used.
 */
@Slf4j
public class JdbcCheckpointStore implements CheckpointStore {

    private static final TypeReference<Map<String, Object>> STATE_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcCheckpointStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void setup() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS graph_checkpoints (
                    thread_id     VARCHAR(128) NOT NULL,
                    step          INTEGER      NOT NULL,
                    checkpoint_id VARCHAR(64)  NOT NULL,
                    node          VARCHAR(64)  NOT NULL,
                    next_node     VARCHAR(64),
                    state         JSONB        NOT NULL,
                    created_at    TIMESTAMP    NOT NULL,
                    PRIMARY KEY (thread_id, step)
                )
                """);
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_graph_checkpoints_created ON graph_checkpoints (created_at)");
        log.info("graph_checkpoints table ready");
    }

    @Override
    public void save(String threadId, int step, String checkpointId, String node, String nextNode,
                     Map<String, Object> state) {
        String json;
        try {
            json = objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new AgentException("CHECKPOINT_FAILED", "Failed to serialize checkpoint state", e);
        }
        jdbcTemplate.update("""
                INSERT INTO graph_checkpoints (thread_id, step, checkpoint_id, node, next_node, state, created_at)
                VALUES (?, ?, ?, ?, ?, CAST(? AS jsonb), ?)
                ON CONFLICT (thread_id, step)
                DO UPDATE SET checkpoint_id = EXCLUDED.checkpoint_id, node = EXCLUDED.node,
                              next_node = EXCLUDED.next_node, state = EXCLUDED.state,
                              created_at = EXCLUDED.created_at
                """, threadId, step, checkpointId, node, nextNode, json, Timestamp.from(clock.instant()));
    }

    @Override
    public Optional<Checkpoint> latest(String threadId) {
        List<Checkpoint> rows = jdbcTemplate.query("""
                SELECT thread_id, step, checkpoint_id, node, next_node, state, created_at FROM graph_checkpoints
                WHERE thread_id = ? ORDER BY step DESC LIMIT 1
                """, rowMapper(), threadId);
        return rows.stream().findFirst();
    }

    @Override
    public List<Checkpoint> list(String threadId) {
        return jdbcTemplate.query("""
                SELECT thread_id, step, checkpoint_id, node, next_node, state, created_at FROM graph_checkpoints
                WHERE thread_id = ? ORDER BY step
                """, rowMapper(), threadId);
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM graph_checkpoints WHERE created_at < ?", Timestamp.from(cutoff));
    }

    private RowMapper<Checkpoint> rowMapper() {
        return (rs, rowNum) -> {
            Map<String, Object> state;
            try {
                state = objectMapper.readValue(rs.getString("state"), STATE_TYPE);
            } catch (JsonProcessingException e) {
                throw new AgentException("CHECKPOINT_FAILED", "Failed to deserialize checkpoint state", e);
            }
            return new Checkpoint(rs.getString("thread_id"), rs.getInt("step"), rs.getString("checkpoint_id"),
                    rs.getString("node"), rs.getString("next_node"), state,
                    rs.getTimestamp("created_at").toInstant());
        };
    }
}
