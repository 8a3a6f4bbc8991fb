package com.eainde.athlete.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Summaries in the {@code conversation_summaries} table. Expired rows are ignored on read and
 * overwritten on the next write.
 */
@Slf4j
public class JdbcConversationSummaryStore implements ConversationSummaryStore {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcConversationSummaryStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    public void setup() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS conversation_summaries (
                    conversation_id VARCHAR(128) PRIMARY KEY,
                    summary         TEXT         NOT NULL,
                    expires_at      TIMESTAMP    NOT NULL,
                    updated_at      TIMESTAMP    NOT NULL
                )
                """);
        log.info("conversation_summaries table ready");
    }

    @Override
    public Optional<String> get(String conversationId) {
        List<String> rows = jdbcTemplate.queryForList(
                "SELECT summary FROM conversation_summaries WHERE conversation_id = ? AND expires_at > ?",
                String.class, conversationId, Timestamp.from(clock.instant()));
        return rows.stream().findFirst();
    }

    @Override
    public void upsert(String conversationId, String summary, Duration ttl) {
        Instant now = clock.instant();
        jdbcTemplate.update("""
                INSERT INTO conversation_summaries (conversation_id, summary, expires_at, updated_at)
                VALUES (?, ?, ?, ?)
                ON CONFLICT (conversation_id)
                DO UPDATE SET summary = EXCLUDED.summary, expires_at = EXCLUDED.expires_at,
                              updated_at = EXCLUDED.updated_at
                """, conversationId, summary, Timestamp.from(now.plus(ttl)), Timestamp.from(now));
    }
}
