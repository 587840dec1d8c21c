package com.dharmil.catalogcrawl.resume;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * {@link ResumeTokenStore} on table {@code crawl_resume_tokens}. Every emission is appended;
 * lookups return the newest row.
 */
public class JdbcResumeTokenStore implements ResumeTokenStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcResumeTokenStore.class);

    private static final String INSERT_SQL =
            "INSERT INTO crawl_resume_tokens (session_id, plan_hash, token_json, checkpoint, created_at) VALUES (?, ?, ?, ?, ?)";
    private static final String LATEST_BY_SESSION_SQL =
            "SELECT token_json FROM crawl_resume_tokens WHERE session_id = ? ORDER BY id DESC LIMIT 1";
    private static final String LATEST_BY_PLAN_SQL =
            "SELECT token_json FROM crawl_resume_tokens WHERE plan_hash = ? ORDER BY id DESC LIMIT 1";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcResumeTokenStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public void save(String sessionId, String planHash, String tokenJson, boolean checkpoint) {
        try {
            int rows = jdbcTemplate.update(INSERT_SQL, ps -> {
                ps.setString(1, sessionId);
                ps.setString(2, planHash);
                ps.setString(3, tokenJson);
                ps.setBoolean(4, checkpoint);
                ps.setTimestamp(5, Timestamp.from(clock.instant()));
            });
            if (rows != 1) {
                log.error("Saving resume token for session {} reported {} rows affected (expected 1)", sessionId, rows);
            } else {
                log.debug("Stored {} token for session {}", checkpoint ? "checkpoint" : "final", sessionId);
            }
        } catch (DataAccessException e) {
            log.error("Failed to store resume token for session {}", sessionId, e);
            throw e;
        }
    }

    @Override
    public Optional<String> findLatest(String sessionId) {
        return first(jdbcTemplate.queryForList(LATEST_BY_SESSION_SQL, String.class, sessionId));
    }

    @Override
    public Optional<String> findLatestByPlanHash(String planHash) {
        return first(jdbcTemplate.queryForList(LATEST_BY_PLAN_SQL, String.class, planHash));
    }

    private static Optional<String> first(List<String> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }
}
