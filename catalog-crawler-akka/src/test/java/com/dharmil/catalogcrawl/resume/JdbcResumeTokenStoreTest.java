package com.dharmil.catalogcrawl.resume;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Clock;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcResumeTokenStoreTest {

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private JdbcResumeTokenStore store;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("schema.sql")
                .build();
        jdbcTemplate = new JdbcTemplate(database);
        store = new JdbcResumeTokenStore(jdbcTemplate, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void returnsNewestTokenPerSession() {
        store.save("s-1", "plan-a", "{\"n\":1}", true);
        store.save("s-1", "plan-a", "{\"n\":2}", false);
        store.save("s-2", "plan-b", "{\"n\":3}", false);

        assertEquals(Optional.of("{\"n\":2}"), store.findLatest("s-1"));
        assertEquals(Optional.of("{\"n\":3}"), store.findLatest("s-2"));
        assertEquals(Optional.of("{\"n\":2}"), store.findLatestByPlanHash("plan-a"));
        assertTrue(store.findLatest("missing").isEmpty());
    }

    @Test
    void recordsCheckpointFlag() {
        store.save("s-1", "plan-a", "{}", true);
        Boolean checkpoint = jdbcTemplate.queryForObject(
                "SELECT checkpoint FROM crawl_resume_tokens WHERE session_id = ?", Boolean.class, "s-1");
        assertEquals(Boolean.TRUE, checkpoint);
    }
}
