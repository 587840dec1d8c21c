package com.dharmil.catalogcrawl.resume;

import com.dharmil.catalogcrawl.model.ResumeToken;
import com.dharmil.catalogcrawl.support.TestRuntimes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResumeTokenCodecTest {

    private final ObjectMapper mapper = TestRuntimes.mapper();
    private final ResumeTokenCodec codec = new ResumeTokenCodec(mapper);

    @Test
    void decodesV2TokenWithoutVersionField() {
        String json = """
                {"plan_hash":"abc123","remaining_pages":[3,5],
                 "remaining_detail_ids":["p1-0","p1-4"],
                 "detail_retry_counts":[["p1-0",2]],
                 "detail_retries_total":7,
                 "generated_at":"2026-03-01T10:15:30Z",
                 "processed_pages":8,"total_pages":10,"batch_size":5,"concurrency_limit":2,
                 "retrying_pages":[5],"failed_pages":[3],
                 "retries_per_page":[[3,3],[5,1]],
                 "detail_retry_histogram":[[2,1]],
                 "some_future_field":true}
                """;

        ResumeToken token = codec.decode(json);

        assertNull(token.version());
        assertEquals(2, token.effectiveVersion());
        assertEquals("abc123", token.planHash());
        assertEquals(List.of(3, 5), token.remainingPages());
        assertEquals(List.of("p1-0", "p1-4"), token.remainingDetailIds());
        assertEquals(Map.of("p1-0", 2), token.detailRetryCounts());
        assertEquals(7L, token.detailRetriesTotal());
        assertEquals(Instant.parse("2026-03-01T10:15:30Z"), token.generatedAt());
        assertEquals(8, token.processedPages());
        assertEquals(10, token.totalPages());
        assertEquals(5, token.batchSize());
        assertEquals(2, token.concurrencyLimit());
        assertEquals(List.of(5), token.retryingPages());
        assertEquals(List.of(3), token.failedPages());
        assertEquals(Map.of(3, 3, 5, 1), token.retriesPerPage());
        assertEquals(Map.of(2, 1), token.detailRetryHistogram());
    }

    @Test
    void absentDetailFieldsDecodeAsNull() {
        ResumeToken token = codec.decode("""
                {"plan_hash":"h","remaining_pages":[1],"processed_pages":0,"total_pages":1,
                 "batch_size":10,"concurrency_limit":4,"retrying_pages":[],"failed_pages":[],
                 "retries_per_page":[]}
                """);

        assertFalse(token.hasDetailFields());
        assertEquals(1, token.effectiveVersion());
        assertNull(token.remainingDetailIds());
        assertNull(token.detailRetryCounts());
        assertNull(token.detailRetryHistogram());
    }

    @Test
    void encodesSnakeCaseFieldsAndPairArrays() throws Exception {
        ResumeToken token = new ResumeToken(2, "h", List.of(4), List.of("x"), Map.of("x", 1), 1L,
                Instant.parse("2026-03-01T00:00:00Z"), 3, 4, 10, 2, List.of(), List.of(4), Map.of(4, 3),
                Map.of(1, 1));

        JsonNode json = mapper.readTree(codec.encode(token));

        assertEquals(2, json.get("version").asInt());
        assertEquals("h", json.get("plan_hash").asText());
        assertEquals(4, json.get("remaining_pages").get(0).asInt());
        assertEquals("x", json.get("detail_retry_counts").get(0).get(0).asText());
        assertEquals(1, json.get("detail_retry_counts").get(0).get(1).asInt());
        assertEquals(3, json.get("retries_per_page").get(0).get(1).asInt());
        assertEquals("2026-03-01T00:00:00Z", json.get("generated_at").asText());
        assertEquals(4, json.get("failed_pages").get(0).asInt());
    }

    @Test
    void tokenWithoutDetailsOmitsDetailFields() throws Exception {
        ResumeToken token = new ResumeToken(null, "h", List.of(1), null, null, null, null,
                0, 1, 10, 4, List.of(), List.of(), Map.of(), null);

        JsonNode json = mapper.readTree(codec.encode(token));

        assertFalse(json.has("version"));
        assertFalse(json.has("remaining_detail_ids"));
        assertFalse(json.has("detail_retry_counts"));
        assertFalse(json.has("detail_retries_total"));
        assertFalse(json.has("detail_retry_histogram"));
        assertTrue(json.has("retries_per_page"));
    }

    @Test
    void rejectsMalformedTokens() {
        assertThrows(InvalidResumeTokenException.class, () -> codec.decode(""));
        assertThrows(InvalidResumeTokenException.class, () -> codec.decode("{not json"));
        assertThrows(InvalidResumeTokenException.class, () -> codec.decode("[1,2]"));
        assertThrows(InvalidResumeTokenException.class, () -> codec.decode("{\"remaining_pages\":[1]}"));
        assertThrows(InvalidResumeTokenException.class,
                () -> codec.decode("{\"plan_hash\":\"h\",\"remaining_pages\":\"1,2\"}"));
        assertThrows(InvalidResumeTokenException.class,
                () -> codec.decode("{\"plan_hash\":\"h\",\"remaining_pages\":[-1]}"));
        assertThrows(InvalidResumeTokenException.class,
                () -> codec.decode("{\"plan_hash\":\"h\",\"remaining_pages\":[1.5]}"));
        assertThrows(InvalidResumeTokenException.class,
                () -> codec.decode("{\"plan_hash\":\"h\",\"remaining_pages\":[1],\"retries_per_page\":[[1]]}"));
        assertThrows(InvalidResumeTokenException.class,
                () -> codec.decode("{\"plan_hash\":\"h\",\"remaining_pages\":[1],\"generated_at\":\"yesterday\"}"));
    }
}
