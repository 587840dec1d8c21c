package com.dharmil.catalogcrawl.resume;

import com.dharmil.catalogcrawl.model.ResumeToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * JSON interchange form of {@link ResumeToken}. Works on the tree model so that an absent field
 * can be told apart from an empty one; unknown fields are ignored. Retry maps travel as arrays
 * of {@code [key, count]} pairs.
 */
public class ResumeTokenCodec {

    private final ObjectMapper mapper;

    public ResumeTokenCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // --- Encoding ---

    public String encode(ResumeToken token) {
        ObjectNode root = mapper.createObjectNode();
        if (token.version() != null) {
            root.put("version", token.version());
        }
        root.put("plan_hash", token.planHash());
        writeInts(root.putArray("remaining_pages"), token.remainingPages());
        if (token.remainingDetailIds() != null) {
            ArrayNode ids = root.putArray("remaining_detail_ids");
            token.remainingDetailIds().forEach(ids::add);
        }
        if (token.detailRetryCounts() != null) {
            ArrayNode pairs = root.putArray("detail_retry_counts");
            token.detailRetryCounts().forEach((id, count) -> pairs.addArray().add(id).add(count));
        }
        if (token.detailRetriesTotal() != null) {
            root.put("detail_retries_total", token.detailRetriesTotal());
        }
        if (token.generatedAt() != null) {
            root.put("generated_at", token.generatedAt().toString());
        }
        root.put("processed_pages", token.processedPages());
        root.put("total_pages", token.totalPages());
        root.put("batch_size", token.batchSize());
        root.put("concurrency_limit", token.concurrencyLimit());
        writeInts(root.putArray("retrying_pages"), token.retryingPages());
        writeInts(root.putArray("failed_pages"), token.failedPages());
        writePairs(root.putArray("retries_per_page"), token.retriesPerPage());
        if (token.detailRetryHistogram() != null) {
            writePairs(root.putArray("detail_retry_histogram"), token.detailRetryHistogram());
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not encode resume token", e);
        }
    }

    private static void writeInts(ArrayNode array, List<Integer> values) {
        values.forEach(array::add);
    }

    private static void writePairs(ArrayNode array, Map<Integer, Integer> pairs) {
        pairs.forEach((key, count) -> array.addArray().add(key).add(count));
    }

    // --- Decoding ---

    public ResumeToken decode(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidResumeTokenException("Resume token is empty");
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidResumeTokenException("Resume token is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidResumeTokenException("Resume token must be a JSON object");
        }
        JsonNode planHash = root.get("plan_hash");
        if (planHash == null || !planHash.isTextual()) {
            throw new InvalidResumeTokenException("Resume token has no plan_hash");
        }
        return new ResumeToken(
                root.hasNonNull("version") ? requireInt(root, "version") : null,
                planHash.asText(),
                readInts(root, "remaining_pages"),
                root.has("remaining_detail_ids") ? readStrings(root, "remaining_detail_ids") : null,
                root.has("detail_retry_counts") ? readPairs(root, "detail_retry_counts", JsonNode::asText) : null,
                root.hasNonNull("detail_retries_total") ? root.get("detail_retries_total").asLong() : null,
                readInstant(root),
                root.path("processed_pages").asLong(0),
                root.path("total_pages").asLong(0),
                root.path("batch_size").asInt(0),
                root.path("concurrency_limit").asInt(0),
                readInts(root, "retrying_pages"),
                readInts(root, "failed_pages"),
                readPairs(root, "retries_per_page", ResumeTokenCodec::asPage),
                root.has("detail_retry_histogram") ? readPairs(root, "detail_retry_histogram", ResumeTokenCodec::asPage) : null);
    }

    private static int requireInt(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new InvalidResumeTokenException("Field " + field + " must be an integer but was " + node);
        }
        return node.asInt();
    }

    private static List<Integer> readInts(JsonNode root, String field) {
        List<Integer> values = new ArrayList<>();
        for (JsonNode element : array(root, field)) {
            values.add(asPage(element));
        }
        return values;
    }

    private static List<String> readStrings(JsonNode root, String field) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : array(root, field)) {
            values.add(element.asText());
        }
        return values;
    }

    private static <K> Map<K, Integer> readPairs(JsonNode root, String field, Function<JsonNode, K> keyReader) {
        Map<K, Integer> pairs = new LinkedHashMap<>();
        for (JsonNode pair : array(root, field)) {
            if (!pair.isArray() || pair.size() != 2) {
                throw new InvalidResumeTokenException("Field " + field + " must hold [key, count] pairs but had " + pair);
            }
            pairs.put(keyReader.apply(pair.get(0)), asPage(pair.get(1)));
        }
        return pairs;
    }

    private static Iterable<JsonNode> array(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new InvalidResumeTokenException("Field " + field + " must be an array");
        }
        return node;
    }

    private static Integer asPage(JsonNode node) {
        if (!node.isIntegralNumber() || !node.canConvertToInt() || node.asInt() < 0) {
            throw new InvalidResumeTokenException("Expected a non-negative integer but found " + node);
        }
        return node.asInt();
    }

    private static Instant readInstant(JsonNode root) {
        JsonNode node = root.get("generated_at");
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            throw new InvalidResumeTokenException("generated_at is not an ISO-8601 instant: " + node.asText(), e);
        }
    }
}
