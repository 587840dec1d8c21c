package com.dharmil.catalogcrawl.resume;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fingerprint of a crawl plan, carried in resume tokens.
 */
public final class PlanHashes {

    private PlanHashes() {
    }

    /** SHA-256 hex of {@code "pages=1,2,3;batch=10"}. */
    public static String of(List<Integer> pages, int batchSize) {
        String canonical = "pages=" + pages.stream().map(String::valueOf).collect(Collectors.joining(","))
                + ";batch=" + batchSize;
        return sha256Hex(canonical);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
