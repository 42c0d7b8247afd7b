package org.neuralchilli.marshal.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical JSON and SHA-256 helpers used for idempotency keys, output hashes
 * and the ledger hash chain. Canonical means sorted map keys and no whitespace,
 * so equal values always produce equal text.
 */
public final class Hashing {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private Hashing() {
    }

    public static ObjectMapper canonicalMapper() {
        return CANONICAL;
    }

    public static String canonicalJson(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON serializable: " + e.getMessage(), e);
        }
    }

    public static Map<String, Object> parseJsonObject(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return CANONICAL.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Deterministic key of one logical step invocation.
     */
    public static String idempotencyKey(String runId, String stepName, Map<String, Object> effectiveParams) {
        return sha256(runId + "\n" + stepName + "\n" + canonicalJson(effectiveParams));
    }

    /**
     * Hash of a step's outputs, used by replay to compare runs.
     */
    public static String outputHash(Map<String, Object> outputs) {
        return sha256(canonicalJson(outputs));
    }

    /**
     * Chain link: hash over an event's material and its predecessor's hash.
     */
    public static String chain(String material, String previousHash) {
        return sha256(previousHash + "\n" + material);
    }
}
