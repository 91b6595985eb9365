package com.learningplatform.common.integrity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.learningplatform.common.tensor.ModelWeights;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Canonical serialization and SHA-256 hashing of model weights.
 *
 * <p>The canonical form is compact JSON with object keys sorted, so two
 * {@link ModelWeights} with equal layers always hash identically.
 *
 * <p>Thread-safe: the underlying {@link ObjectMapper} is configured once and only read.
 */
public final class WeightHasher {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private WeightHasher() {}

    public static String canonicalJson(ModelWeights weights) {
        try {
            return CANONICAL.writeValueAsString(weights.toPlain());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Weights could not be serialized", e);
        }
    }

    public static String hash(ModelWeights weights) {
        return sha256Hex(canonicalJson(weights));
    }

    /** Size of the canonical form in kilobytes. */
    public static double sizeKb(ModelWeights weights) {
        return canonicalJson(weights).getBytes(StandardCharsets.UTF_8).length / 1024.0;
    }

    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
