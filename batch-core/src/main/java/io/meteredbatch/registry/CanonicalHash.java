package io.meteredbatch.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.meteredbatch.core.Json;
import io.meteredbatch.core.WorkItem;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 over a stable serialization of an item's identifying inputs. Fields are sorted by
 * name, values are trimmed and null equals empty, so field order and surrounding whitespace
 * never change the hash.
 */
public final class CanonicalHash {
    private CanonicalHash() {
    }

    public static String of(WorkItem item) {
        return of(item.identity(), item.payload());
    }

    public static String of(String identity, Map<String, String> payload) {
        Map<String, String> fields = new TreeMap<>();
        payload.forEach((k, v) -> fields.put(k, v == null ? "" : v.strip()));
        Map<String, Object> normalized = new TreeMap<>();
        normalized.put("identity", identity.strip());
        normalized.put("payload", fields);
        String canonical;
        try {
            canonical = Json.mapper().writeValueAsString(normalized);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize inputs of " + identity, e);
        }
        return sha256Hex(canonical);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
