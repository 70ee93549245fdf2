package com.statecore.core.fold;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;

/**
 * SHA-256 checksum and size of a payload's canonical JSON form
 * (object fields sorted by name at every depth).
 */
public final class PayloadChecksums {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PayloadChecksums() {
    }

    public record Digest(String checksum, int sizeBytes) {
    }

    public static Digest digest(ObjectNode payload) {
        byte[] canonical = canonicalBytes(payload);
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return new Digest(HexFormat.of().formatHex(sha256.digest(canonical)), canonical.length);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static byte[] canonicalBytes(ObjectNode payload) {
        try {
            return MAPPER.writeValueAsBytes(canonicalize(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable", e);
        }
    }

    private static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            names.sort(null);
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            Iterator<JsonNode> elements = node.elements();
            while (elements.hasNext()) {
                array.add(canonicalize(elements.next()));
            }
            return array;
        }
        return node;
    }
}
