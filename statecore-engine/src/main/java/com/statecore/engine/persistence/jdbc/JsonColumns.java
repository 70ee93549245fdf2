package com.statecore.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.exception.StorageException;

/**
 * Converts JSONB column values to and from Jackson object nodes.
 */
final class JsonColumns {

    private final ObjectMapper objectMapper;

    JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize JSON column", e);
        }
    }

    ObjectNode read(String json) {
        if (json == null || json.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.isObject()) {
                throw new StorageException("Expected a JSON object column but found " + node.getNodeType(), null);
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to deserialize JSON column", e);
        }
    }
}
