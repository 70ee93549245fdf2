package com.statecore.core.fold;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Builds the delta documents stored with each event.
 *
 * <pre>
 * {"replace": {...}}                  full payload (created, rollback)
 * {"set": {...}, "unset": ["field"]}  top-level field diff (updated, deleted)
 * </pre>
 */
public final class PayloadDelta {

    public static final String REPLACE = "replace";
    public static final String SET = "set";
    public static final String UNSET = "unset";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private PayloadDelta() {
    }

    /**
     * Delta that replaces the whole payload.
     */
    public static ObjectNode replace(ObjectNode payload) {
        ObjectNode delta = NODES.objectNode();
        delta.set(REPLACE, payload.deepCopy());
        return delta;
    }

    /**
     * Top-level diff turning {@code before} into {@code after}.
     * Changed or added fields go to "set" with their full new value, removed fields to "unset".
     */
    public static ObjectNode diff(ObjectNode before, ObjectNode after) {
        ObjectNode set = NODES.objectNode();
        ArrayNode unset = NODES.arrayNode();

        Iterator<Map.Entry<String, JsonNode>> fields = after.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode previous = before == null ? null : before.get(field.getKey());
            if (previous == null || !previous.equals(field.getValue())) {
                set.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        if (before != null) {
            Iterator<String> names = before.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (!after.has(name)) {
                    unset.add(name);
                }
            }
        }

        ObjectNode delta = NODES.objectNode();
        delta.set(SET, set);
        delta.set(UNSET, unset);
        return delta;
    }

    /**
     * Check if a diff delta changes nothing.
     */
    public static boolean isEmpty(ObjectNode delta) {
        if (delta.has(REPLACE)) {
            return false;
        }
        JsonNode set = delta.get(SET);
        JsonNode unset = delta.get(UNSET);
        return (set == null || set.isEmpty()) && (unset == null || unset.isEmpty());
    }
}
