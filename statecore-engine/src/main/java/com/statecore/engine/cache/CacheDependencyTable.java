package com.statecore.engine.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntityType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static table of which cached entities must be invalidated when another entity changes.
 * A reference may be a single id or an array of ids; both the old and new values count.
 */
public class CacheDependencyTable {

    private final List<DependencyRule> rules;

    public CacheDependencyTable(Collection<DependencyRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static CacheDependencyTable defaults() {
        return new CacheDependencyTable(List.of(
            new DependencyRule(EntityType.TASK, "workflow_id", EntityType.WORKFLOW),
            new DependencyRule(EntityType.TASK, "assigned_agent", EntityType.AGENT),
            new DependencyRule(EntityType.RESOURCE, "allocated_to", EntityType.AGENT)
        ));
    }

    public static CacheDependencyTable empty() {
        return new CacheDependencyTable(List.of());
    }

    /**
     * Keys depending on {@code key}, given its payload before and after a change.
     */
    public Set<EntityKey> dependentsOf(EntityKey key, ObjectNode before, ObjectNode after) {
        Set<EntityKey> dependents = new TreeSet<>();
        for (DependencyRule rule : rules) {
            if (rule.source() != key.entityType()) {
                continue;
            }
            collect(rule, before, dependents);
            collect(rule, after, dependents);
        }
        dependents.remove(key);
        return dependents;
    }

    public List<DependencyRule> rules() {
        return rules;
    }

    private static void collect(DependencyRule rule, ObjectNode payload, Set<EntityKey> into) {
        if (payload == null) {
            return;
        }
        JsonNode value = payload.get(rule.field());
        if (value == null || value.isNull()) {
            return;
        }
        List<JsonNode> ids = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(ids::add);
        } else {
            ids.add(value);
        }
        for (JsonNode id : ids) {
            if (id.isValueNode() && !id.isNull() && !id.asText().isBlank()) {
                into.add(EntityKey.of(rule.target(), id.asText()));
            }
        }
    }
}
