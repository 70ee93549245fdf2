package com.statecore.engine.cache;

import com.statecore.core.model.EntityType;

/**
 * A cached entity of type {@code target} depends on entities of type {@code source}
 * whose payload field {@code field} references it by id.
 *
 * Example: task.workflow_id -> workflow means a change to a task invalidates its workflow.
 */
public record DependencyRule(EntityType source, String field, EntityType target) {

    /**
     * Parse "source.field->target", e.g. "task.assigned_agent->agent".
     */
    public static DependencyRule parse(String rule) {
        int arrow = rule.indexOf("->");
        int dot = rule.indexOf('.');
        if (arrow < 0 || dot < 0 || dot > arrow) {
            throw new IllegalArgumentException("Expected 'source.field->target' but got: " + rule);
        }
        return new DependencyRule(
            EntityType.fromCode(rule.substring(0, dot).trim()),
            rule.substring(dot + 1, arrow).trim(),
            EntityType.fromCode(rule.substring(arrow + 2).trim())
        );
    }

    @Override
    public String toString() {
        return source.code() + "." + field + "->" + target.code();
    }
}
