package com.statecore.core.model;

import java.util.Locale;

/**
 * Kinds of entities whose state is tracked by the core.
 * Partitions the key space: an entity id is unique only within its type.
 */
public enum EntityType {
    WORKFLOW,
    AGENT,
    TASK,
    RESOURCE,
    SYSTEM;

    /**
     * Lower-case code used in lock keys, cache keys and storage rows.
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a type from its code or enum name, case-insensitively.
     */
    public static EntityType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Entity type code must not be blank");
        }
        return EntityType.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
