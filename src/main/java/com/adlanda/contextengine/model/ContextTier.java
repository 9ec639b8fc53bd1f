package com.adlanda.contextengine.model;

import java.util.List;

/**
 * Priority bucket for context scope.
 *
 * Retrieval searches tiers in declaration order: the most specific
 * (workspace) first, the most general (global) last.
 */
public enum ContextTier {
    WORKSPACE("workspace"),
    HYBRID("hybrid"),
    GLOBAL("global");

    /**
     * Fixed hierarchical search order.
     */
    public static final List<ContextTier> SEARCH_ORDER = List.of(WORKSPACE, HYBRID, GLOBAL);

    private final String value;

    ContextTier(String value) {
        this.value = value;
    }

    /**
     * Lower-case name used in vector index payloads and filters.
     */
    public String value() {
        return value;
    }

    public static ContextTier fromValue(String value) {
        for (ContextTier tier : values()) {
            if (tier.value.equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown context tier: " + value);
    }
}
