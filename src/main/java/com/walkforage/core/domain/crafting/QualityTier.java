package com.walkforage.core.domain.crafting;

/**
 * Discrete quality buckets, lowest first. The cut points live in {@code QualityScorer}.
 */
public enum QualityTier {
    POOR,
    ADEQUATE,
    GOOD,
    EXCELLENT,
    MASTERWORK;

    public String displayName() {
        String n = name().toLowerCase();
        return Character.toUpperCase(n.charAt(0)) + n.substring(1);
    }
}
