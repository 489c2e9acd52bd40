package com.walkforage.core.domain.crafting;

import java.util.*;

/**
 * How much each property axis contributes to a craftable's quality.
 *
 * A {@code common} block applies to every resource type; {@code perType} blocks override it
 * for one type. Each declared block is expected to be non-negative and sum to 1.0
 * (checked by the content validator, not here).
 */
public final class QualityWeights {

    public static final double SUM_TOLERANCE = 1e-6;

    private static final QualityWeights NONE = new QualityWeights(Map.of(), Map.of());

    private final Map<String, Double> common;
    private final Map<String, Map<String, Double>> perType;

    public QualityWeights(Map<String, Double> common, Map<String, Map<String, Double>> perType) {
        this.common = (common != null) ? Collections.unmodifiableMap(new LinkedHashMap<>(common)) : Map.of();
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        if (perType != null) {
            perType.forEach((type, w) -> copy.put(type, Collections.unmodifiableMap(new LinkedHashMap<>(w))));
        }
        this.perType = Collections.unmodifiableMap(copy);
    }

    public static QualityWeights none() {
        return NONE;
    }

    public static QualityWeights of(Map<String, Double> common) {
        return new QualityWeights(common, Map.of());
    }

    public Map<String, Double> getCommon() {
        return common;
    }

    public Map<String, Map<String, Double>> getPerType() {
        return perType;
    }

    /**
     * Weights to apply for a resource type: its own block, else the common block, else the fallback
     * (normally the resource type's default weights).
     */
    public Map<String, Double> forType(String resourceType, Map<String, Double> fallback) {
        Map<String, Double> own = perType.get(resourceType);
        if (own != null) return own;
        if (!common.isEmpty()) return common;
        return (fallback != null) ? fallback : Map.of();
    }

    public boolean isEmpty() {
        return common.isEmpty() && perType.isEmpty();
    }

    /**
     * Every declared block, keyed "common" or by resource type id.
     */
    public Map<String, Map<String, Double>> declaredBlocks() {
        Map<String, Map<String, Double>> out = new LinkedHashMap<>();
        if (!common.isEmpty()) out.put("common", common);
        out.putAll(perType);
        return out;
    }

    public static double sum(Map<String, Double> weights) {
        double s = 0.0;
        for (Double w : weights.values()) s += (w != null) ? w : 0.0;
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QualityWeights other)) return false;
        return common.equals(other.common) && perType.equals(other.perType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(common, perType);
    }

    @Override
    public String toString() {
        return "QualityWeights{common=" + common + ", perType=" + perType + "}";
    }
}
