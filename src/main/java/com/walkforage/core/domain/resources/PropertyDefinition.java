package com.walkforage.core.domain.resources;

/**
 * One numeric axis of a resource type (hardness, workability, ...).
 * Values live on the closed range [minValue, maxValue], 1..10 unless the content says otherwise.
 */
public record PropertyDefinition(
        String id,
        String abbreviation,
        String displayName,
        double minValue,
        double maxValue
) {

    public static final double DEFAULT_MIN = 1.0;
    public static final double DEFAULT_MAX = 10.0;

    public PropertyDefinition {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("property id is blank");
        if (maxValue <= minValue) {
            throw new IllegalArgumentException("property " + id + ": maxValue must be > minValue");
        }
        if (abbreviation == null) abbreviation = id.substring(0, 1).toUpperCase();
        if (displayName == null) displayName = id;
    }

    public static PropertyDefinition of(String id) {
        return new PropertyDefinition(id, null, null, DEFAULT_MIN, DEFAULT_MAX);
    }

    /** Maps a raw value onto 0..1 using this axis' range. */
    public double normalize(double value) {
        return (value - minValue) / (maxValue - minValue);
    }

    public boolean inRange(double value) {
        return value >= minValue && value <= maxValue;
    }
}
