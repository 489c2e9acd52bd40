package com.walkforage.core.domain.resources;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Data-driven resource category (stone, wood, food, ...).
 * The property schema drives both material validation and quality scoring.
 */
public record ResourceType(
        String id,
        String singularName,
        String pluralName,
        String icon,
        List<PropertyDefinition> propertySchema,
        Map<String, Double> defaultQualityWeights,
        Set<String> supportedFlags
) {

    public ResourceType {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("resource type id is blank");
        propertySchema = (propertySchema != null) ? List.copyOf(propertySchema) : List.of();
        defaultQualityWeights = (defaultQualityWeights != null) ? Map.copyOf(defaultQualityWeights) : Map.of();
        supportedFlags = (supportedFlags != null) ? Set.copyOf(supportedFlags) : Set.of();
        if (singularName == null) singularName = id;
        if (pluralName == null) pluralName = singularName + "s";
    }

    public PropertyDefinition getProperty(String propertyId) {
        for (PropertyDefinition p : propertySchema) {
            if (p.id().equals(propertyId)) return p;
        }
        return null;
    }

    public boolean hasProperty(String propertyId) {
        return getProperty(propertyId) != null;
    }

    public boolean supportsFlag(String flag) {
        return flag != null && supportedFlags.contains(flag);
    }
}
