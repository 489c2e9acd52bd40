package com.walkforage.core.domain.resources;

import java.util.Map;
import java.util.Set;

/**
 * Static definition of a gatherable material (granite, european_ash, hazelnut, ...).
 */
public record Material(
        String id,
        String name,
        String resourceType,
        String category,
        String description,
        double rarity,
        Map<String, Double> properties,
        Set<String> flags
) {

    public Material {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("material id is blank");
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("material " + id + " has no resource type");
        }
        properties = (properties != null) ? Map.copyOf(properties) : Map.of();
        flags = (flags != null) ? Set.copyOf(flags) : Set.of();
        if (name == null) name = id;
    }

    public Double getProperty(String propertyId) {
        return properties.get(propertyId);
    }

    public boolean hasFlag(String flag) {
        return flag != null && flags.contains(flag);
    }

    public boolean isToolstone() {
        return hasFlag("toolstone");
    }
}
