package com.walkforage.core.domain.crafting;

import com.walkforage.core.domain.tech.ResourceCost;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Static definition of a tool or component recipe.
 */
public record Craftable(
        String id,
        String name,
        CraftableKind kind,
        String category,
        String era,
        String requiredTech,
        List<ItemRequirement> requiredTools,
        List<ItemRequirement> requiredComponents,
        List<ResourceCost> materials,
        QualityWeights qualityWeights
) {

    public Craftable {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("craftable id is blank");
        if (kind == null) throw new IllegalArgumentException("craftable " + id + " has no kind");
        requiredTools = (requiredTools != null) ? List.copyOf(requiredTools) : List.of();
        requiredComponents = (requiredComponents != null) ? List.copyOf(requiredComponents) : List.of();
        materials = (materials != null) ? List.copyOf(materials) : List.of();
        if (qualityWeights == null) qualityWeights = QualityWeights.none();
        if (name == null) name = id;
    }

    public boolean isTool() {
        return kind == CraftableKind.TOOL;
    }

    /**
     * Direct requirement ids (tools first, then components), each listed once.
     * These are the edges of the craftable dependency graph.
     */
    public List<String> requirementIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (ItemRequirement r : requiredTools) ids.add(r.itemId());
        for (ItemRequirement r : requiredComponents) ids.add(r.itemId());
        return new ArrayList<>(ids);
    }

    public boolean hasNoRequirements() {
        return requiredTools.isEmpty() && requiredComponents.isEmpty();
    }
}
