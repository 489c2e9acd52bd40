package com.walkforage.core.domain.tech;

import java.util.List;

public record Technology(
        String id,
        String name,
        String era,
        String description,
        List<String> prerequisites,
        List<ResourceCost> resourceCost,
        List<String> unlocks,
        List<String> enablesRecipes
) {

    public Technology {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("technology id is blank");
        prerequisites = (prerequisites != null) ? List.copyOf(prerequisites) : List.of();
        resourceCost = (resourceCost != null) ? List.copyOf(resourceCost) : List.of();
        unlocks = (unlocks != null) ? List.copyOf(unlocks) : List.of();
        enablesRecipes = (enablesRecipes != null) ? List.copyOf(enablesRecipes) : List.of();
        if (name == null) name = id;
    }

    /** Summed cost for one resource type, 0 when the type is not part of the price. */
    public int costFor(String resourceType) {
        int total = 0;
        for (ResourceCost c : resourceCost) {
            if (c.resourceType().equals(resourceType)) total += c.quantity();
        }
        return total;
    }

    public boolean isRoot() {
        return prerequisites.isEmpty();
    }
}
