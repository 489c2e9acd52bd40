package com.walkforage.core.domain.tech;

/**
 * A quantity of some resource type to pay. {@code requiredFlag} optionally restricts
 * which materials qualify (e.g. "toolstone"); null means any material of the type.
 */
public record ResourceCost(String resourceType, int quantity, String requiredFlag) {

    public ResourceCost {
        if (resourceType == null || resourceType.isBlank()) throw new IllegalArgumentException("resourceType is blank");
        if (quantity < 0) throw new IllegalArgumentException("negative cost for " + resourceType);
        if (requiredFlag != null && requiredFlag.isBlank()) requiredFlag = null;
    }

    public ResourceCost(String resourceType, int quantity) {
        this(resourceType, quantity, null);
    }

    public boolean isFlagged() {
        return requiredFlag != null;
    }
}
