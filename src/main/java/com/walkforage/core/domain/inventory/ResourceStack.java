package com.walkforage.core.domain.inventory;

/**
 * Read-only view of one stack: a material and how many units of it the player holds.
 */
public record ResourceStack(String materialId, int quantity) {

    public ResourceStack {
        if (materialId == null || materialId.isBlank()) throw new IllegalArgumentException("materialId is blank");
        if (quantity < 0) throw new IllegalArgumentException("negative quantity for " + materialId);
    }
}
