package com.walkforage.core.domain.crafting;

/**
 * A required tool or component, by definition id, and how many instances are needed.
 */
public record ItemRequirement(String itemId, int quantity) {

    public ItemRequirement {
        if (itemId == null || itemId.isBlank()) throw new IllegalArgumentException("itemId is blank");
        if (quantity <= 0) throw new IllegalArgumentException("quantity must be > 0 for " + itemId);
    }

    public static ItemRequirement one(String itemId) {
        return new ItemRequirement(itemId, 1);
    }
}
