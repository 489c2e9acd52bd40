package com.walkforage.core.domain.crafting;

import com.walkforage.core.domain.inventory.Selection;

/**
 * A crafted tool or component held by the player.
 * {@code usedMaterials} is the selection that paid for it; quality was scored from it.
 */
public record OwnedItem(
        String instanceId,
        String itemId,
        CraftableKind kind,
        Selection usedMaterials,
        double quality,
        QualityTier tier
) {

    public OwnedItem {
        if (instanceId == null || instanceId.isBlank()) throw new IllegalArgumentException("instanceId is blank");
        if (itemId == null || itemId.isBlank()) throw new IllegalArgumentException("itemId is blank");
        if (kind == null) throw new IllegalArgumentException("kind is null");
        if (usedMaterials == null) usedMaterials = Selection.empty();
        if (tier == null) tier = QualityTier.POOR;
    }
}
