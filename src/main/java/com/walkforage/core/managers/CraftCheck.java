package com.walkforage.core.managers;

import java.util.List;
import java.util.Map;

/**
 * Pre-selection hint for the crafting screen: what is missing, and which stacks and component
 * instances could be picked. Advisory only.
 *
 * @param missingTech        required technology not yet unlocked, or null
 * @param eligibleMaterials  per resource type, material ids whose stacks satisfy the slot's flag
 * @param suggestedComponents owned component instance ids, up to the required quantity per component
 */
public record CraftCheck(
        String craftableId,
        boolean canProceed,
        String missingTech,
        List<ItemShortfall> missingTools,
        List<ItemShortfall> missingComponents,
        List<ResourceShortfall> missingResources,
        Map<String, List<String>> eligibleMaterials,
        List<String> suggestedComponents
) {

    public CraftCheck {
        missingTools = (missingTools != null) ? List.copyOf(missingTools) : List.of();
        missingComponents = (missingComponents != null) ? List.copyOf(missingComponents) : List.of();
        missingResources = (missingResources != null) ? List.copyOf(missingResources) : List.of();
        eligibleMaterials = (eligibleMaterials != null) ? Map.copyOf(eligibleMaterials) : Map.of();
        suggestedComponents = (suggestedComponents != null) ? List.copyOf(suggestedComponents) : List.of();
    }
}
