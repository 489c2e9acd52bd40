package com.walkforage.core.managers;

import java.util.List;

/**
 * Why a spend, unlock or craft was refused. These are expected, user-facing conditions:
 * the caller decides how to present them. Fields not relevant to a reason are null/0/empty.
 */
public record SpendFailure(
        Reason reason,
        String resourceType,
        String materialId,
        int have,
        int needed,
        List<String> missingIds
) {

    public enum Reason {
        NO_SELECTION,
        WRONG_QUANTITY_SELECTED,
        INSUFFICIENT_MATERIAL,
        MATERIAL_NOT_ELIGIBLE,
        ALREADY_UNLOCKED,
        MISSING_PREREQUISITES,
        MISSING_TOOLS,
        WRONG_COMPONENTS_SELECTED,
        UNKNOWN_TARGET
    }

    public SpendFailure {
        if (reason == null) throw new IllegalArgumentException("reason is null");
        missingIds = (missingIds != null) ? List.copyOf(missingIds) : List.of();
    }

    public static SpendFailure noSelection(String resourceType, int needed) {
        return new SpendFailure(Reason.NO_SELECTION, resourceType, null, 0, needed, List.of());
    }

    public static SpendFailure wrongQuantity(String resourceType, int selected, int needed) {
        return new SpendFailure(Reason.WRONG_QUANTITY_SELECTED, resourceType, null, selected, needed, List.of());
    }

    public static SpendFailure insufficient(String resourceType, String materialId, int have, int needed) {
        return new SpendFailure(Reason.INSUFFICIENT_MATERIAL, resourceType, materialId, have, needed, List.of());
    }

    public static SpendFailure notEligible(String resourceType, String materialId, String requiredFlag) {
        return new SpendFailure(Reason.MATERIAL_NOT_ELIGIBLE, resourceType, materialId, 0, 0,
                requiredFlag != null ? List.of(requiredFlag) : List.of());
    }

    public static SpendFailure alreadyUnlocked(String id) {
        return new SpendFailure(Reason.ALREADY_UNLOCKED, null, null, 0, 0, List.of(id));
    }

    public static SpendFailure missingPrerequisites(List<String> ids) {
        return new SpendFailure(Reason.MISSING_PREREQUISITES, null, null, 0, 0, ids);
    }

    public static SpendFailure missingTools(List<String> ids) {
        return new SpendFailure(Reason.MISSING_TOOLS, null, null, 0, 0, ids);
    }

    public static SpendFailure noComponentSelection(List<String> requiredIds) {
        return new SpendFailure(Reason.NO_SELECTION, null, null, 0, 0, requiredIds);
    }

    /**
     * @param offendingInstanceIds selected instances that are unknown, repeated, not components or not in the recipe
     */
    public static SpendFailure wrongComponents(List<String> offendingInstanceIds) {
        return new SpendFailure(Reason.WRONG_COMPONENTS_SELECTED, null, null, 0, 0, offendingInstanceIds);
    }

    /**
     * Valid instances, wrong number of them for one component definition. Only then is {@code needed} positive.
     */
    public static SpendFailure wrongComponentCount(String componentId, int selected, int needed) {
        return new SpendFailure(Reason.WRONG_COMPONENTS_SELECTED, null, null, selected, needed, List.of(componentId));
    }

    public boolean isComponentCountMismatch() {
        return reason == Reason.WRONG_COMPONENTS_SELECTED && needed > 0;
    }

    public static SpendFailure unknownTarget(String id) {
        return new SpendFailure(Reason.UNKNOWN_TARGET, null, null, 0, 0, id != null ? List.of(id) : List.of());
    }

    public String message() {
        return switch (reason) {
            case NO_SELECTION -> resourceType != null
                    ? "No " + resourceType + " selected (need " + needed + ")"
                    : "Components not selected: " + String.join(", ", missingIds);
            case WRONG_QUANTITY_SELECTED ->
                    "Wrong " + resourceType + " quantity selected (need " + needed + ", selected " + have + ")";
            case INSUFFICIENT_MATERIAL ->
                    "Not enough " + materialId + " (have " + have + ", need " + needed + ")";
            case MATERIAL_NOT_ELIGIBLE ->
                    materialId + " is not a valid " + resourceType
                            + (missingIds.isEmpty() ? "" : " (must be " + missingIds.get(0) + ")");
            case ALREADY_UNLOCKED -> "Already unlocked: " + String.join(", ", missingIds);
            case MISSING_PREREQUISITES -> "Missing prerequisites: " + String.join(", ", missingIds);
            case MISSING_TOOLS -> "Missing tools: " + String.join(", ", missingIds);
            case WRONG_COMPONENTS_SELECTED -> isComponentCountMismatch()
                    ? "Wrong number of " + missingIds.get(0) + " selected (need " + needed + ", selected " + have + ")"
                    : "Invalid component selection: " + String.join(", ", missingIds);
            case UNKNOWN_TARGET -> "Unknown id: " + String.join(", ", missingIds);
        };
    }
}
