package com.walkforage.core.managers;

import java.util.List;

/**
 * Pre-selection hint for the unlock screen. Resource totals are summed across stacks,
 * so a clean check does not prove a particular selection will commit.
 */
public record AvailabilityCheck(
        String id,
        boolean canProceed,
        boolean alreadyUnlocked,
        List<String> missingPrerequisites,
        List<ResourceShortfall> missingResources
) {

    public AvailabilityCheck {
        missingPrerequisites = (missingPrerequisites != null) ? List.copyOf(missingPrerequisites) : List.of();
        missingResources = (missingResources != null) ? List.copyOf(missingResources) : List.of();
    }
}
