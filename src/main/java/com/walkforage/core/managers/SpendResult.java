package com.walkforage.core.managers;

import com.walkforage.core.domain.inventory.Inventory;

/**
 * Outcome of {@link ConsumptionEngine#attemptSpend}. On failure {@code inventory} is the
 * caller's instance, untouched; on success it is the same instance, debited.
 */
public record SpendResult(
        boolean success,
        Inventory inventory,
        String grantedId,
        SpendFailure failure
) {

    public static SpendResult ok(Inventory inventory, String grantedId) {
        return new SpendResult(true, inventory, grantedId, null);
    }

    public static SpendResult failed(Inventory inventory, SpendFailure failure) {
        return new SpendResult(false, inventory, null, failure);
    }

    public SpendFailure.Reason reason() {
        return (failure != null) ? failure.reason() : null;
    }
}
