package com.walkforage.core.managers;

import com.walkforage.core.domain.crafting.OwnedItem;

public record CraftResult(boolean success, OwnedItem item, SpendFailure failure) {

    public static CraftResult ok(OwnedItem item) {
        return new CraftResult(true, item, null);
    }

    public static CraftResult failed(SpendFailure failure) {
        return new CraftResult(false, null, failure);
    }

    public SpendFailure.Reason reason() {
        return (failure != null) ? failure.reason() : null;
    }
}
