package com.walkforage.core.managers;

import com.walkforage.core.domain.inventory.Inventory;
import com.walkforage.core.domain.inventory.Selection;
import com.walkforage.core.domain.resources.Material;
import com.walkforage.core.domain.resources.MaterialCatalog;
import com.walkforage.core.domain.tech.ResourceCost;

import java.util.*;

/**
 * Validates a player's selection against a price and debits the inventory.
 *
 * Protocol: every check runs before any stack is touched (validate-all, then apply-all).
 * This class is the only code path that removes resources from an {@link Inventory};
 * callers must not run two spends on the same inventory concurrently.
 */
public class ConsumptionEngine {

    private final MaterialCatalog catalog;

    public ConsumptionEngine(MaterialCatalog catalog) {
        this.catalog = (catalog != null) ? catalog : new MaterialCatalog(List.of());
    }

    public SpendResult attemptSpend(List<ResourceCost> requiredCosts, Selection selection, Inventory inventory) {
        return attemptSpend(null, requiredCosts, selection, inventory);
    }

    /**
     * @param targetId the technology/craftable being paid for, echoed back on success
     */
    public SpendResult attemptSpend(String targetId,
                                    List<ResourceCost> requiredCosts,
                                    Selection selection,
                                    Inventory inventory) {
        Objects.requireNonNull(inventory, "inventory");
        Selection sel = (selection != null) ? selection : Selection.empty();
        Map<String, TypeCost> costs = aggregate(requiredCosts);

        // 1) structural: every priced type must be present in the selection
        for (TypeCost c : costs.values()) {
            if (c.quantity > 0 && !sel.hasType(c.type)) {
                return SpendResult.failed(inventory, SpendFailure.noSelection(c.type, c.quantity));
            }
        }

        // 2) quantity: exact match per type, including types that cost nothing
        Set<String> types = new LinkedHashSet<>(costs.keySet());
        types.addAll(sel.getResourceTypes());
        for (String type : types) {
            int required = costs.containsKey(type) ? costs.get(type).quantity : 0;
            long selected = sel.getTotal(type);
            boolean negative = sel.getEntries(type).stream().anyMatch(e -> e.quantity() < 0);

            if (negative || selected != required) {
                return SpendResult.failed(inventory, SpendFailure.wrongQuantity(type, clampToInt(selected), required));
            }
        }

        // 3) eligibility of flag-constrained slots
        for (TypeCost c : costs.values()) {
            if (c.flags.isEmpty()) continue;
            for (var e : sel.aggregate(c.type).entrySet()) {
                if (e.getValue() <= 0) continue;
                Material m = catalog.get(c.type, e.getKey());
                String missingFlag = firstMissingFlag(m, c.flags);
                if (missingFlag != null) {
                    return SpendResult.failed(inventory, SpendFailure.notEligible(c.type, e.getKey(), missingFlag));
                }
            }
        }

        // 4) availability: first shortfall aborts the whole spend
        List<Debit> debits = new ArrayList<>();
        for (String type : types) {
            for (var e : sel.aggregate(type).entrySet()) {
                int needed = (int) (long) e.getValue();
                if (needed <= 0) continue;

                int have = inventory.getCount(type, e.getKey());
                if (have < needed) {
                    return SpendResult.failed(inventory, SpendFailure.insufficient(type, e.getKey(), have, needed));
                }
                debits.add(new Debit(type, e.getKey(), needed));
            }
        }

        // 5) apply
        for (Debit d : debits) {
            if (!inventory.remove(d.type, d.materialId, d.quantity)) {
                // unreachable after step 4 unless the inventory is shared with another writer
                throw new IllegalStateException("Inventory changed during spend: " + d.type + "/" + d.materialId);
            }
        }

        return SpendResult.ok(inventory, targetId);
    }

    // --- HELPER ---

    private static Map<String, TypeCost> aggregate(List<ResourceCost> requiredCosts) {
        Map<String, TypeCost> out = new LinkedHashMap<>();
        if (requiredCosts == null) return out;

        for (ResourceCost c : requiredCosts) {
            if (c == null) continue;
            TypeCost agg = out.computeIfAbsent(c.resourceType(), TypeCost::new);
            agg.quantity += c.quantity();
            if (c.isFlagged()) agg.flags.add(c.requiredFlag());
        }
        return out;
    }

    private static String firstMissingFlag(Material m, Set<String> flags) {
        for (String f : flags) {
            if (m == null || !m.hasFlag(f)) return f;
        }
        return null;
    }

    private static int clampToInt(long v) {
        if (v > Integer.MAX_VALUE) return Integer.MAX_VALUE;
        if (v < Integer.MIN_VALUE) return Integer.MIN_VALUE;
        return (int) v;
    }

    private static final class TypeCost {
        final String type;
        int quantity;
        final Set<String> flags = new LinkedHashSet<>();

        TypeCost(String type) {
            this.type = type;
        }
    }

    private record Debit(String type, String materialId, int quantity) {}
}
