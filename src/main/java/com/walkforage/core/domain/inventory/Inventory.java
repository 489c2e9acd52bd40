package com.walkforage.core.domain.inventory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.walkforage.core.domain.resources.ResourceType;
import com.walkforage.core.domain.resources.ResourceTypeRegistry;

import java.util.*;

/**
 * Player inventory: per resource type, an ordered list of stacks.
 *
 * Invariants:
 * - at most one stack per materialId within a type;
 * - a stack never holds zero or fewer units (it is removed instead).
 *
 * Only registered resource types are accepted. Instances are owned by one session
 * and are not thread-safe.
 */
public class Inventory {

    private static class StackSlot {
        final String materialId;
        int count;

        StackSlot(String materialId, int count) {
            this.materialId = materialId;
            this.count = count;
        }
    }

    private final Map<String, List<StackSlot>> slotsByType = new LinkedHashMap<>();

    public Inventory(ResourceTypeRegistry registry) {
        if (registry == null) return;
        for (ResourceType t : registry.getAll()) {
            slotsByType.put(t.id(), new ArrayList<>());
        }
    }

    private Inventory(Collection<String> typeIds) {
        for (String id : typeIds) slotsByType.put(id, new ArrayList<>());
    }

    // ==========================================================
    // READ-ONLY HELPERS
    // ==========================================================

    public Set<String> getResourceTypes() {
        return Collections.unmodifiableSet(slotsByType.keySet());
    }

    public boolean supportsType(String resourceType) {
        return resourceType != null && slotsByType.containsKey(resourceType);
    }

    /**
     * Snapshot of the stacks of a type, in insertion order.
     */
    public List<ResourceStack> stacks(String resourceType) {
        List<StackSlot> slots = slotsFor(resourceType);
        if (slots.isEmpty()) return Collections.emptyList();
        List<ResourceStack> out = new ArrayList<>(slots.size());
        for (StackSlot s : slots) out.add(new ResourceStack(s.materialId, s.count));
        return Collections.unmodifiableList(out);
    }

    public int getCount(String resourceType, String materialId) {
        StackSlot s = find(resourceType, materialId);
        return (s != null) ? s.count : 0;
    }

    /**
     * Sum over every stack of the type, regardless of material. Saturates at Integer.MAX_VALUE.
     */
    public int getTotal(String resourceType) {
        long total = 0;
        for (StackSlot s : slotsFor(resourceType)) total += s.count;
        return (int) Math.min(total, Integer.MAX_VALUE);
    }

    public boolean has(String resourceType, String materialId, int quantity) {
        return getCount(resourceType, materialId) >= quantity;
    }

    public boolean isEmpty() {
        for (List<StackSlot> slots : slotsByType.values()) {
            if (!slots.isEmpty()) return false;
        }
        return true;
    }

    // ==========================================================
    // MUTATION
    // ==========================================================

    /**
     * Adds units to the material's stack, creating it at the end of the type list if needed.
     * @return false for an unknown type, a blank id or a non-positive quantity
     */
    public boolean add(String resourceType, String materialId, int quantity) {
        if (!supportsType(resourceType)) return false;
        if (materialId == null || materialId.isBlank() || quantity <= 0) return false;

        StackSlot s = find(resourceType, materialId);
        if (s == null) {
            slotsByType.get(resourceType).add(new StackSlot(materialId, quantity));
            return true;
        }
        long sum = (long) s.count + quantity;
        if (sum > Integer.MAX_VALUE) return false;
        s.count = (int) sum;
        return true;
    }

    /**
     * Removes units from one stack. A stack that reaches zero is dropped.
     * @return false (and nothing changes) if the stack is missing or too small
     */
    public boolean remove(String resourceType, String materialId, int quantity) {
        if (quantity <= 0) return false;
        StackSlot s = find(resourceType, materialId);
        if (s == null || s.count < quantity) return false;

        s.count -= quantity;
        if (s.count == 0) {
            slotsByType.get(resourceType).remove(s);
        }
        return true;
    }

    /**
     * Adds every stack of {@code source} into this inventory. Types unknown here are skipped.
     */
    public void mergeFrom(Inventory source) {
        if (source == null) return;
        for (var e : source.slotsByType.entrySet()) {
            for (StackSlot s : e.getValue()) {
                add(e.getKey(), s.materialId, s.count);
            }
        }
    }

    public Inventory copy() {
        Inventory out = new Inventory(slotsByType.keySet());
        for (var e : slotsByType.entrySet()) {
            List<StackSlot> target = out.slotsByType.get(e.getKey());
            for (StackSlot s : e.getValue()) target.add(new StackSlot(s.materialId, s.count));
        }
        return out;
    }

    // --- HELPER ---

    private List<StackSlot> slotsFor(String resourceType) {
        if (resourceType == null) return Collections.emptyList();
        List<StackSlot> slots = slotsByType.get(resourceType);
        return (slots != null) ? slots : Collections.emptyList();
    }

    private StackSlot find(String resourceType, String materialId) {
        if (materialId == null) return null;
        for (StackSlot s : slotsFor(resourceType)) {
            if (s.materialId.equals(materialId)) return s;
        }
        return null;
    }

    // --- SERIALIZZAZIONE ---

    public JsonObject serialize() {
        JsonObject json = new JsonObject();
        for (var e : slotsByType.entrySet()) {
            JsonArray arr = new JsonArray();
            for (StackSlot s : e.getValue()) {
                JsonObject stack = new JsonObject();
                stack.addProperty("materialId", s.materialId);
                stack.addProperty("quantity", s.count);
                arr.add(stack);
            }
            json.add(e.getKey(), arr);
        }
        return json;
    }

    /**
     * Rebuilds an inventory from {@link #serialize()} output. Unknown types, blank ids and
     * non-positive quantities are dropped; repeated materials are merged into one stack.
     */
    public static Inventory fromSerialized(JsonObject json, ResourceTypeRegistry registry) {
        Inventory inv = new Inventory(registry);
        if (json == null) return inv;

        for (String type : json.keySet()) {
            if (!inv.supportsType(type)) {
                System.err.println("⚠️ [Inventory] Unknown resource type in snapshot: " + type);
                continue;
            }
            JsonElement el = json.get(type);
            if (el == null || !el.isJsonArray()) continue;

            for (JsonElement item : el.getAsJsonArray()) {
                if (item == null || !item.isJsonObject()) continue;
                JsonObject obj = item.getAsJsonObject();
                if (!obj.has("materialId") || !obj.has("quantity")) continue;
                inv.add(type, obj.get("materialId").getAsString(), obj.get("quantity").getAsInt());
            }
        }
        return inv;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Inventory other)) return false;
        if (!slotsByType.keySet().equals(other.slotsByType.keySet())) return false;
        for (String type : slotsByType.keySet()) {
            if (!stacks(type).equals(other.stacks(type))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (String type : slotsByType.keySet()) {
            h = 31 * h + type.hashCode();
            h = 31 * h + stacks(type).hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Inventory{");
        boolean first = true;
        for (String type : slotsByType.keySet()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(type).append('=').append(stacks(type));
        }
        return sb.append('}').toString();
    }
}
