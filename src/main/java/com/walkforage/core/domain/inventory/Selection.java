package com.walkforage.core.domain.inventory;

import java.util.*;

/**
 * What the player chose to spend: per resource type, a list of (materialId, quantity).
 * Nothing here is checked against an inventory; {@code ConsumptionEngine} does that at commit time.
 */
public final class Selection {

    public record Entry(String materialId, int quantity) {
        public Entry {
            if (materialId == null || materialId.isBlank()) throw new IllegalArgumentException("materialId is blank");
        }
    }

    private static final Selection EMPTY = new Selection(Map.of());

    private final Map<String, List<Entry>> entries;

    private Selection(Map<String, List<Entry>> entries) {
        this.entries = entries;
    }

    public static Selection empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> getResourceTypes() {
        return entries.keySet();
    }

    public boolean hasType(String resourceType) {
        List<Entry> list = entries.get(resourceType);
        return list != null && !list.isEmpty();
    }

    public List<Entry> getEntries(String resourceType) {
        if (resourceType == null) return List.of();
        return entries.getOrDefault(resourceType, List.of());
    }

    /**
     * Sum of the selected quantities for a type. Long, so oversized selections can't wrap.
     */
    public long getTotal(String resourceType) {
        long total = 0;
        for (Entry e : getEntries(resourceType)) total += e.quantity();
        return total;
    }

    /**
     * Selected quantity per material, duplicates merged, first-seen order.
     */
    public Map<String, Long> aggregate(String resourceType) {
        Map<String, Long> out = new LinkedHashMap<>();
        for (Entry e : getEntries(resourceType)) {
            out.merge(e.materialId(), (long) e.quantity(), Long::sum);
        }
        return out;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Selection other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Selection" + entries;
    }

    public static final class Builder {
        private final Map<String, List<Entry>> entries = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(String resourceType, String materialId, int quantity) {
            if (resourceType == null || resourceType.isBlank()) throw new IllegalArgumentException("resourceType is blank");
            entries.computeIfAbsent(resourceType, k -> new ArrayList<>()).add(new Entry(materialId, quantity));
            return this;
        }

        public Selection build() {
            if (entries.isEmpty()) return EMPTY;
            Map<String, List<Entry>> copy = new LinkedHashMap<>();
            entries.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            return new Selection(Collections.unmodifiableMap(copy));
        }
    }
}
