package com.walkforage.core.domain.resources;

import java.util.*;

/**
 * Read-only lookup of material definitions, grouped by resource type.
 * The per-type lists stay in declaration order; the id maps are derived from them once.
 */
public final class MaterialCatalog {

    private final Map<String, List<Material>> byType = new LinkedHashMap<>();
    private final Map<String, Map<String, Material>> byTypeAndId = new HashMap<>();

    public MaterialCatalog(Collection<Material> materials) {
        if (materials == null) return;

        Map<String, List<Material>> grouped = new LinkedHashMap<>();
        for (Material m : materials) {
            if (m == null) continue;
            Map<String, Material> ids = byTypeAndId.computeIfAbsent(m.resourceType(), k -> new HashMap<>());
            if (ids.putIfAbsent(m.id(), m) != null) {
                throw new IllegalArgumentException("duplicate material " + m.resourceType() + "/" + m.id());
            }
            grouped.computeIfAbsent(m.resourceType(), k -> new ArrayList<>()).add(m);
        }
        grouped.forEach((type, list) -> byType.put(type, List.copyOf(list)));
    }

    public Material get(String resourceType, String materialId) {
        if (resourceType == null || materialId == null) return null;
        Map<String, Material> ids = byTypeAndId.get(resourceType);
        return (ids != null) ? ids.get(materialId) : null;
    }

    public List<Material> getAll(String resourceType) {
        if (resourceType == null) return List.of();
        return byType.getOrDefault(resourceType, List.of());
    }

    public List<Material> getAll() {
        List<Material> out = new ArrayList<>();
        byType.values().forEach(out::addAll);
        return out;
    }

    public Set<String> getResourceTypes() {
        return Collections.unmodifiableSet(byType.keySet());
    }

    public List<Material> getWithFlag(String resourceType, String flag) {
        List<Material> out = new ArrayList<>();
        for (Material m : getAll(resourceType)) {
            if (m.hasFlag(flag)) out.add(m);
        }
        return out;
    }
}
