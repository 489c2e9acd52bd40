package com.walkforage.core.domain.resources;

import java.util.*;

/**
 * Registry of every resource type known to the content.
 * Declaration order is kept: inventories and listings iterate types in that order.
 */
public final class ResourceTypeRegistry {

    private final Map<String, ResourceType> types = new LinkedHashMap<>();

    public ResourceTypeRegistry(Collection<ResourceType> definitions) {
        if (definitions == null) return;
        for (ResourceType t : definitions) {
            if (t == null) continue;
            if (types.putIfAbsent(t.id(), t) != null) {
                throw new IllegalArgumentException("duplicate resource type: " + t.id());
            }
        }
    }

    public ResourceType get(String typeId) {
        if (typeId == null) return null;
        return types.get(typeId);
    }

    public boolean contains(String typeId) {
        return typeId != null && types.containsKey(typeId);
    }

    public List<ResourceType> getAll() {
        return List.copyOf(types.values());
    }

    public List<String> getIds() {
        return List.copyOf(types.keySet());
    }

    public int size() {
        return types.size();
    }
}
