package com.walkforage.core.content.dao;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.walkforage.core.domain.resources.Material;
import com.walkforage.core.domain.resources.ResourceType;
import com.walkforage.core.ports.IContentSource;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * One table per resource type: {@code materials/<type>.json}.
 */
public class MaterialDefinitionDAO {

    private final IContentSource source;

    public MaterialDefinitionDAO(IContentSource source) {
        this.source = source;
    }

    public static String fileFor(String resourceType) {
        return "materials/" + resourceType + ".json";
    }

    public List<Material> loadAll(List<ResourceType> types) {
        List<Material> out = new ArrayList<>();
        for (ResourceType t : types) {
            String file = fileFor(t.id());
            if (!source.exists(file)) {
                System.out.println("⚠️ [ContentLoader] No material table for type '" + t.id() + "' (" + file + ")");
                continue;
            }
            out.addAll(load(t.id(), file));
        }
        return out;
    }

    private List<Material> load(String type, String file) {
        List<Material> out = new ArrayList<>();
        for (JsonElement el : ContentJson.readArray(source, file)) {
            JsonObject obj = ContentJson.asObject(el, file);
            String id = ContentJson.requireString(obj, "id", file);
            String where = file + "[" + id + "]";

            out.add(new Material(
                    id,
                    ContentJson.getString(obj, "name", null, where),
                    type,
                    ContentJson.getString(obj, "category", null, where),
                    ContentJson.getString(obj, "description", "", where),
                    ContentJson.getDouble(obj, "rarity", 0.0, where),
                    ContentJson.doubleMap(obj.get("properties"), where + ".properties"),
                    new LinkedHashSet<>(ContentJson.stringList(obj, "flags", where))
            ));
        }
        return out;
    }
}
