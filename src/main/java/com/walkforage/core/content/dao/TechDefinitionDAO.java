package com.walkforage.core.content.dao;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.walkforage.core.content.ContentIntegrityException;
import com.walkforage.core.domain.tech.ResourceCost;
import com.walkforage.core.domain.tech.Technology;
import com.walkforage.core.ports.IContentSource;

import java.util.ArrayList;
import java.util.List;

public class TechDefinitionDAO {

    public static final String FILE = "technologies.json";

    private final IContentSource source;

    public TechDefinitionDAO(IContentSource source) {
        this.source = source;
    }

    public List<Technology> loadAllNodes() {
        List<Technology> nodes = new ArrayList<>();
        for (JsonElement el : ContentJson.readArray(source, FILE)) {
            JsonObject obj = ContentJson.asObject(el, FILE);
            String id = ContentJson.requireString(obj, "id", FILE);
            String where = FILE + "[" + id + "]";

            nodes.add(new Technology(
                    id,
                    ContentJson.getString(obj, "name", null, where),
                    ContentJson.getString(obj, "era", null, where),
                    ContentJson.getString(obj, "description", "", where),
                    ContentJson.stringList(obj, "prerequisites", where),
                    parseCosts(obj, "resourceCost", where),
                    ContentJson.stringList(obj, "unlocks", where),
                    ContentJson.stringList(obj, "enablesRecipes", where)
            ));
        }
        return nodes;
    }

    static List<ResourceCost> parseCosts(JsonObject obj, String key, String where) {
        List<ResourceCost> out = new ArrayList<>();
        if (!obj.has(key) || obj.get(key).isJsonNull()) return out;
        if (!obj.get(key).isJsonArray()) {
            throw new ContentIntegrityException(List.of(where + ": '" + key + "' must be an array"));
        }

        for (JsonElement el : obj.getAsJsonArray(key)) {
            JsonObject c = ContentJson.asObject(el, where + "." + key);
            String type = ContentJson.requireString(c, "resourceType", where + "." + key);
            int qty = ContentJson.getInt(c, "quantity", 0, where + "." + key);
            if (qty < 0) {
                throw new ContentIntegrityException(List.of(where + ": negative " + type + " quantity " + qty));
            }
            out.add(new ResourceCost(type, qty, ContentJson.getString(c, "requiredFlag", null, where)));
        }
        return out;
    }
}
