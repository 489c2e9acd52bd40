package com.walkforage.core.content.dao;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.walkforage.core.content.ContentIntegrityException;
import com.walkforage.core.domain.resources.PropertyDefinition;
import com.walkforage.core.domain.resources.ResourceType;
import com.walkforage.core.ports.IContentSource;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

public class ResourceTypeDAO {

    public static final String FILE = "resource_types.json";

    private final IContentSource source;

    public ResourceTypeDAO(IContentSource source) {
        this.source = source;
    }

    public List<ResourceType> loadAll() {
        List<ResourceType> out = new ArrayList<>();
        for (JsonElement el : ContentJson.readArray(source, FILE)) {
            JsonObject obj = ContentJson.asObject(el, FILE);
            String id = ContentJson.requireString(obj, "id", FILE);
            String where = FILE + "[" + id + "]";

            List<PropertyDefinition> schema = new ArrayList<>();
            if (obj.has("properties") && obj.get("properties").isJsonArray()) {
                for (JsonElement p : obj.getAsJsonArray("properties")) {
                    JsonObject po = ContentJson.asObject(p, where + ".properties");
                    String pid = ContentJson.requireString(po, "id", where + ".properties");
                    try {
                        schema.add(new PropertyDefinition(
                                pid,
                                ContentJson.getString(po, "abbreviation", null, where),
                                ContentJson.getString(po, "displayName", null, where),
                                ContentJson.getDouble(po, "minValue", PropertyDefinition.DEFAULT_MIN, where),
                                ContentJson.getDouble(po, "maxValue", PropertyDefinition.DEFAULT_MAX, where)
                        ));
                    } catch (IllegalArgumentException e) {
                        throw new ContentIntegrityException(where + ": " + e.getMessage(), e);
                    }
                }
            }

            out.add(new ResourceType(
                    id,
                    ContentJson.getString(obj, "singularName", null, where),
                    ContentJson.getString(obj, "pluralName", null, where),
                    ContentJson.getString(obj, "icon", "", where),
                    schema,
                    ContentJson.doubleMap(obj.get("defaultQualityWeights"), where + ".defaultQualityWeights"),
                    new LinkedHashSet<>(ContentJson.stringList(obj, "flags", where))
            ));
        }
        return out;
    }
}
