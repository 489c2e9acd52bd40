package com.walkforage.core.content.dao;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.walkforage.core.content.ContentIntegrityException;
import com.walkforage.core.domain.crafting.Craftable;
import com.walkforage.core.domain.crafting.CraftableKind;
import com.walkforage.core.domain.crafting.ItemRequirement;
import com.walkforage.core.domain.crafting.QualityWeights;
import com.walkforage.core.ports.IContentSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tools and components. Requirements accept either a bare id (quantity 1)
 * or {@code {"id": ..., "quantity": n}}.
 */
public class CraftableDefinitionDAO {

    public static final String FILE = "craftables.json";
    static final String COMMON_WEIGHTS_KEY = "default";

    private final IContentSource source;

    public CraftableDefinitionDAO(IContentSource source) {
        this.source = source;
    }

    public List<Craftable> loadAll() {
        List<Craftable> out = new ArrayList<>();
        for (JsonElement el : ContentJson.readArray(source, FILE)) {
            JsonObject obj = ContentJson.asObject(el, FILE);
            String id = ContentJson.requireString(obj, "id", FILE);
            String where = FILE + "[" + id + "]";

            out.add(new Craftable(
                    id,
                    ContentJson.getString(obj, "name", null, where),
                    parseKind(ContentJson.requireString(obj, "kind", where), where),
                    ContentJson.getString(obj, "category", null, where),
                    ContentJson.getString(obj, "era", null, where),
                    ContentJson.getString(obj, "requiredTech", null, where),
                    parseRequirements(obj, "requiredTools", where),
                    parseRequirements(obj, "requiredComponents", where),
                    TechDefinitionDAO.parseCosts(obj, "materials", where),
                    parseWeights(obj.get("qualityWeights"), where)
            ));
        }
        return out;
    }

    private static CraftableKind parseKind(String raw, String where) {
        try {
            return CraftableKind.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ContentIntegrityException(where + ": unknown kind '" + raw + "'", e);
        }
    }

    private static List<ItemRequirement> parseRequirements(JsonObject obj, String key, String where) {
        List<ItemRequirement> out = new ArrayList<>();
        for (JsonElement el : ContentJson.getArray(obj, key, where)) {
            try {
                if (el != null && el.isJsonPrimitive()) {
                    out.add(ItemRequirement.one(el.getAsString()));
                } else {
                    JsonObject r = ContentJson.asObject(el, where + "." + key);
                    out.add(new ItemRequirement(
                            ContentJson.requireString(r, "id", where + "." + key),
                            ContentJson.getInt(r, "quantity", 1, where + "." + key)));
                }
            } catch (IllegalArgumentException e) {
                throw new ContentIntegrityException(where + "." + key + ": " + e.getMessage(), e);
            }
        }
        return out;
    }

    private static QualityWeights parseWeights(JsonElement el, String where) {
        if (el == null || el.isJsonNull()) return QualityWeights.none();
        JsonObject obj = ContentJson.asObject(el, where + ".qualityWeights");

        Map<String, Double> common = new LinkedHashMap<>();
        Map<String, Map<String, Double>> perType = new LinkedHashMap<>();
        for (String key : obj.keySet()) {
            Map<String, Double> block = ContentJson.doubleMap(obj.get(key), where + ".qualityWeights." + key);
            if (COMMON_WEIGHTS_KEY.equals(key)) common = block;
            else perType.put(key, block);
        }
        return new QualityWeights(common, perType);
    }
}
