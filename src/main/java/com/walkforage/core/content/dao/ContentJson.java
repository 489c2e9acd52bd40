package com.walkforage.core.content.dao;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;
import com.walkforage.core.content.ContentIntegrityException;
import com.walkforage.core.ports.IContentSource;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.util.*;

/**
 * Gson helpers shared by the content DAOs. Any malformed table is fatal.
 */
final class ContentJson {

    private static final Gson GSON = new Gson();
    private static final Type STRING_LIST = new TypeToken<List<String>>() {}.getType();
    private static final Type DOUBLE_MAP = new TypeToken<LinkedHashMap<String, Double>>() {}.getType();

    private ContentJson() {}

    static JsonArray readArray(IContentSource source, String name) {
        try (Reader reader = source.open(name)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonArray()) {
                throw new ContentIntegrityException(List.of(name + ": expected a JSON array at the root"));
            }
            return root.getAsJsonArray();
        } catch (IOException e) {
            throw new ContentIntegrityException("Cannot read " + name + " from " + source.describe(), e);
        } catch (JsonParseException e) {
            throw new ContentIntegrityException("Malformed JSON in " + name + ": " + e.getMessage(), e);
        }
    }

    static JsonObject asObject(JsonElement el, String where) {
        if (el == null || !el.isJsonObject()) {
            throw new ContentIntegrityException(List.of(where + ": expected a JSON object"));
        }
        return el.getAsJsonObject();
    }

    static String requireString(JsonObject obj, String key, String where) {
        String s = getString(obj, key, null, where);
        if (s == null || s.isBlank()) {
            throw new ContentIntegrityException(List.of(where + ": missing '" + key + "'"));
        }
        return s;
    }

    static String getString(JsonObject obj, String key, String defaultValue, String where) {
        JsonElement el = obj.get(key);
        if (el == null || el.isJsonNull()) return defaultValue;
        if (!el.isJsonPrimitive()) {
            throw new ContentIntegrityException(List.of(where + ": '" + key + "' is not a string"));
        }
        return el.getAsString();
    }

    static int getInt(JsonObject obj, String key, int defaultValue, String where) {
        JsonElement el = obj.get(key);
        if (el == null || el.isJsonNull()) return defaultValue;
        try {
            if (!el.isJsonPrimitive()) throw new UnsupportedOperationException(el.toString());
            return el.getAsBigDecimal().intValueExact();
        } catch (ArithmeticException | NumberFormatException | UnsupportedOperationException e) {
            throw new ContentIntegrityException(where + ": '" + key + "' is not an integer", e);
        }
    }

    static double getDouble(JsonObject obj, String key, double defaultValue, String where) {
        JsonElement el = obj.get(key);
        if (el == null || el.isJsonNull()) return defaultValue;
        try {
            if (!el.isJsonPrimitive()) throw new UnsupportedOperationException(el.toString());
            return el.getAsDouble();
        } catch (NumberFormatException | UnsupportedOperationException e) {
            throw new ContentIntegrityException(where + ": '" + key + "' is not a number", e);
        }
    }

    static List<String> stringList(JsonObject obj, String key, String where) {
        JsonElement el = obj.get(key);
        if (el == null || el.isJsonNull()) return new ArrayList<>();
        try {
            List<String> out = GSON.fromJson(el, STRING_LIST);
            if (out == null) return new ArrayList<>();
            for (String s : out) {
                if (s == null || s.isBlank()) {
                    throw new ContentIntegrityException(List.of(where + ": '" + key + "' contains a blank or null entry"));
                }
            }
            return out;
        } catch (JsonParseException e) {
            throw new ContentIntegrityException(where + ": '" + key + "' is not a list of strings", e);
        }
    }

    static JsonArray getArray(JsonObject obj, String key, String where) {
        JsonElement el = obj.get(key);
        if (el == null || el.isJsonNull()) return new JsonArray();
        if (!el.isJsonArray()) {
            throw new ContentIntegrityException(List.of(where + ": '" + key + "' is not a list"));
        }
        return el.getAsJsonArray();
    }

    static Map<String, Double> doubleMap(JsonElement el, String where) {
        if (el == null || el.isJsonNull()) return new LinkedHashMap<>();
        try {
            Map<String, Double> out = GSON.fromJson(el, DOUBLE_MAP);
            if (out == null) return new LinkedHashMap<>();
            if (out.containsValue(null)) {
                throw new ContentIntegrityException(List.of(where + ": null value"));
            }
            return out;
        } catch (JsonParseException e) {
            throw new ContentIntegrityException(where + ": expected an object of numbers", e);
        }
    }
}
