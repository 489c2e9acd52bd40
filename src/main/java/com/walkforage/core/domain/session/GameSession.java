package com.walkforage.core.domain.session;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.walkforage.core.domain.crafting.CraftableKind;
import com.walkforage.core.domain.crafting.OwnedItem;
import com.walkforage.core.domain.crafting.QualityTier;
import com.walkforage.core.domain.inventory.Inventory;
import com.walkforage.core.domain.inventory.Selection;
import com.walkforage.core.domain.resources.ResourceTypeRegistry;

import java.util.*;

/**
 * Session-scoped player state: inventory, unlocked technologies and crafted items.
 * Created empty, grown only through TechManager / CraftingManager. Not thread-safe:
 * concurrent callers go through {@code SessionCommandQueue}.
 */
public class GameSession {

    private final UUID sessionId;
    private final Inventory inventory;
    private final Set<String> unlockedTechs = new LinkedHashSet<>();
    private final List<OwnedItem> ownedTools = new ArrayList<>();
    private final List<OwnedItem> ownedComponents = new ArrayList<>();

    public GameSession(UUID sessionId, ResourceTypeRegistry registry) {
        this(sessionId, new Inventory(registry));
    }

    public GameSession(UUID sessionId, Inventory inventory) {
        this.sessionId = (sessionId != null) ? sessionId : UUID.randomUUID();
        this.inventory = Objects.requireNonNull(inventory, "inventory");
    }

    public UUID getSessionId() { return sessionId; }

    public Inventory getInventory() { return inventory; }

    // --- TECH ---

    public Set<String> getUnlockedTechs() {
        return Collections.unmodifiableSet(unlockedTechs);
    }

    public boolean hasTech(String techId) {
        if (techId == null || techId.isBlank()) return false;
        return unlockedTechs.contains(techId);
    }

    public void addTech(String techId) {
        if (techId == null || techId.isBlank()) return;
        unlockedTechs.add(techId);
    }

    // --- OWNED ITEMS ---

    public List<OwnedItem> getOwnedTools() {
        return Collections.unmodifiableList(ownedTools);
    }

    public List<OwnedItem> getOwnedComponents() {
        return Collections.unmodifiableList(ownedComponents);
    }

    /**
     * Definition ids of every tool and component held, in acquisition order.
     * This is the "owned set" the craftable dependency graph is queried against.
     */
    public Set<String> getOwnedItemIds() {
        Set<String> out = new LinkedHashSet<>();
        for (OwnedItem t : ownedTools) out.add(t.itemId());
        for (OwnedItem c : ownedComponents) out.add(c.itemId());
        return out;
    }

    public int countOwned(String itemId) {
        if (itemId == null) return 0;
        int n = 0;
        for (OwnedItem t : ownedTools) if (itemId.equals(t.itemId())) n++;
        for (OwnedItem c : ownedComponents) if (itemId.equals(c.itemId())) n++;
        return n;
    }

    public OwnedItem findOwned(String instanceId) {
        if (instanceId == null) return null;
        for (OwnedItem t : ownedTools) if (instanceId.equals(t.instanceId())) return t;
        for (OwnedItem c : ownedComponents) if (instanceId.equals(c.instanceId())) return c;
        return null;
    }

    public List<OwnedItem> getOwnedComponentsOf(String componentId) {
        List<OwnedItem> out = new ArrayList<>();
        for (OwnedItem c : ownedComponents) {
            if (c.itemId().equals(componentId)) out.add(c);
        }
        return out;
    }

    public void addOwned(OwnedItem item) {
        if (item == null) return;
        if (item.kind() == CraftableKind.TOOL) ownedTools.add(item);
        else ownedComponents.add(item);
    }

    /**
     * Removes component instances by instance id; unknown ids are ignored.
     */
    public void removeComponents(Collection<String> instanceIds) {
        if (instanceIds == null || instanceIds.isEmpty()) return;
        Set<String> ids = new HashSet<>(instanceIds);
        ownedComponents.removeIf(c -> ids.contains(c.instanceId()));
    }

    // --- SERIALIZZAZIONE ---

    public JsonObject serialize() {
        JsonObject json = new JsonObject();
        json.addProperty("sessionId", sessionId.toString());
        json.add("inventory", inventory.serialize());

        JsonArray techs = new JsonArray();
        unlockedTechs.forEach(techs::add);
        json.add("unlockedTechs", techs);

        JsonArray items = new JsonArray();
        for (OwnedItem t : ownedTools) items.add(serializeItem(t));
        for (OwnedItem c : ownedComponents) items.add(serializeItem(c));
        json.add("ownedItems", items);
        return json;
    }

    public static GameSession fromSerialized(JsonObject json, ResourceTypeRegistry registry) {
        if (json == null) return new GameSession(null, registry);

        UUID id = null;
        if (json.has("sessionId")) {
            try {
                id = UUID.fromString(json.get("sessionId").getAsString());
            } catch (IllegalArgumentException e) {
                System.err.println("⚠️ [GameSession] Invalid sessionId in snapshot, generating a new one: " + e.getMessage());
            }
        }

        JsonObject inv = json.has("inventory") && json.get("inventory").isJsonObject()
                ? json.getAsJsonObject("inventory") : null;
        GameSession session = new GameSession(id, Inventory.fromSerialized(inv, registry));

        if (json.has("unlockedTechs") && json.get("unlockedTechs").isJsonArray()) {
            for (JsonElement el : json.getAsJsonArray("unlockedTechs")) {
                if (el != null && !el.isJsonNull()) session.addTech(el.getAsString());
            }
        }

        if (json.has("ownedItems") && json.get("ownedItems").isJsonArray()) {
            for (JsonElement el : json.getAsJsonArray("ownedItems")) {
                if (el == null || !el.isJsonObject()) continue;
                session.addOwned(deserializeItem(el.getAsJsonObject()));
            }
        }
        return session;
    }

    private static JsonObject serializeItem(OwnedItem item) {
        JsonObject obj = new JsonObject();
        obj.addProperty("instanceId", item.instanceId());
        obj.addProperty("itemId", item.itemId());
        obj.addProperty("kind", item.kind().name());
        obj.addProperty("quality", item.quality());
        obj.addProperty("tier", item.tier().name());

        JsonObject used = new JsonObject();
        Selection sel = item.usedMaterials();
        for (String type : sel.getResourceTypes()) {
            JsonArray arr = new JsonArray();
            for (Selection.Entry e : sel.getEntries(type)) {
                JsonObject entry = new JsonObject();
                entry.addProperty("materialId", e.materialId());
                entry.addProperty("quantity", e.quantity());
                arr.add(entry);
            }
            used.add(type, arr);
        }
        obj.add("usedMaterials", used);
        return obj;
    }

    private static OwnedItem deserializeItem(JsonObject obj) {
        Selection.Builder used = Selection.builder();
        if (obj.has("usedMaterials") && obj.get("usedMaterials").isJsonObject()) {
            JsonObject u = obj.getAsJsonObject("usedMaterials");
            for (String type : u.keySet()) {
                for (JsonElement el : u.getAsJsonArray(type)) {
                    JsonObject e = el.getAsJsonObject();
                    used.add(type, e.get("materialId").getAsString(), e.get("quantity").getAsInt());
                }
            }
        }
        return new OwnedItem(
                obj.get("instanceId").getAsString(),
                obj.get("itemId").getAsString(),
                CraftableKind.valueOf(obj.get("kind").getAsString()),
                used.build(),
                obj.has("quality") ? obj.get("quality").getAsDouble() : 0.0,
                obj.has("tier") ? QualityTier.valueOf(obj.get("tier").getAsString()) : QualityTier.POOR
        );
    }

    @Override
    public String toString() {
        return "GameSession(" + sessionId.toString().substring(0, 8) + ")";
    }
}
