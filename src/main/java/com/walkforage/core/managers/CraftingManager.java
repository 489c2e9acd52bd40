package com.walkforage.core.managers;

import com.walkforage.core.domain.crafting.Craftable;
import com.walkforage.core.domain.crafting.CraftableKind;
import com.walkforage.core.domain.crafting.ItemRequirement;
import com.walkforage.core.domain.crafting.OwnedItem;
import com.walkforage.core.domain.inventory.Inventory;
import com.walkforage.core.domain.inventory.ResourceStack;
import com.walkforage.core.domain.inventory.Selection;
import com.walkforage.core.domain.resources.Material;
import com.walkforage.core.domain.resources.MaterialCatalog;
import com.walkforage.core.domain.session.GameSession;
import com.walkforage.core.domain.tech.ResourceCost;
import com.walkforage.core.graph.DependencyGraph;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tool and component recipes: requirement queries over the craftable graph, and the craft
 * operation itself (validate tech, tools, components and materials, then pay and hand out the item).
 */
public class CraftingManager {

    private final DependencyGraph<Craftable> graph;
    private final ConsumptionEngine engine;
    private final QualityScorer scorer;
    private final MaterialCatalog catalog;
    private final Function<String, String> instanceIds;

    public CraftingManager(DependencyGraph<Craftable> graph,
                           ConsumptionEngine engine,
                           QualityScorer scorer,
                           MaterialCatalog catalog) {
        this(graph, engine, scorer, catalog, itemId -> itemId + "_" + UUID.randomUUID());
    }

    /**
     * @param instanceIds builds a fresh instance id from a craftable id
     */
    public CraftingManager(DependencyGraph<Craftable> graph,
                           ConsumptionEngine engine,
                           QualityScorer scorer,
                           MaterialCatalog catalog,
                           Function<String, String> instanceIds) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.instanceIds = Objects.requireNonNull(instanceIds, "instanceIds");
    }

    public static DependencyGraph<Craftable> buildGraph(Collection<Craftable> craftables) {
        return new DependencyGraph<>("craftable", craftables, Craftable::id, Craftable::requirementIds);
    }

    public DependencyGraph<Craftable> getGraph() {
        return graph;
    }

    public Craftable getCraftable(String id) {
        return graph.get(id);
    }

    public List<Craftable> getTools() {
        return graph.getAll().stream().filter(Craftable::isTool).collect(Collectors.toList());
    }

    public List<Craftable> getComponents() {
        return graph.getAll().stream().filter(c -> !c.isTool()).collect(Collectors.toList());
    }

    // ==========================================================
    // REQUIREMENT QUERIES
    // ==========================================================

    /** @return null for an id that is not a tool or component */
    public Boolean isAvailable(String craftableId, Set<String> ownedItemIds) {
        return graph.isAvailable(craftableId, ownedItemIds);
    }

    public List<Craftable> getAvailableCraftables(Set<String> ownedItemIds) {
        return graph.availableNodes(ownedItemIds);
    }

    public List<String> missingRequirements(String craftableId, Set<String> ownedItemIds) {
        return graph.missingPrerequisites(craftableId, ownedItemIds);
    }

    public List<String> transitiveClosure(String craftableId) {
        return graph.transitiveClosure(craftableId);
    }

    /** True if some other recipe needs this tool to be crafted. */
    public boolean isCraftingTool(String toolId) {
        if (toolId == null) return false;
        for (Craftable c : graph.getAll()) {
            for (ItemRequirement r : c.requiredTools()) {
                if (toolId.equals(r.itemId())) return true;
            }
        }
        return false;
    }

    /**
     * Advisory check for the crafting screen. Counts only stacks that satisfy each slot's flag.
     *
     * @return null for an unknown craftable
     */
    public CraftCheck canCraft(String craftableId, GameSession session) {
        Craftable c = graph.get(craftableId);
        if (c == null || session == null) return null;

        String missingTech = (c.requiredTech() != null && !session.hasTech(c.requiredTech()))
                ? c.requiredTech() : null;

        List<ItemShortfall> missingTools = new ArrayList<>();
        for (ItemRequirement r : c.requiredTools()) {
            int have = session.countOwned(r.itemId());
            if (have < r.quantity()) missingTools.add(new ItemShortfall(r.itemId(), have, r.quantity()));
        }

        List<ItemShortfall> missingComponents = new ArrayList<>();
        List<String> suggested = new ArrayList<>();
        for (ItemRequirement r : c.requiredComponents()) {
            List<OwnedItem> owned = session.getOwnedComponentsOf(r.itemId());
            if (owned.size() < r.quantity()) {
                missingComponents.add(new ItemShortfall(r.itemId(), owned.size(), r.quantity()));
            } else {
                for (int i = 0; i < r.quantity(); i++) suggested.add(owned.get(i).instanceId());
            }
        }

        Map<String, List<String>> eligible = new LinkedHashMap<>();
        List<ResourceShortfall> missingResources = new ArrayList<>();
        for (var e : groupCosts(c.materials()).entrySet()) {
            String type = e.getKey();
            Set<String> flags = e.getValue().flags;
            Inventory inv = session.getInventory();

            List<String> ids = new ArrayList<>();
            int total = 0;
            for (ResourceStack s : inv.stacks(type)) {
                if (!satisfies(type, s.materialId(), flags)) continue;
                ids.add(s.materialId());
                total += s.quantity();
            }
            eligible.put(type, ids);
            if (total < e.getValue().quantity) {
                missingResources.add(new ResourceShortfall(type, total, e.getValue().quantity));
            }
        }

        boolean ok = missingTech == null && missingTools.isEmpty()
                && missingComponents.isEmpty() && missingResources.isEmpty();
        return new CraftCheck(craftableId, ok, missingTech, missingTools, missingComponents,
                missingResources, eligible, suggested);
    }

    // ==========================================================
    // CRAFT
    // ==========================================================

    /**
     * Crafts one instance. Tools are required but not consumed; selected component instances and
     * the selected materials are consumed. Nothing changes unless every check passes.
     *
     * @param componentInstanceIds owned component instances to use, exactly matching the recipe
     */
    public CraftResult craft(GameSession session,
                             String craftableId,
                             Selection selection,
                             Collection<String> componentInstanceIds) {
        Objects.requireNonNull(session, "session");

        Craftable c = graph.get(craftableId);
        if (c == null) return CraftResult.failed(SpendFailure.unknownTarget(craftableId));

        if (c.requiredTech() != null && !session.hasTech(c.requiredTech())) {
            return CraftResult.failed(SpendFailure.missingPrerequisites(List.of(c.requiredTech())));
        }

        List<String> missingTools = new ArrayList<>();
        for (ItemRequirement r : c.requiredTools()) {
            if (session.countOwned(r.itemId()) < r.quantity()) missingTools.add(r.itemId());
        }
        if (!missingTools.isEmpty()) return CraftResult.failed(SpendFailure.missingTools(missingTools));

        List<String> selectedComponents = (componentInstanceIds != null)
                ? new ArrayList<>(componentInstanceIds) : List.of();
        SpendFailure componentError = validateComponents(c, selectedComponents, session);
        if (componentError != null) return CraftResult.failed(componentError);

        SpendResult paid = engine.attemptSpend(c.id(), c.materials(), selection, session.getInventory());
        if (!paid.success()) return CraftResult.failed(paid.failure());

        Selection used = (selection != null) ? selection : Selection.empty();
        double quality = scorer.score(c, used);

        session.removeComponents(selectedComponents);
        OwnedItem item = new OwnedItem(instanceIds.apply(c.id()), c.id(), c.kind(), used, quality, scorer.tier(quality));
        session.addOwned(item);
        return CraftResult.ok(item);
    }

    // --- HELPER ---

    private SpendFailure validateComponents(Craftable c, List<String> selected, GameSession session) {
        Map<String, Integer> required = new LinkedHashMap<>();
        for (ItemRequirement r : c.requiredComponents()) required.merge(r.itemId(), r.quantity(), Integer::sum);

        if (required.isEmpty()) {
            return selected.isEmpty() ? null : SpendFailure.wrongComponents(selected);
        }
        if (selected.isEmpty()) {
            return SpendFailure.noComponentSelection(new ArrayList<>(required.keySet()));
        }

        List<String> badInstances = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Map<String, Integer> counted = new HashMap<>();
        for (String instanceId : selected) {
            OwnedItem owned = session.findOwned(instanceId);
            if (!seen.add(instanceId) || owned == null || owned.kind() != CraftableKind.COMPONENT
                    || !required.containsKey(owned.itemId())) {
                badInstances.add(instanceId);
                continue;
            }
            counted.merge(owned.itemId(), 1, Integer::sum);
        }
        if (!badInstances.isEmpty()) return SpendFailure.wrongComponents(badInstances);

        // instance ids are all valid, only the per-component counts can still be off
        for (var e : required.entrySet()) {
            int have = counted.getOrDefault(e.getKey(), 0);
            if (have != e.getValue()) return SpendFailure.wrongComponentCount(e.getKey(), have, e.getValue());
        }
        return null;
    }

    private boolean satisfies(String type, String materialId, Set<String> flags) {
        if (flags.isEmpty()) return true;
        Material m = catalog.get(type, materialId);
        if (m == null) return false;
        for (String f : flags) {
            if (!m.hasFlag(f)) return false;
        }
        return true;
    }

    private static Map<String, SlotCost> groupCosts(List<ResourceCost> costs) {
        Map<String, SlotCost> out = new LinkedHashMap<>();
        for (ResourceCost rc : costs) {
            SlotCost s = out.computeIfAbsent(rc.resourceType(), k -> new SlotCost());
            s.quantity += rc.quantity();
            if (rc.isFlagged()) s.flags.add(rc.requiredFlag());
        }
        return out;
    }

    private static final class SlotCost {
        int quantity;
        final Set<String> flags = new LinkedHashSet<>();
    }
}
