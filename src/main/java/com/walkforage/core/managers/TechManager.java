package com.walkforage.core.managers;

import com.walkforage.core.domain.inventory.Inventory;
import com.walkforage.core.domain.inventory.Selection;
import com.walkforage.core.domain.session.GameSession;
import com.walkforage.core.domain.tech.ResourceCost;
import com.walkforage.core.domain.tech.Technology;
import com.walkforage.core.graph.DependencyGraph;

import java.util.*;
import java.util.stream.Collectors;

public class TechManager {

    private final DependencyGraph<Technology> graph;
    private final ConsumptionEngine engine;

    public TechManager(DependencyGraph<Technology> graph, ConsumptionEngine engine) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public static DependencyGraph<Technology> buildGraph(Collection<Technology> technologies) {
        return new DependencyGraph<>("tech", technologies, Technology::id, Technology::prerequisites);
    }

    public DependencyGraph<Technology> getGraph() {
        return graph;
    }

    public Collection<Technology> getAllNodes() {
        return graph.getAll();
    }

    public Technology getNode(String id) {
        return graph.get(id);
    }

    public List<Technology> getTechsByEra(String era) {
        if (era == null) return List.of();
        return graph.getAll().stream()
                .filter(t -> era.equals(t.era()))
                .collect(Collectors.toList());
    }

    // ==========================================================
    // PREREQUISITE QUERIES
    // ==========================================================

    /** @return null for an unknown technology */
    public Boolean isAvailable(String techId, Set<String> unlocked) {
        return graph.isAvailable(techId, unlocked);
    }

    public List<Technology> getAvailableTechs(Set<String> unlocked) {
        return graph.availableNodes(unlocked);
    }

    public List<String> missingPrerequisites(String techId, Set<String> unlocked) {
        return graph.missingPrerequisites(techId, unlocked);
    }

    public List<String> transitiveClosure(String techId) {
        return graph.transitiveClosure(techId);
    }

    public int getTechResourceCost(String techId, String resourceType) {
        Technology t = graph.get(techId);
        return (t != null) ? t.costFor(resourceType) : 0;
    }

    /**
     * Advisory check for the unlock screen: prerequisites plus per-type inventory totals.
     *
     * @return null for an unknown technology
     */
    public AvailabilityCheck checkAvailability(String techId, Set<String> unlocked, Inventory inventory) {
        Technology node = graph.get(techId);
        if (node == null) return null;

        Set<String> have = (unlocked != null) ? unlocked : Set.of();
        boolean already = have.contains(techId);
        List<String> missingPrereqs = graph.missingPrerequisites(techId, have);

        Map<String, Integer> neededByType = new LinkedHashMap<>();
        for (ResourceCost c : node.resourceCost()) {
            neededByType.merge(c.resourceType(), c.quantity(), Integer::sum);
        }

        List<ResourceShortfall> missingResources = new ArrayList<>();
        for (var e : neededByType.entrySet()) {
            int total = (inventory != null) ? inventory.getTotal(e.getKey()) : 0;
            if (total < e.getValue()) {
                missingResources.add(new ResourceShortfall(e.getKey(), total, e.getValue()));
            }
        }

        boolean ok = !already && missingPrereqs.isEmpty() && missingResources.isEmpty();
        return new AvailabilityCheck(techId, ok, already, missingPrereqs, missingResources);
    }

    public AvailabilityCheck checkAvailability(String techId, GameSession session) {
        if (session == null) return checkAvailability(techId, Set.of(), null);
        return checkAvailability(techId, session.getUnlockedTechs(), session.getInventory());
    }

    // ==========================================================
    // UNLOCK
    // ==========================================================

    /**
     * Pays for and unlocks a technology. On any failure the session is left exactly as it was.
     */
    public SpendResult unlockNode(GameSession session, String techId, Selection selection) {
        Objects.requireNonNull(session, "session");
        Inventory inventory = session.getInventory();

        Technology node = graph.get(techId);
        if (node == null) return SpendResult.failed(inventory, SpendFailure.unknownTarget(techId));

        if (session.hasTech(techId)) {
            return SpendResult.failed(inventory, SpendFailure.alreadyUnlocked(techId));
        }

        List<String> missing = graph.missingPrerequisites(techId, session.getUnlockedTechs());
        if (!missing.isEmpty()) {
            return SpendResult.failed(inventory, SpendFailure.missingPrerequisites(missing));
        }

        SpendResult paid = engine.attemptSpend(techId, node.resourceCost(), selection, inventory);
        if (!paid.success()) return paid;

        session.addTech(techId);
        return paid;
    }
}
