package com.walkforage.core.managers;

import com.walkforage.core.domain.crafting.Craftable;
import com.walkforage.core.domain.crafting.CraftableKind;
import com.walkforage.core.domain.crafting.ItemRequirement;
import com.walkforage.core.domain.crafting.QualityWeights;
import com.walkforage.core.domain.resources.Material;
import com.walkforage.core.domain.resources.MaterialCatalog;
import com.walkforage.core.domain.resources.PropertyDefinition;
import com.walkforage.core.domain.resources.ResourceType;
import com.walkforage.core.domain.resources.ResourceTypeRegistry;
import com.walkforage.core.domain.tech.ResourceCost;
import com.walkforage.core.domain.tech.Technology;
import com.walkforage.core.graph.DependencyGraph;

import java.util.*;

/**
 * Cross-table checks on the static content. Run once at load time; nothing here is on a hot path.
 */
public class ContentIntegrityValidator {

    private static final int MAX_PRINTED = 100;

    private final ResourceTypeRegistry registry;
    private final MaterialCatalog catalog;
    private final DependencyGraph<Technology> techGraph;
    private final DependencyGraph<Craftable> craftableGraph;

    public ContentIntegrityValidator(ResourceTypeRegistry registry,
                                     MaterialCatalog catalog,
                                     DependencyGraph<Technology> techGraph,
                                     DependencyGraph<Craftable> craftableGraph) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.techGraph = Objects.requireNonNull(techGraph, "techGraph");
        this.craftableGraph = Objects.requireNonNull(craftableGraph, "craftableGraph");
    }

    public IntegrityReport validate() {
        IntegrityReport report = new IntegrityReport();

        checkResourceTypes(report);
        checkMaterials(report);
        checkTechnologies(report);
        checkCraftables(report);
        checkGraph(techGraph, report);
        checkGraph(craftableGraph, report);

        return report;
    }

    /** Validates and prints warnings, then either the violations or a one-line summary. */
    public IntegrityReport validateAndPrint() {
        System.out.println("🔍 [Integrity] Validating content...");
        IntegrityReport report = validate();

        printWarnings(report.getWarnings());
        if (report.isValid()) {
            System.out.println("✅ [Integrity] Content verified: " + techGraph.size() + " technologies, "
                    + craftableGraph.size() + " craftables, " + catalog.getAll().size() + " materials.");
        } else {
            printErrors(report.getErrors());
        }
        return report;
    }

    // ===== RESOURCE TYPES & MATERIALS =====

    private void checkResourceTypes(IntegrityReport report) {
        for (ResourceType t : registry.getAll()) {
            Map<String, Double> w = t.defaultQualityWeights();
            if (!w.isEmpty()) checkWeightBlock("resource type " + t.id() + " default weights", t, w, report);
        }
    }

    private void checkMaterials(IntegrityReport report) {
        for (String type : catalog.getResourceTypes()) {
            ResourceType rt = registry.get(type);
            if (rt == null) {
                report.error("Materials declared for unknown resource type '" + type + "'");
                continue;
            }
            for (Material m : catalog.getAll(type)) {
                String where = "Material " + type + "/" + m.id();
                if (!(m.rarity() >= 0.0 && m.rarity() <= 1.0)) {
                    report.error(where + ": rarity " + m.rarity() + " outside [0,1]");
                }
                for (PropertyDefinition p : rt.propertySchema()) {
                    Double v = m.getProperty(p.id());
                    if (v == null) {
                        report.error(where + ": missing property '" + p.id() + "'");
                    } else if (!p.inRange(v)) {
                        report.error(where + ": property '" + p.id() + "'=" + v
                                + " outside [" + p.minValue() + "," + p.maxValue() + "]");
                    }
                }
                for (String prop : m.properties().keySet()) {
                    if (!rt.hasProperty(prop)) report.error(where + ": unknown property '" + prop + "'");
                }
                for (String flag : m.flags()) {
                    if (!rt.supportsFlag(flag)) report.error(where + ": flag '" + flag + "' not supported by " + type);
                }
            }
        }
    }

    // ===== TECHNOLOGIES =====

    private void checkTechnologies(IntegrityReport report) {
        for (Technology t : techGraph.getAll()) {
            String where = "Technology " + t.id();

            for (String p : t.prerequisites()) {
                Technology pre = techGraph.get(p);
                if (pre == null) {
                    report.error(where + ": unknown prerequisite '" + p + "'");
                } else if (!pre.unlocks().contains(t.id())) {
                    report.warn(where + ": prerequisite " + p + " does not list it in unlocks");
                }
            }
            for (String u : t.unlocks()) {
                Technology next = techGraph.get(u);
                if (next == null) {
                    report.error(where + ": unlocks unknown technology '" + u + "'");
                } else if (!next.prerequisites().contains(t.id())) {
                    report.warn(where + ": unlocks " + u + " which does not require it");
                }
            }
            for (String r : t.enablesRecipes()) {
                if (!craftableGraph.contains(r)) report.error(where + ": enables unknown recipe '" + r + "'");
            }
            if (t.unlocks().isEmpty() && t.enablesRecipes().isEmpty()) {
                report.warn(where + " unlocks nothing and enables no recipe");
            }
            checkCosts(where, t.resourceCost(), report);
        }
    }

    // ===== CRAFTABLES =====

    private void checkCraftables(IntegrityReport report) {
        Set<String> enabledByTech = new HashSet<>();
        for (Technology t : techGraph.getAll()) enabledByTech.addAll(t.enablesRecipes());

        Set<String> requiredSomewhere = new HashSet<>();
        for (Craftable c : craftableGraph.getAll()) requiredSomewhere.addAll(c.requirementIds());

        for (Craftable c : craftableGraph.getAll()) {
            String where = "Craftable " + c.id();

            if (c.requiredTech() != null && !techGraph.contains(c.requiredTech())) {
                report.error(where + ": requires unknown technology '" + c.requiredTech() + "'");
            }
            checkRequirements(where, "tool", c.requiredTools(), CraftableKind.TOOL, report);
            checkRequirements(where, "component", c.requiredComponents(), CraftableKind.COMPONENT, report);
            checkCosts(where, c.materials(), report);

            for (var e : c.qualityWeights().declaredBlocks().entrySet()) {
                String block = e.getKey();
                ResourceType scope = "common".equals(block) ? null : registry.get(block);
                if (!"common".equals(block) && scope == null) {
                    report.error(where + ": quality weights for unknown resource type '" + block + "'");
                    continue;
                }
                checkWeightBlock(where + " weights[" + block + "]", scope, e.getValue(), report);
            }

            if (c.kind() == CraftableKind.COMPONENT && !requiredSomewhere.contains(c.id())) {
                report.warn(where + ": component is never required by any recipe");
            }
            if (!enabledByTech.contains(c.id())) {
                report.warn(where + ": no technology lists it in enablesRecipes");
            }
        }
    }

    private void checkRequirements(String where, String label, List<ItemRequirement> reqs,
                                   CraftableKind expected, IntegrityReport report) {
        for (ItemRequirement r : reqs) {
            Craftable target = craftableGraph.get(r.itemId());
            if (target == null) {
                report.error(where + ": unknown required " + label + " '" + r.itemId() + "'");
            } else if (target.kind() != expected) {
                report.error(where + ": required " + label + " '" + r.itemId() + "' is a " + target.kind());
            }
        }
    }

    private void checkCosts(String where, List<ResourceCost> costs, IntegrityReport report) {
        for (ResourceCost c : costs) {
            ResourceType rt = registry.get(c.resourceType());
            if (rt == null) {
                report.error(where + ": cost in unknown resource type '" + c.resourceType() + "'");
                continue;
            }
            if (c.quantity() <= 0) {
                report.error(where + ": non-positive " + c.resourceType() + " cost " + c.quantity());
            }
            if (c.isFlagged() && !rt.supportsFlag(c.requiredFlag())) {
                report.error(where + ": flag '" + c.requiredFlag() + "' not supported by " + c.resourceType());
            }
        }
    }

    /**
     * @param scope the resource type the block applies to, null for a common block (axes of any type)
     */
    private void checkWeightBlock(String where, ResourceType scope, Map<String, Double> weights, IntegrityReport report) {
        for (var e : weights.entrySet()) {
            Double w = e.getValue();
            if (w == null || w < 0.0 || Double.isNaN(w)) {
                report.error(where + ": invalid weight " + w + " for '" + e.getKey() + "'");
            }
            if (!isKnownAxis(scope, e.getKey())) {
                report.error(where + ": unknown property axis '" + e.getKey() + "'");
            }
        }
        double sum = QualityWeights.sum(weights);
        if (Math.abs(sum - 1.0) > QualityWeights.SUM_TOLERANCE) {
            report.error(where + ": weights sum to " + sum + ", expected 1.0");
        }
    }

    private boolean isKnownAxis(ResourceType scope, String axis) {
        if (scope != null) return scope.hasProperty(axis);
        for (ResourceType t : registry.getAll()) {
            if (t.hasProperty(axis)) return true;
        }
        return false;
    }

    // ===== GRAPH SHAPE =====

    private void checkGraph(DependencyGraph<?> graph, IntegrityReport report) {
        List<String> cycle = graph.validateAcyclic();
        if (!cycle.isEmpty()) {
            report.error("Cycle in " + graph.getLabel() + " graph: " + String.join(", ", cycle));
        }
        if (graph.size() > 0 && graph.getRoots().isEmpty()) {
            report.error("The " + graph.getLabel() + " graph has no root (every node has prerequisites)");
        }
    }

    private void printWarnings(List<String> warnings) {
        for (String w : warnings) System.out.println("⚠️ [Integrity] " + w);
    }

    private void printErrors(List<String> errorLog) {
        if (errorLog.size() > MAX_PRINTED) {
            System.err.println("🚨 [Integrity] " + errorLog.size() + " content violations (too many to list)");
            for (String s : errorLog.subList(0, MAX_PRINTED)) System.err.println("❌ " + s);
        } else {
            System.err.println("🚨 [Integrity] CONTENT VIOLATIONS:");
            for (String s : errorLog) System.err.println("❌ " + s);
        }
    }
}
