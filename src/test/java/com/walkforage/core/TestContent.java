package com.walkforage.core;

import com.walkforage.core.content.GameContent;
import com.walkforage.core.domain.crafting.Craftable;
import com.walkforage.core.domain.crafting.CraftableKind;
import com.walkforage.core.domain.crafting.ItemRequirement;
import com.walkforage.core.domain.crafting.QualityWeights;
import com.walkforage.core.domain.resources.*;
import com.walkforage.core.domain.tech.ResourceCost;
import com.walkforage.core.domain.tech.Technology;
import com.walkforage.core.managers.CraftingManager;
import com.walkforage.core.managers.QualityScorer;
import com.walkforage.core.managers.TechManager;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Small in-code content used across the unit tests.
 *
 * Techs: basic_knapping (10 stone + 5 food) -> grinding (15 stone), hafting (5 stone + 5 wood).
 * Craftables: hammerstone, hand_axe (needs hammerstone, toolstone), crude_handle,
 * stone_knife (hammerstone + crude_handle, toolstone + wood).
 */
public final class TestContent {

    public static final Map<String, Double> STANDARD_WEIGHTS =
            Map.of("hardness", 0.5, "workability", 0.3, "durability", 0.2);

    private TestContent() {}

    public static ResourceTypeRegistry registry() {
        List<PropertyDefinition> schema = List.of(
                PropertyDefinition.of("hardness"),
                PropertyDefinition.of("workability"),
                PropertyDefinition.of("durability"));
        Map<String, Double> defaults = Map.of("hardness", 0.33, "workability", 0.34, "durability", 0.33);

        return new ResourceTypeRegistry(List.of(
                new ResourceType("stone", "Stone", "Stones", "🪨", schema, defaults, Set.of("toolstone")),
                new ResourceType("wood", "Wood", "Woods", "🪵", schema, defaults, Set.of()),
                new ResourceType("food", "Food", "Foods", "🍎", List.of(), Map.of(), Set.of())
        ));
    }

    public static MaterialCatalog catalog() {
        return new MaterialCatalog(List.of(
                stone("granite", 7, 3, 9, false),
                stone("basalt", 8, 2, 9, false),
                stone("flint", 7, 8, 6, true),
                stone("obsidian", 6, 7, 4, true),
                stone("test_stone", 6.4, 2.8, 8.2, false),
                wood("oak", 7, 4, 9),
                wood("test_wood", 4.6, 9.1, 3.7),
                food("hazelnut"),
                food("blackberry")
        ));
    }

    public static List<Technology> technologies() {
        return List.of(
                new Technology("basic_knapping", "Basic Knapping", "lower_paleolithic", "",
                        List.of(),
                        List.of(new ResourceCost("stone", 10), new ResourceCost("food", 5)),
                        List.of("grinding", "hafting"),
                        List.of("hammerstone", "hand_axe")),
                new Technology("grinding", "Grinding", "lower_paleolithic", "",
                        List.of("basic_knapping"),
                        List.of(new ResourceCost("stone", 15)),
                        List.of(),
                        List.of()),
                new Technology("hafting", "Hafting", "middle_paleolithic", "",
                        List.of("basic_knapping"),
                        List.of(new ResourceCost("stone", 5), new ResourceCost("wood", 5)),
                        List.of(),
                        List.of("crude_handle", "stone_knife"))
        );
    }

    public static List<Craftable> craftables() {
        QualityWeights standard = QualityWeights.of(STANDARD_WEIGHTS);
        return List.of(
                new Craftable("hammerstone", "Hammerstone", CraftableKind.TOOL, "knapping", "lower_paleolithic",
                        "basic_knapping", List.of(), List.of(),
                        List.of(new ResourceCost("stone", 10)), standard),
                new Craftable("hand_axe", "Hand Axe", CraftableKind.TOOL, "woodworking", "lower_paleolithic",
                        "basic_knapping", List.of(ItemRequirement.one("hammerstone")), List.of(),
                        List.of(new ResourceCost("stone", 5, "toolstone")), standard),
                new Craftable("crude_handle", "Crude Handle", CraftableKind.COMPONENT, "handle", "lower_paleolithic",
                        "hafting", List.of(), List.of(),
                        List.of(new ResourceCost("wood", 5)), standard),
                new Craftable("stone_knife", "Stone Knife", CraftableKind.TOOL, "cutting", "middle_paleolithic",
                        "hafting", List.of(ItemRequirement.one("hammerstone")), List.of(ItemRequirement.one("crude_handle")),
                        List.of(new ResourceCost("stone", 3, "toolstone"), new ResourceCost("wood", 2)), standard)
        );
    }

    public static GameContent content() {
        ResourceTypeRegistry registry = registry();
        MaterialCatalog catalog = catalog();
        return new GameContent(registry, catalog,
                TechManager.buildGraph(technologies()),
                CraftingManager.buildGraph(craftables()),
                new QualityScorer(registry, catalog));
    }

    private static Material stone(String id, double h, double w, double d, boolean toolstone) {
        return new Material(id, null, "stone", "test", "", 0.3, axes(h, w, d),
                toolstone ? Set.of("toolstone") : Set.of());
    }

    private static Material wood(String id, double h, double w, double d) {
        return new Material(id, null, "wood", "test", "", 0.3, axes(h, w, d), Set.of());
    }

    private static Material food(String id) {
        return new Material(id, null, "food", "test", "", 0.5, Map.of(), Set.of());
    }

    private static Map<String, Double> axes(double h, double w, double d) {
        return Map.of("hardness", h, "workability", w, "durability", d);
    }
}
