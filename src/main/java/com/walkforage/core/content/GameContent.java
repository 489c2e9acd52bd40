package com.walkforage.core.content;

import com.walkforage.core.domain.crafting.Craftable;
import com.walkforage.core.domain.resources.MaterialCatalog;
import com.walkforage.core.domain.resources.ResourceTypeRegistry;
import com.walkforage.core.domain.session.GameSession;
import com.walkforage.core.domain.tech.Technology;
import com.walkforage.core.graph.DependencyGraph;
import com.walkforage.core.managers.ConsumptionEngine;
import com.walkforage.core.managers.ContentIntegrityValidator;
import com.walkforage.core.managers.CraftingManager;
import com.walkforage.core.managers.QualityScorer;
import com.walkforage.core.managers.TechManager;

import java.util.Objects;
import java.util.UUID;

/**
 * Static content loaded once at startup, plus the managers wired on top of it.
 * Immutable after construction and safe to share between sessions.
 */
public final class GameContent {

    private final ResourceTypeRegistry registry;
    private final MaterialCatalog catalog;
    private final DependencyGraph<Technology> techGraph;
    private final DependencyGraph<Craftable> craftableGraph;

    private final ConsumptionEngine consumptionEngine;
    private final QualityScorer qualityScorer;
    private final TechManager techManager;
    private final CraftingManager craftingManager;

    public GameContent(ResourceTypeRegistry registry,
                       MaterialCatalog catalog,
                       DependencyGraph<Technology> techGraph,
                       DependencyGraph<Craftable> craftableGraph) {
        this(registry, catalog, techGraph, craftableGraph, QualityScorer.fromConfig(registry, catalog));
    }

    public GameContent(ResourceTypeRegistry registry,
                       MaterialCatalog catalog,
                       DependencyGraph<Technology> techGraph,
                       DependencyGraph<Craftable> craftableGraph,
                       QualityScorer qualityScorer) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.techGraph = Objects.requireNonNull(techGraph, "techGraph");
        this.craftableGraph = Objects.requireNonNull(craftableGraph, "craftableGraph");
        this.qualityScorer = Objects.requireNonNull(qualityScorer, "qualityScorer");

        this.consumptionEngine = new ConsumptionEngine(catalog);
        this.techManager = new TechManager(techGraph, consumptionEngine);
        this.craftingManager = new CraftingManager(craftableGraph, consumptionEngine, qualityScorer, catalog);
    }

    public ResourceTypeRegistry getRegistry() { return registry; }
    public MaterialCatalog getCatalog() { return catalog; }
    public DependencyGraph<Technology> getTechGraph() { return techGraph; }
    public DependencyGraph<Craftable> getCraftableGraph() { return craftableGraph; }

    public ConsumptionEngine getConsumptionEngine() { return consumptionEngine; }
    public QualityScorer getQualityScorer() { return qualityScorer; }
    public TechManager getTechManager() { return techManager; }
    public CraftingManager getCraftingManager() { return craftingManager; }

    public ContentIntegrityValidator validator() {
        return new ContentIntegrityValidator(registry, catalog, techGraph, craftableGraph);
    }

    /** Empty session: no resources, no technologies, no items. */
    public GameSession newSession(UUID sessionId) {
        return new GameSession(sessionId, registry);
    }

    @Override
    public String toString() {
        return "GameContent{types=" + registry.size() + ", materials=" + catalog.getAll().size()
                + ", techs=" + techGraph.size() + ", craftables=" + craftableGraph.size() + "}";
    }
}
