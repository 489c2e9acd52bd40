package com.walkforage.core.content;

import com.walkforage.core.content.dao.CraftableDefinitionDAO;
import com.walkforage.core.content.dao.MaterialDefinitionDAO;
import com.walkforage.core.content.dao.ResourceTypeDAO;
import com.walkforage.core.content.dao.TechDefinitionDAO;
import com.walkforage.core.domain.crafting.Craftable;
import com.walkforage.core.domain.resources.Material;
import com.walkforage.core.domain.resources.MaterialCatalog;
import com.walkforage.core.domain.resources.ResourceType;
import com.walkforage.core.domain.resources.ResourceTypeRegistry;
import com.walkforage.core.domain.tech.Technology;
import com.walkforage.core.graph.DependencyGraph;
import com.walkforage.core.managers.CraftingManager;
import com.walkforage.core.managers.IntegrityReport;
import com.walkforage.core.managers.TechManager;
import com.walkforage.core.ports.IContentSource;

import java.util.List;
import java.util.Objects;

/**
 * Reads every content table through the DAOs and assembles a {@link GameContent}.
 */
public class GameContentLoader {

    private final IContentSource source;
    private final ResourceTypeDAO resourceTypeDAO;
    private final MaterialDefinitionDAO materialDAO;
    private final TechDefinitionDAO techDAO;
    private final CraftableDefinitionDAO craftableDAO;

    public GameContentLoader(IContentSource source) {
        this.source = Objects.requireNonNull(source, "source");
        this.resourceTypeDAO = new ResourceTypeDAO(source);
        this.materialDAO = new MaterialDefinitionDAO(source);
        this.techDAO = new TechDefinitionDAO(source);
        this.craftableDAO = new CraftableDefinitionDAO(source);
    }

    /**
     * Parses and indexes the content. Structural problems (bad JSON, duplicate ids) throw;
     * cross-table consistency is not checked here.
     */
    public GameContent load() {
        System.out.println("🔍 [ContentLoader] Loading content from " + source.describe());
        try {
            List<ResourceType> types = resourceTypeDAO.loadAll();
            ResourceTypeRegistry registry = new ResourceTypeRegistry(types);

            List<Material> materials = materialDAO.loadAll(registry.getAll());
            MaterialCatalog catalog = new MaterialCatalog(materials);

            List<Technology> techs = techDAO.loadAllNodes();
            DependencyGraph<Technology> techGraph = TechManager.buildGraph(techs);

            List<Craftable> craftables = craftableDAO.loadAll();
            DependencyGraph<Craftable> craftableGraph = CraftingManager.buildGraph(craftables);

            GameContent content = new GameContent(registry, catalog, techGraph, craftableGraph);
            System.out.println("✅ [ContentLoader] Loaded " + content);
            return content;
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ContentIntegrityException("Invalid content: " + e.getMessage(), e);
        }
    }

    /**
     * Loads and runs the full integrity suite.
     *
     * @throws ContentIntegrityException listing every violation when the content is not consistent
     */
    public GameContent loadValidated() {
        GameContent content = load();
        IntegrityReport report = content.validator().validateAndPrint();
        if (!report.isValid()) {
            throw new ContentIntegrityException(report.getErrors());
        }
        return content;
    }
}
