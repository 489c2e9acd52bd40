package com.walkforage.core.content;

import com.walkforage.core.domain.inventory.Selection;
import com.walkforage.core.domain.session.GameSession;
import com.walkforage.core.managers.CraftResult;
import com.walkforage.core.managers.SpendResult;
import com.walkforage.core.ports.IContentSource;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.FileNotFoundException;
import java.io.StringReader;
import java.util.List;
import java.util.UUID;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class GameContentLoaderTest {

    private static final String TYPES = "[{\"id\":\"stone\",\"properties\":[{\"id\":\"hardness\"}],"
            + "\"defaultQualityWeights\":{\"hardness\":1.0}}]";
    private static final String STONES = "[{\"id\":\"granite\",\"rarity\":0.3,\"properties\":{\"hardness\":7}}]";
    private static final String TECHS = "[{\"id\":\"basic_knapping\",\"resourceCost\":[{\"resourceType\":\"stone\",\"quantity\":10}],"
            + "\"enablesRecipes\":[\"hammerstone\"]}]";
    private static final String CRAFTABLES = "[{\"id\":\"hammerstone\",\"kind\":\"tool\",\"requiredTech\":\"basic_knapping\","
            + "\"materials\":[{\"resourceType\":\"stone\",\"quantity\":10}]}]";

    @Mock private IContentSource mockSource;

    @Before
    public void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        when(mockSource.describe()).thenReturn("mock");
        when(mockSource.exists(anyString())).thenReturn(true);
        serve("resource_types.json", TYPES);
        serve("materials/stone.json", STONES);
        serve("technologies.json", TECHS);
        serve("craftables.json", CRAFTABLES);
    }

    private void serve(String name, String json) throws Exception {
        when(mockSource.open(name)).thenAnswer(inv -> new StringReader(json));
    }

    // ========================================================================
    // Bundled content
    // ========================================================================

    @Test
    public void testBundledContentPassesIntegrity() {
        GameContent content = new GameContentLoader(new ClasspathContentSource("content")).loadValidated();

        assertEquals(List.of("stone", "wood", "food"), content.getRegistry().getIds());
        assertEquals(8, content.getTechGraph().size());
        assertEquals(12, content.getCraftableGraph().size());
        assertEquals(List.of("basic_knapping"), content.getTechGraph().getRoots());
        assertFalse(content.getCraftableGraph().getRoots().isEmpty());
        assertFalse(content.getCatalog().getWithFlag("stone", "toolstone").isEmpty());
    }

    @Test
    public void testBundledContentPlaysThroughFirstTool() {
        GameContent content = new GameContentLoader(new ClasspathContentSource("content")).loadValidated();
        GameSession session = content.newSession(UUID.randomUUID());
        session.getInventory().add("stone", "granite", 20);
        session.getInventory().add("food", "hazelnut", 5);

        SpendResult unlocked = content.getTechManager().unlockNode(session, "basic_knapping",
                Selection.builder().add("stone", "granite", 10).add("food", "hazelnut", 5).build());
        CraftResult crafted = content.getCraftingManager().craft(session, "hammerstone",
                Selection.builder().add("stone", "granite", 10).build(), List.of());

        assertTrue(unlocked.success());
        assertTrue(crafted.success());
        assertTrue(session.getInventory().isEmpty());
        assertEquals(1, session.countOwned("hammerstone"));
    }

    @Test
    public void testBundledGraphsNeverReachThemselves() {
        GameContent content = new GameContentLoader(new ClasspathContentSource("content")).loadValidated();

        for (String id : content.getTechGraph().getIds()) {
            assertFalse(id, content.getTechGraph().transitiveClosure(id).contains(id));
        }
        for (String id : content.getCraftableGraph().getIds()) {
            assertFalse(id, content.getCraftableGraph().transitiveClosure(id).contains(id));
        }
    }

    // ========================================================================
    // Loading through the port
    // ========================================================================

    @Test
    public void testMinimalContentLoads() {
        GameContent content = new GameContentLoader(mockSource).loadValidated();

        assertEquals(1, content.getCatalog().getAll().size());
        assertEquals(10, content.getTechManager().getTechResourceCost("basic_knapping", "stone"));
        assertTrue(content.getCraftingManager().getCraftable("hammerstone").isTool());
    }

    @Test
    public void testMissingMaterialTableOnlyWarns() throws Exception {
        when(mockSource.exists("materials/stone.json")).thenReturn(false);

        GameContent content = new GameContentLoader(mockSource).load();

        assertTrue(content.getCatalog().getAll().isEmpty());
        verify(mockSource, never()).open("materials/stone.json");
    }

    @Test
    public void testMalformedJsonRejected() throws Exception {
        serve("technologies.json", "[{\"id\": \"basic_knapping\",");

        ContentIntegrityException e = assertThrows(ContentIntegrityException.class,
                () -> new GameContentLoader(mockSource).load());
        assertTrue(e.getMessage().contains("technologies.json"));
    }

    @Test
    public void testUnreadableTableRejected() throws Exception {
        when(mockSource.open("craftables.json")).thenThrow(new FileNotFoundException("craftables.json"));

        assertThrows(ContentIntegrityException.class, () -> new GameContentLoader(mockSource).load());
    }

    @Test
    public void testDuplicateIdRejected() throws Exception {
        serve("technologies.json", "[{\"id\":\"basic_knapping\"},{\"id\":\"basic_knapping\"}]");

        ContentIntegrityException e = assertThrows(ContentIntegrityException.class,
                () -> new GameContentLoader(mockSource).load());
        assertTrue(e.getMessage().contains("duplicate id: basic_knapping"));
    }

    @Test
    public void testDanglingReferenceFailsValidation() throws Exception {
        serve("technologies.json", "[{\"id\":\"basic_knapping\",\"prerequisites\":[\"tool_use\"],"
                + "\"enablesRecipes\":[\"hammerstone\"]}]");

        ContentIntegrityException e = assertThrows(ContentIntegrityException.class,
                () -> new GameContentLoader(mockSource).loadValidated());
        assertTrue(e.getViolations().stream().anyMatch(v -> v.contains("unknown prerequisite 'tool_use'")));
    }

    @Test
    public void testNullListEntryRejected() throws Exception {
        serve("technologies.json", "[{\"id\":\"basic_knapping\",\"prerequisites\":[null]}]");

        ContentIntegrityException e = assertThrows(ContentIntegrityException.class,
                () -> new GameContentLoader(mockSource).load());
        assertTrue(e.getMessage().contains("prerequisites"));
    }

    @Test
    public void testObjectWhereStringExpectedRejected() throws Exception {
        serve("technologies.json", "[{\"id\":\"basic_knapping\",\"name\":{}}]");

        ContentIntegrityException e = assertThrows(ContentIntegrityException.class,
                () -> new GameContentLoader(mockSource).load());
        assertTrue(e.getMessage().contains("'name' is not a string"));
    }

    @Test
    public void testFractionalQuantityRejected() throws Exception {
        serve("technologies.json", "[{\"id\":\"basic_knapping\",\"resourceCost\":"
                + "[{\"resourceType\":\"stone\",\"quantity\":2.5}]}]");

        ContentIntegrityException e = assertThrows(ContentIntegrityException.class,
                () -> new GameContentLoader(mockSource).load());
        assertTrue(e.getMessage().contains("'quantity' is not an integer"));
    }

    @Test
    public void testRequirementsMustBeAList() throws Exception {
        serve("craftables.json", "[{\"id\":\"hammerstone\",\"kind\":\"tool\",\"requiredTools\":\"stone_knife\"}]");

        assertThrows(ContentIntegrityException.class, () -> new GameContentLoader(mockSource).load());
    }
}
