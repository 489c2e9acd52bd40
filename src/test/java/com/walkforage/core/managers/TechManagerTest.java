package com.walkforage.core.managers;

import com.walkforage.core.TestContent;
import com.walkforage.core.domain.inventory.Inventory;
import com.walkforage.core.domain.inventory.Selection;
import com.walkforage.core.domain.session.GameSession;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class TechManagerTest {

    @Mock private ConsumptionEngine mockEngine;

    private TechManager techManager;
    private GameSession session;

    private static final Selection KNAPPING_PRICE = Selection.builder()
            .add("stone", "granite", 10)
            .add("food", "hazelnut", 5)
            .build();

    @Before
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        techManager = new TechManager(
                TechManager.buildGraph(TestContent.technologies()),
                new ConsumptionEngine(TestContent.catalog()));
        session = new GameSession(UUID.randomUUID(), TestContent.registry());
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Test
    public void testLookups() {
        assertEquals(3, techManager.getAllNodes().size());
        assertEquals("Grinding", techManager.getNode("grinding").name());
        assertNull(techManager.getNode("smelting"));
        assertEquals(2, techManager.getTechsByEra("lower_paleolithic").size());
        assertTrue(techManager.getTechsByEra(null).isEmpty());
    }

    @Test
    public void testTechResourceCost() {
        assertEquals(10, techManager.getTechResourceCost("basic_knapping", "stone"));
        assertEquals(5, techManager.getTechResourceCost("basic_knapping", "food"));
        assertEquals(0, techManager.getTechResourceCost("basic_knapping", "wood"));
        assertEquals(0, techManager.getTechResourceCost("smelting", "stone"));
    }

    @Test
    public void testAvailabilityQueries() {
        assertEquals(Boolean.FALSE, techManager.isAvailable("grinding", Set.of()));
        assertEquals(List.of("basic_knapping"), techManager.missingPrerequisites("grinding", Set.of()));
        assertNull(techManager.isAvailable("smelting", Set.of()));
        assertEquals(List.of("basic_knapping"), techManager.transitiveClosure("grinding"));
        assertEquals(1, techManager.getAvailableTechs(Set.of()).size());
    }

    // ========================================================================
    // checkAvailability
    // ========================================================================

    @Test
    public void testCheckAvailabilityReportsShortfall() {
        Inventory inv = session.getInventory();
        inv.add("stone", "granite", 4);
        inv.add("stone", "basalt", 4);
        inv.add("food", "hazelnut", 5);

        AvailabilityCheck check = techManager.checkAvailability("basic_knapping", session);

        assertFalse(check.canProceed());
        assertFalse(check.alreadyUnlocked());
        assertTrue(check.missingPrerequisites().isEmpty());
        assertEquals(List.of(new ResourceShortfall("stone", 8, 10)), check.missingResources());
    }

    @Test
    public void testCheckAvailabilityReportsMissingPrerequisites() {
        AvailabilityCheck check = techManager.checkAvailability("grinding", Set.of(), null);

        assertFalse(check.canProceed());
        assertEquals(List.of("basic_knapping"), check.missingPrerequisites());
        assertEquals(List.of(new ResourceShortfall("stone", 0, 15)), check.missingResources());
    }

    @Test
    public void testCheckAvailabilityUnknownIsNull() {
        assertNull(techManager.checkAvailability("smelting", session));
    }

    @Test
    public void testCheckAvailabilityDoesNotMutate() {
        session.getInventory().add("stone", "granite", 20);
        session.getInventory().add("food", "hazelnut", 10);
        Inventory before = session.getInventory().copy();

        assertTrue(techManager.checkAvailability("basic_knapping", session).canProceed());
        assertEquals(before, session.getInventory());
        assertFalse(session.hasTech("basic_knapping"));
    }

    // ========================================================================
    // unlockNode
    // ========================================================================

    @Test
    public void testUnlockPaysAndRecordsTech() {
        session.getInventory().add("stone", "granite", 20);
        session.getInventory().add("food", "hazelnut", 10);

        SpendResult result = techManager.unlockNode(session, "basic_knapping", KNAPPING_PRICE);

        assertTrue(result.success());
        assertEquals("basic_knapping", result.grantedId());
        assertTrue(session.hasTech("basic_knapping"));
        assertEquals(10, session.getInventory().getCount("stone", "granite"));
        assertEquals(5, session.getInventory().getCount("food", "hazelnut"));
        assertEquals(Boolean.TRUE, techManager.isAvailable("grinding", session.getUnlockedTechs()));
    }

    @Test
    public void testUnlockTwiceRefused() {
        session.getInventory().add("stone", "granite", 20);
        session.getInventory().add("food", "hazelnut", 10);
        techManager.unlockNode(session, "basic_knapping", KNAPPING_PRICE);

        SpendResult again = techManager.unlockNode(session, "basic_knapping", KNAPPING_PRICE);

        assertEquals(SpendFailure.Reason.ALREADY_UNLOCKED, again.reason());
        assertEquals(10, session.getInventory().getCount("stone", "granite"));
    }

    @Test
    public void testUnlockWithFailedSpendLeavesSessionUntouched() {
        session.getInventory().add("stone", "granite", 5);
        session.getInventory().add("food", "hazelnut", 10);
        Inventory before = session.getInventory().copy();

        SpendResult result = techManager.unlockNode(session, "basic_knapping", KNAPPING_PRICE);

        assertEquals(SpendFailure.Reason.INSUFFICIENT_MATERIAL, result.reason());
        assertFalse(session.hasTech("basic_knapping"));
        assertEquals(before, session.getInventory());
    }

    @Test
    public void testPrerequisitesCheckedBeforeSpending() {
        TechManager withMock = new TechManager(TechManager.buildGraph(TestContent.technologies()), mockEngine);

        SpendResult result = withMock.unlockNode(session, "grinding",
                Selection.builder().add("stone", "granite", 15).build());

        assertEquals(SpendFailure.Reason.MISSING_PREREQUISITES, result.reason());
        assertEquals(List.of("basic_knapping"), result.failure().missingIds());
        verify(mockEngine, never()).attemptSpend(anyString(), anyList(), any(), any());
    }

    @Test
    public void testUnknownTechRefused() {
        TechManager withMock = new TechManager(TechManager.buildGraph(TestContent.technologies()), mockEngine);

        assertEquals(SpendFailure.Reason.UNKNOWN_TARGET,
                withMock.unlockNode(session, "smelting", KNAPPING_PRICE).reason());
        verifyNoInteractions(mockEngine);
    }

    @Test
    public void testEngineFailurePassedThrough() {
        TechManager withMock = new TechManager(TechManager.buildGraph(TestContent.technologies()), mockEngine);
        SpendResult refused = SpendResult.failed(session.getInventory(), SpendFailure.noSelection("food", 5));
        when(mockEngine.attemptSpend(eq("basic_knapping"), anyList(), any(), any())).thenReturn(refused);

        SpendResult result = withMock.unlockNode(session, "basic_knapping", Selection.empty());

        assertSame(refused, result);
        assertFalse(session.hasTech("basic_knapping"));
    }
}
