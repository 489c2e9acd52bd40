package com.walkforage.core.domain.inventory;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.walkforage.core.TestContent;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class InventoryTest {

    private Inventory inventory;

    @Before
    public void setUp() {
        inventory = new Inventory(TestContent.registry());
    }

    // ========================================================================
    // Add / remove
    // ========================================================================

    @Test
    public void testStartsEmptyWithRegisteredTypes() {
        assertTrue(inventory.isEmpty());
        assertTrue(inventory.supportsType("stone"));
        assertTrue(inventory.supportsType("food"));
        assertFalse(inventory.supportsType("metal"));
    }

    @Test
    public void testTotalSaturatesInsteadOfWrapping() {
        assertTrue(inventory.add("stone", "granite", Integer.MAX_VALUE));
        assertTrue(inventory.add("stone", "basalt", Integer.MAX_VALUE));

        assertEquals(Integer.MAX_VALUE, inventory.getTotal("stone"));
    }

    @Test
    public void testAddMergesIntoExistingStack() {
        assertTrue(inventory.add("stone", "granite", 5));
        assertTrue(inventory.add("stone", "basalt", 3));
        assertTrue(inventory.add("stone", "granite", 2));

        assertEquals(List.of(new ResourceStack("granite", 7), new ResourceStack("basalt", 3)),
                inventory.stacks("stone"));
        assertEquals(10, inventory.getTotal("stone"));
    }

    @Test
    public void testAddRejectsInvalidInput() {
        assertFalse(inventory.add("metal", "copper", 1));
        assertFalse(inventory.add("stone", "granite", 0));
        assertFalse(inventory.add("stone", "granite", -4));
        assertFalse(inventory.add("stone", " ", 1));
        assertTrue(inventory.isEmpty());
    }

    @Test
    public void testRemoveDropsEmptiedStack() {
        inventory.add("stone", "granite", 5);

        assertTrue(inventory.remove("stone", "granite", 5));
        assertTrue(inventory.stacks("stone").isEmpty());
        assertEquals(0, inventory.getCount("stone", "granite"));
    }

    @Test
    public void testRemoveShortfallChangesNothing() {
        inventory.add("stone", "granite", 5);

        assertFalse(inventory.remove("stone", "granite", 6));
        assertFalse(inventory.remove("stone", "basalt", 1));
        assertEquals(5, inventory.getCount("stone", "granite"));
    }

    @Test
    public void testHas() {
        inventory.add("wood", "oak", 4);
        assertTrue(inventory.has("wood", "oak", 4));
        assertFalse(inventory.has("wood", "oak", 5));
        assertFalse(inventory.has("metal", "oak", 1));
    }

    // ========================================================================
    // Copy / merge / equality
    // ========================================================================

    @Test
    public void testCopyIsIndependent() {
        inventory.add("stone", "granite", 5);
        Inventory copy = inventory.copy();

        assertEquals(inventory, copy);
        copy.remove("stone", "granite", 1);
        assertEquals(5, inventory.getCount("stone", "granite"));
        assertNotEquals(inventory, copy);
    }

    @Test
    public void testMergeFrom() {
        inventory.add("stone", "granite", 5);
        Inventory other = new Inventory(TestContent.registry());
        other.add("stone", "granite", 1);
        other.add("food", "hazelnut", 3);

        inventory.mergeFrom(other);

        assertEquals(6, inventory.getCount("stone", "granite"));
        assertEquals(3, inventory.getCount("food", "hazelnut"));
    }

    @Test
    public void testStacksSnapshotIsReadOnly() {
        inventory.add("stone", "granite", 5);
        List<ResourceStack> snap = inventory.stacks("stone");
        inventory.add("stone", "basalt", 1);

        assertEquals(1, snap.size());
        assertThrows(UnsupportedOperationException.class, () -> snap.add(new ResourceStack("flint", 1)));
    }

    // ========================================================================
    // Snapshot
    // ========================================================================

    @Test
    public void testSerializedSnapshotRestoresSameInventory() {
        inventory.add("stone", "granite", 5);
        inventory.add("stone", "basalt", 10);
        inventory.add("food", "hazelnut", 2);

        JsonObject json = inventory.serialize();
        assertEquals(2, json.getAsJsonArray("stone").size());

        assertEquals(inventory, Inventory.fromSerialized(json, TestContent.registry()));
    }

    @Test
    public void testFromSerializedDropsUnknownTypesAndBadQuantities() {
        JsonObject json = new JsonObject();
        JsonObject bad = new JsonObject();
        bad.addProperty("materialId", "granite");
        bad.addProperty("quantity", 0);
        JsonArray stones = new JsonArray();
        stones.add(bad);
        json.add("stone", stones);
        json.add("metal", new JsonArray());

        Inventory restored = Inventory.fromSerialized(json, TestContent.registry());
        assertTrue(restored.isEmpty());
        assertFalse(restored.supportsType("metal"));
    }
}
