package com.walkforage.core.infrastructure;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Files;

import static org.junit.Assert.*;

public class CoreConfigTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @After
    public void tearDown() {
        CoreConfig.reset();
    }

    @Test
    public void testDefaultsWhenNothingLoaded() {
        CoreConfig.reset();

        assertEquals("content", CoreConfig.getString("content.path", "content"));
        assertEquals(2, CoreConfig.getInt("session.queue.shutdownSeconds", 2));
        assertEquals(0.1, CoreConfig.getDouble("quality.floor", 0.1), 0.0);
    }

    @Test
    public void testValuesFromFile() throws Exception {
        File f = tmp.newFile("walkforage.properties");
        Files.writeString(f.toPath(), "content.path = packs/alpha \nsession.queue.shutdownSeconds=5\nquality.floor=0.25\n");

        CoreConfig.load(f.toPath());

        assertEquals("packs/alpha", CoreConfig.getString("content.path", "content"));
        assertEquals(5, CoreConfig.getInt("session.queue.shutdownSeconds", 2));
        assertEquals(0.25, CoreConfig.getDouble("quality.floor", 0.1), 0.0);
    }

    @Test
    public void testMalformedValuesFallBack() throws Exception {
        File f = tmp.newFile("walkforage.properties");
        Files.writeString(f.toPath(), "session.queue.shutdownSeconds=soon\nquality.floor=NaN\ncontent.path=\n");

        CoreConfig.load(f.toPath());

        assertEquals(2, CoreConfig.getInt("session.queue.shutdownSeconds", 2));
        assertEquals(0.1, CoreConfig.getDouble("quality.floor", 0.1), 0.0);
        assertEquals("content", CoreConfig.getString("content.path", "content"));
    }

    @Test
    public void testMissingFileKeepsDefaults() {
        CoreConfig.load(tmp.getRoot().toPath().resolve("absent.properties"));

        assertEquals(0.1, CoreConfig.getDouble("quality.floor", 0.1), 0.0);
    }

    @Test
    public void testBundledFileOnClasspath() {
        CoreConfig.load();

        assertEquals("content", CoreConfig.getString("content.path", "missing"));
        assertEquals(0.8, CoreConfig.getDouble("quality.tier.masterwork", 0.0), 0.0);
    }
}
