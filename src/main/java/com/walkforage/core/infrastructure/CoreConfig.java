package com.walkforage.core.infrastructure;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * External configuration.
 * Reads 'walkforage.properties' from the working directory, else the copy bundled on the classpath.
 * Tuning values (quality ladder, content location) can change without recompiling.
 */
public class CoreConfig {

    public static final String FILE_NAME = "walkforage.properties";

    private static final Properties props = new Properties();

    public static void load() {
        Path local = Path.of(FILE_NAME);
        if (Files.isRegularFile(local)) {
            load(local);
            return;
        }

        try (InputStream in = CoreConfig.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            props.clear();
            if (in == null) {
                System.out.println("⚠️ " + FILE_NAME + " not found. Using DEFAULT values.");
                return;
            }
            props.load(in);
            System.out.println("⚙️ Configuration loaded from classpath " + FILE_NAME);
        } catch (IOException e) {
            System.err.println("❌ Cannot read classpath " + FILE_NAME + ": " + e.getMessage() + ". Using defaults.");
        }
    }

    public static void load(Path file) {
        props.clear();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
            System.out.println("⚙️ Configuration loaded from " + file);
        } catch (IOException e) {
            System.err.println("❌ Cannot read " + file + ": " + e.getMessage() + ". Using defaults.");
        }
    }

    /** Drops every loaded value; getters fall back to their defaults. */
    public static void reset() {
        props.clear();
    }

    public static String getString(String key, String defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        return val.trim();
    }

    /**
     * Reads an integer from the config, or the default when missing.
     */
    public static int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            System.err.println("❌ Config error for " + key + ": " + val + " is not an integer.");
            return defaultValue;
        }
    }

    public static double getDouble(String key, double defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            double d = Double.parseDouble(val.trim());
            if (Double.isNaN(d) || Double.isInfinite(d)) throw new NumberFormatException("not finite");
            return d;
        } catch (NumberFormatException e) {
            System.err.println("❌ Config error for " + key + ": " + val + " is not a number.");
            return defaultValue;
        }
    }
}
