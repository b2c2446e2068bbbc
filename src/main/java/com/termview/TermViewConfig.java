/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview;

import com.termview.art.ViewportPolicy;
import com.termview.utils.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Typed access to {@code application.properties}.
 *
 * <p>Lookup order, later wins: classpath defaults, {@code config/application.properties}
 * in the working directory, then JVM system properties with the same key.
 */
public class TermViewConfig {

    static final String CONFIG_RESOURCE = "application.properties";
    static final Path EXTERNAL_CONFIG = Paths.get("config", CONFIG_RESOURCE);

    private final Properties properties;

    public TermViewConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads classpath defaults and applies the external override file if present.
     *
     * @throws IOException if the classpath defaults are missing or unreadable
     */
    public static TermViewConfig load() throws IOException {
        return load(EXTERNAL_CONFIG);
    }

    public static TermViewConfig load(Path externalConfig) throws IOException {
        Properties config = new Properties();

        try (InputStream inputStream = TermViewConfig.class.getClassLoader()
                .getResourceAsStream(CONFIG_RESOURCE)) {
            if (inputStream == null) {
                throw new IOException(CONFIG_RESOURCE + " not found in classpath");
            }
            config.load(inputStream);
        }

        if (externalConfig != null && Files.exists(externalConfig)) {
            try (InputStream inputStream = Files.newInputStream(externalConfig)) {
                Properties overrides = new Properties();
                overrides.load(inputStream);
                config.putAll(overrides);
                LoggerUtil.debug(String.format("Loaded %d configuration overrides from %s",
                    overrides.size(), externalConfig.toAbsolutePath()));
            } catch (IOException e) {
                LoggerUtil.warn("Failed to load configuration overrides: " + e.getMessage());
            }
        }

        return new TermViewConfig(config);
    }

    public String getString(String key, String defaultValue) {
        String value = System.getProperty(key, properties.getProperty(key, defaultValue));
        return value != null ? value.trim() : null;
    }

    /**
     * @throws IllegalArgumentException if the configured value is not an integer
     */
    public int getInt(String key, int defaultValue) {
        String value = getString(key, Integer.toString(defaultValue));
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration " + key + " must be an integer, got: " + value, e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return Boolean.parseBoolean(getString(key, Boolean.toString(defaultValue)));
    }

    public String getRenderProfile() {
        return getString("render.profile", "default");
    }

    public boolean isDebugLogging() {
        return getBoolean("log.debug", false);
    }

    public ViewportPolicy getViewportPolicy() {
        ViewportPolicy defaults = ViewportPolicy.defaults();
        return new ViewportPolicy(
            getInt("viewport.margin.width", defaults.marginWidth()),
            getInt("viewport.margin.height", defaults.marginHeight()),
            getInt("viewport.min.width", defaults.minWidth()),
            getInt("viewport.min.height", defaults.minHeight()),
            getInt("viewport.large.width", defaults.largeWidth()),
            getInt("viewport.large.height", defaults.largeHeight()),
            getInt("viewport.cap.width", defaults.capWidth()),
            getInt("viewport.cap.height", defaults.capHeight()));
    }
}
