package com.tyron.snipj.core.test;

import com.tyron.snipj.api.project.Project;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * A mutable Project implementation for unit and integration testing.
 * <p>
 * Usage:
 * <pre>
 *     MockProject project = new MockProject(tempDir);
 *     project.getConfiguration().setProperty("snipj.snippets.statusText", "S");
 * </pre>
 */
public class MockProject implements Project {

    private final String name;
    private final Path rootDir;

    private boolean isOpen = true;
    
    private final MockConfiguration configuration = new MockConfiguration();

    public MockProject(Path rootDir) {
        this("MockProject", rootDir);
    }

    public MockProject(String name, Path rootDir) {
        this.name = name;
        this.rootDir = rootDir;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Path getRootDirectory() {
        return rootDir;
    }

    @Override
    public ProjectConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public boolean isOpen() {
        return isOpen;
    }

    @Override
    public void dispose() {
        this.isOpen = false;
    }

    public static class MockConfiguration implements ProjectConfiguration {
        private final Map<String, String> properties = new HashMap<>();

        @Override
        public String getProperty(String key) {
            return properties.get(key);
        }

        @Override
        public String getProperty(String key, String defaultValue) {
            return properties.getOrDefault(key, defaultValue);
        }

        @Override
        public void setProperty(String key, String value) {
            properties.put(key, value);
        }
    }
}
