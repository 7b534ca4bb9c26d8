package com.tyron.snipj.api.project;

import com.tyron.snipj.api.service.Disposable;

import java.nio.file.Path;

/**
 * Represents a loaded project.
 * <p>
 * Project-scoped services (editor registry, snippet sessions, configuration) live as long as the project is open.
 * </p>
 */
public interface Project extends Disposable {

    /**
     * @return The display name of the project (e.g., "MyApplication").
     */
    String getName();

    /**
     * @return The root folder containing the project configuration file ({@code snipj.yaml}).
     */
    Path getRootDirectory();

    /**
     * @return The configuration provider for this project.
     */
    ProjectConfiguration getConfiguration();

    /**
     * @return true if the project is currently open and valid.
     */
    boolean isOpen();

    /**
     * Generic configuration wrapper (Key-Value store).
     */
    interface ProjectConfiguration {
        String getProperty(String key);
        String getProperty(String key, String defaultValue);

        void setProperty(String key, String value);

        default boolean getBoolean(String key, boolean defaultValue) {
            String raw = getProperty(key);
            if (raw == null || raw.isBlank()) {
                return defaultValue;
            }
            return Boolean.parseBoolean(raw.trim());
        }
    }
}
