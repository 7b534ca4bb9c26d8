package com.tyron.snipj.core.snippet;

import com.tyron.snipj.api.project.Project;

import java.util.Objects;

/**
 * Snippet options read from the project configuration ({@code snippets:} section of {@code snipj.yaml}).
 */
public final class SnippetSettings {

    public static final String PREFIX = "snipj.snippets.";

    public static final String STATUS_TEXT = PREFIX + "statusText";
    public static final String SELECT_ON_INSERT = PREFIX + "selectOnInsert";
    public static final String INSERT_FINAL_TABSTOP = PREFIX + "insertFinalTabstop";

    public static final String DEFAULT_STATUS_TEXT = "SNIP";

    private final Project.ProjectConfiguration configuration;

    public SnippetSettings(Project.ProjectConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public static SnippetSettings of(Project project) {
        return new SnippetSettings(project.getConfiguration());
    }

    /**
     * @return text of the status indicator shown while a session is active.
     */
    public String getStatusText() {
        String text = configuration.getProperty(STATUS_TEXT);
        return text == null || text.isBlank() ? DEFAULT_STATUS_TEXT : text;
    }

    /**
     * Whether the first tabstop is selected after insertion, instead of placing the caret after it.
     */
    public boolean isSelectOnInsert() {
        return configuration.getBoolean(SELECT_ON_INSERT, true);
    }

    /**
     * Whether a {@code $0} is appended to snippets that do not declare one.
     */
    public boolean isInsertFinalTabstop() {
        return configuration.getBoolean(INSERT_FINAL_TABSTOP, true);
    }
}
