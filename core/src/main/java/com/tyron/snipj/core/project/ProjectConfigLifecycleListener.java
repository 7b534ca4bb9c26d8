package com.tyron.snipj.core.project;

import com.tyron.snipj.api.project.Project;
import com.tyron.snipj.api.project.ProjectLifecycleListener;
import com.tyron.snipj.core.snippet.SnippetSettings;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads project configuration from the project root ({@code snipj.yaml} / {@code snipj.yml})
 * into {@link Project#getConfiguration()}.
 * <pre>
 * id: demo
 * properties:
 *   foo: bar
 * snippets:
 *   statusText: SNIP
 *   selectOnInsert: true
 *   insertFinalTabstop: true
 * </pre>
 */
public final class ProjectConfigLifecycleListener implements ProjectLifecycleListener {

    private static final Logger LOG = Logger.getLogger(ProjectConfigLifecycleListener.class.getName());

    public static final String ID_KEY = "snipj.id";
    public static final String PROPERTIES_PREFIX = "snipj.properties.";

    private final Project project;

    public ProjectConfigLifecycleListener(Project project) {
        this.project = Objects.requireNonNull(project, "project");
    }

    @Override
    public void projectOpened(Project project) {
        loadConfigIntoProjectConfiguration();
    }

    private void loadConfigIntoProjectConfiguration() {
        Path root = this.project.getRootDirectory();
        if (root == null) return;

        Path config = root.resolve("snipj.yaml");
        if (!Files.isRegularFile(config)) {
            config = root.resolve("snipj.yml");
        }
        if (!Files.isRegularFile(config)) return;

        try (InputStream in = Files.newInputStream(config)) {
            Object doc = new Yaml().load(in);
            if (!(doc instanceof Map<?, ?> map)) return;

            Object id = map.get("id");
            if (id != null) {
                this.project.getConfiguration().setProperty(ID_KEY, String.valueOf(id));
            }

            // properties: {k: v}
            copySection(map.get("properties"), PROPERTIES_PREFIX);

            // snippets: {statusText: .., selectOnInsert: .., insertFinalTabstop: ..}
            copySection(map.get("snippets"), SnippetSettings.PREFIX);

            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("projectConfig loaded file=" + config + " project=" + this.project.getName());
            }
        } catch (IOException | YAMLException e) {
            // Parsing/config is optional.
            LOG.log(Level.WARNING, "projectConfig ignored file=" + config, e);
        }
    }

    private void copySection(Object section, String prefix) {
        if (!(section instanceof Map<?, ?> sectionMap)) return;
        for (Map.Entry<?, ?> e : sectionMap.entrySet()) {
            if (e.getKey() == null) continue;
            String value = (e.getValue() != null) ? String.valueOf(e.getValue()) : "";
            this.project.getConfiguration().setProperty(prefix + e.getKey(), value);
        }
    }
}
