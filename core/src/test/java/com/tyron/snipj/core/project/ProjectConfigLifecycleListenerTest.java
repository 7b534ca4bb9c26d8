package com.tyron.snipj.core.project;

import com.tyron.snipj.core.snippet.SnippetSettings;
import com.tyron.snipj.core.test.MockProject;
import com.tyron.snipj.testFramework.TestLogging;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;

public class ProjectConfigLifecycleListenerTest {

    @TempDir
    Path root;

    @Test
    public void loadsSnipjYaml() throws Exception {
        Files.writeString(root.resolve("snipj.yaml"), """
                id: demo
                properties:
                  foo: bar
                snippets:
                  statusText: SNIPPET
                  selectOnInsert: false
                """, StandardCharsets.UTF_8);

        MockProject project = new MockProject(root);
        new ProjectConfigLifecycleListener(project).projectOpened(project);

        Assertions.assertEquals("demo", project.getConfiguration().getProperty("snipj.id"));
        Assertions.assertEquals("bar", project.getConfiguration().getProperty("snipj.properties.foo"));

        SnippetSettings settings = SnippetSettings.of(project);
        Assertions.assertEquals("SNIPPET", settings.getStatusText());
        Assertions.assertFalse(settings.isSelectOnInsert());
        Assertions.assertTrue(settings.isInsertFinalTabstop());
    }

    @Test
    public void fallsBackToYml() throws Exception {
        Files.writeString(root.resolve("snipj.yml"), "id: other\n", StandardCharsets.UTF_8);

        MockProject project = new MockProject(root);
        new ProjectConfigLifecycleListener(project).projectOpened(project);

        Assertions.assertEquals("other", project.getConfiguration().getProperty("snipj.id"));
    }

    @Test
    public void missingFileKeepsDefaults() {
        MockProject project = new MockProject(root);
        new ProjectConfigLifecycleListener(project).projectOpened(project);

        Assertions.assertNull(project.getConfiguration().getProperty("snipj.id"));
        Assertions.assertEquals(SnippetSettings.DEFAULT_STATUS_TEXT, SnippetSettings.of(project).getStatusText());
    }

    @Test
    public void malformedYamlIsLoggedAndIgnored() throws Exception {
        TestLogging.configureOnce();
        Files.writeString(root.resolve("snipj.yaml"), "id: [unclosed\n", StandardCharsets.UTF_8);
        MockProject project = new MockProject(root);

        try (TestLogging.Capture capture = TestLogging.capture(ProjectConfigLifecycleListener.class.getName(), Level.WARNING)) {
            new ProjectConfigLifecycleListener(project).projectOpened(project);
            Assertions.assertTrue(capture.contains("projectConfig ignored"));
        }
        Assertions.assertNull(project.getConfiguration().getProperty("snipj.id"));
    }
}
