package com.tyron.snipj.core.editor;

import com.tyron.snipj.api.editor.EditorManager;
import com.tyron.snipj.api.editor.EditorManagerListener;
import com.tyron.snipj.api.editor.FileDocumentManager;
import com.tyron.snipj.api.project.Project;
import com.tyron.snipj.api.project.ProjectLifecycleListener;
import com.tyron.snipj.api.snippet.SnippetManager;
import com.tyron.snipj.core.project.ProjectConfigLifecycleListener;
import com.tyron.snipj.core.service.ProjectServiceManager;
import com.tyron.snipj.core.snippet.SnippetEditorListener;
import com.tyron.snipj.core.snippet.SnippetManagerImpl;

/**
 * Convenience registration for editor/document and snippet infrastructure.
 *
 * The project uses a simple service container; interfaces require explicit bindings.
 * Call this once per project during initialization.
 */
public final class EditorCore {

    private EditorCore() {
    }

    public static void register(Project project) {
        ProjectServiceManager.registerBinding(project, FileDocumentManager.class, FileDocumentManagerImpl.class);
        ProjectServiceManager.registerBinding(project, EditorManager.class, EditorManagerImpl.class);
        ProjectServiceManager.registerBinding(project, SnippetManager.class, SnippetManagerImpl.class);

        ProjectServiceManager.registerExtension(project, EditorManagerListener.class, SnippetEditorListener.class);
        ProjectServiceManager.registerExtension(project, ProjectLifecycleListener.class, ProjectConfigLifecycleListener.class);
    }
}
