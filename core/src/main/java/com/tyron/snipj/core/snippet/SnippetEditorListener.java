package com.tyron.snipj.core.snippet;

import com.tyron.snipj.api.editor.Editor;
import com.tyron.snipj.api.editor.EditorManagerListener;
import com.tyron.snipj.api.project.Project;

/**
 * Keeps snippet sessions in step with the editor lifecycle: a released editor drops its session,
 * a focused one updates the status indicator.
 */
public final class SnippetEditorListener implements EditorManagerListener {

    private final Project project;

    public SnippetEditorListener(Project project) {
        this.project = project;
    }

    @Override
    public void editorFocused(Editor editor) {
        SnippetManagerImpl.getInstance(project).editorFocused(editor);
    }

    @Override
    public void editorReleased(Editor editor) {
        SnippetManagerImpl.getInstance(project).editorReleased(editor);
    }
}
