package com.tyron.snipj.api.editor;

/**
 * Project extension point notified about editor lifecycle changes.
 */
public interface EditorManagerListener {

    default void editorCreated(Editor editor) {
    }

    default void editorFocused(Editor editor) {
    }

    /**
     * Called after the editor was removed from the manager.
     */
    default void editorReleased(Editor editor) {
    }
}
