package com.tyron.snipj.api.editor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Manages the lifecycle of {@link Editor} instances.
 *
 * An editor edits a {@link Document}. Multiple editors may exist for a single document.
 * Registered {@link EditorManagerListener} extensions are told when editors are created and released.
 */
public interface EditorManager {

    /**
     * Opens an editor for the given file (creating or reusing its {@link Document}).
     */
    Editor openEditor(Path file) throws IOException;

    /**
     * Creates an editor for an existing document.
     */
    Editor createEditor(Document document);

    /**
     * Releases an editor instance.
     */
    void releaseEditor(Editor editor);

    /**
     * Marks the editor as the one the user is working in.
     */
    void focusEditor(Editor editor);

    Editor getFocusedEditor();

    List<Editor> getEditors(Document document);

    List<Editor> getAllEditors();
}
