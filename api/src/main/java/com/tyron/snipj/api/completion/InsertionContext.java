package com.tyron.snipj.api.completion;

import com.tyron.snipj.api.editor.Document;
import com.tyron.snipj.api.editor.Editor;
import com.tyron.snipj.api.project.Project;

/**
 * Provides context to {@link InsertHandler}s about where the completion happened.
 * <p>
 * This class is mutable. Handlers update the offsets when they change the inserted text.
 * </p>
 */
public class InsertionContext {

    private final Project project;
    private final Editor editor;
    private final char completionChar; // The char that triggered completion (e.g. TAB or Enter)

    private int startOffset;
    private int tailOffset; // Where the caret ends up

    public InsertionContext(Project project,
                            Editor editor,
                            char completionChar,
                            int startOffset,
                            int tailOffset) {
        this.project = project;
        this.editor = editor;
        this.completionChar = completionChar;
        this.startOffset = startOffset;
        this.tailOffset = tailOffset;
    }

    public Project getProject() {
        return project;
    }

    public Editor getEditor() {
        return editor;
    }

    public Document getDocument() {
        return editor.getDocument();
    }

    /**
     * @return The character that forced the completion (e.g. \t, \n).
     * Returns 0 if explicitly selected from the list.
     */
    public char getCompletionChar() {
        return completionChar;
    }

    /**
     * Start of the text being replaced (the typed prefix).
     */
    public int getStartOffset() {
        return startOffset;
    }

    public void setStartOffset(int offset) {
        this.startOffset = offset;
    }

    public int getTailOffset() {
        return tailOffset;
    }

    /**
     * If you insert extra characters, update the tail offset
     * so the caller knows where the inserted text ends.
     */
    public void setTailOffset(int offset) {
        this.tailOffset = offset;
    }
}
