package com.tyron.snipj.api.editor;

/**
 * Listener for {@link Document} changes.
 */
@FunctionalInterface
public interface DocumentListener {

    /**
     * Fired after the document has been modified.
     */
    void documentChanged(DocumentEvent event);
}
