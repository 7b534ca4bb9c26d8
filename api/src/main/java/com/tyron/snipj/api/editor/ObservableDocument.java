package com.tyron.snipj.api.editor;

/**
 * Extension of {@link Document} for implementations that publish change events.
 * <p>
 * Snippet sessions can only track documents of this kind.
 */
public interface ObservableDocument extends Document {

    void addDocumentListener(DocumentListener listener);

    void removeDocumentListener(DocumentListener listener);

    /**
     * Monotonically increasing stamp; increments on every change.
     */
    long getModificationStamp();
}
