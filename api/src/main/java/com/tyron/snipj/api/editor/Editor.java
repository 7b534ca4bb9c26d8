package com.tyron.snipj.api.editor;

/**
 * Abstract view of a code editor attached to a {@link Document}.
 * <p>
 * The editor owns the caret and the selection. Snippet sessions drive both through this interface.
 */
public interface Editor {
    Document getDocument();

    Carets getCaretModel();

    Selection getSelectionModel();
    
    /**
     * Scroll the view so the caret is visible.
     */
    void scrollToCaret();

    interface Carets {
        int getOffset();

        /**
         * Moves the caret and notifies {@link CaretListener}s.
         */
        void moveToOffset(int offset);

        void addCaretListener(CaretListener listener);

        void removeCaretListener(CaretListener listener);
    }

    interface Selection {
        boolean hasSelection();

        int getSelectionStart();

        int getSelectionEnd();

        /**
         * Selects {@code [start, end)} and puts the caret at {@code end}.
         */
        void setSelection(int start, int end);

        void removeSelection();

        default String getSelectedText(Document document) {
            if (!hasSelection()) {
                return null;
            }
            return document.getText(getSelectionStart(), getSelectionEnd() - getSelectionStart());
        }
    }

    /**
     * Receives explicit caret moves. Caret shifts caused by document edits are not reported.
     */
    @FunctionalInterface
    interface CaretListener {
        void caretMoved(Editor editor, int oldOffset, int newOffset);
    }
}
