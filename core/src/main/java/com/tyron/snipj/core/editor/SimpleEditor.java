package com.tyron.snipj.core.editor;

import com.tyron.snipj.api.editor.Document;
import com.tyron.snipj.api.editor.DocumentEvent;
import com.tyron.snipj.api.editor.DocumentListener;
import com.tyron.snipj.api.editor.Editor;
import com.tyron.snipj.api.editor.ObservableDocument;
import com.tyron.snipj.api.service.Disposable;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Minimal {@link Editor} implementation.
 * <p>
 * This does not render anything; it provides caret and selection state and the document reference.
 * When the document is observable, caret and selection follow edits made elsewhere in the text.
 */
public final class SimpleEditor implements Editor, Disposable {

    private final Document document;
    private final SimpleCarets carets = new SimpleCarets();
    private final SimpleSelection selection = new SimpleSelection();
    private final DocumentListener offsetTracker = this::adjustOffsets;

    public SimpleEditor(Document document) {
        this.document = Objects.requireNonNull(document, "document");
        if (document instanceof ObservableDocument observable) {
            observable.addDocumentListener(offsetTracker);
        }
    }

    @Override
    public Document getDocument() {
        return document;
    }

    @Override
    public Carets getCaretModel() {
        return carets;
    }

    @Override
    public Selection getSelectionModel() {
        return selection;
    }

    @Override
    public void scrollToCaret() {
        // No-op (UI specific).
    }

    @Override
    public void dispose() {
        if (document instanceof ObservableDocument observable) {
            observable.removeDocumentListener(offsetTracker);
        }
    }

    private void adjustOffsets(DocumentEvent event) {
        carets.offset = shift(carets.offset, event);
        if (selection.hasSelection()) {
            int start = shift(selection.start, event);
            int end = shift(selection.end, event);
            if (start >= end) {
                selection.removeSelection();
            } else {
                selection.start = start;
                selection.end = end;
            }
        }
    }

    /**
     * Offsets at or before the change start stay put, offsets inside the replaced range collapse to its start.
     */
    private static int shift(int offset, DocumentEvent event) {
        if (offset <= event.getStartOffset()) {
            return offset;
        }
        if (offset < event.getEndOffset()) {
            return event.getStartOffset();
        }
        return offset + event.getDelta();
    }

    private final class SimpleCarets implements Carets {
        private volatile int offset;
        private final CopyOnWriteArrayList<CaretListener> listeners = new CopyOnWriteArrayList<>();

        @Override
        public int getOffset() {
            return offset;
        }

        @Override
        public void moveToOffset(int offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("offset < 0: " + offset);
            }
            int old = this.offset;
            this.offset = offset;
            for (CaretListener listener : listeners) {
                listener.caretMoved(SimpleEditor.this, old, offset);
            }
        }

        @Override
        public void addCaretListener(CaretListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
        }

        @Override
        public void removeCaretListener(CaretListener listener) {
            listeners.remove(listener);
        }
    }

    private final class SimpleSelection implements Selection {
        private int start = -1;
        private int end = -1;

        @Override
        public boolean hasSelection() {
            return start >= 0 && end > start;
        }

        @Override
        public int getSelectionStart() {
            return hasSelection() ? start : carets.getOffset();
        }

        @Override
        public int getSelectionEnd() {
            return hasSelection() ? end : carets.getOffset();
        }

        @Override
        public void setSelection(int start, int end) {
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("Invalid selection [" + start + ", " + end + ")");
            }
            if (start == end) {
                removeSelection();
            } else {
                this.start = start;
                this.end = end;
            }
            carets.moveToOffset(end);
        }

        @Override
        public void removeSelection() {
            this.start = -1;
            this.end = -1;
        }
    }
}
