package com.tyron.snipj.api.editor;

import java.util.Objects;

/**
 * A single text change in a {@link Document}: the range {@code [startOffset, endOffset)} of the text
 * before the change was replaced by {@link #getNewText()}.
 */
public final class DocumentEvent {

    private final Document document;
    private final int startOffset;
    private final int endOffset;
    private final String newText;

    public DocumentEvent(Document document, int startOffset, int endOffset, String newText) {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid change range [" + startOffset + ", " + endOffset + ")");
        }
        this.document = document;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.newText = Objects.requireNonNull(newText, "newText");
    }

    public Document getDocument() {
        return document;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public TextRange getRange() {
        return new TextRange(startOffset, endOffset);
    }

    public String getNewText() {
        return newText;
    }

    public int getOldLength() {
        return endOffset - startOffset;
    }

    /**
     * @return how much the document length changed.
     */
    public int getDelta() {
        return newText.length() - getOldLength();
    }

    @Override
    public String toString() {
        return "DocumentEvent[" + startOffset + ", " + endOffset + ") -> '" + newText + "'";
    }
}
