package com.tyron.snipj.api.editor;

/**
 * Half-open offset range {@code [startOffset, endOffset)} in a {@link Document}.
 */
public final class TextRange {

    private final int startOffset;
    private final int endOffset;

    public TextRange(int startOffset, int endOffset) {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid range [" + startOffset + ", " + endOffset + ")");
        }
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    public static TextRange from(int offset, int length) {
        return new TextRange(offset, offset + length);
    }

    public static TextRange empty(int offset) {
        return new TextRange(offset, offset);
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int getLength() {
        return endOffset - startOffset;
    }

    public boolean isEmpty() {
        return startOffset == endOffset;
    }

    /**
     * Inclusive on both ends, so an empty range touching either boundary is contained.
     */
    public boolean contains(TextRange other) {
        return startOffset <= other.startOffset && other.endOffset <= endOffset;
    }

    public boolean containsOffset(int offset) {
        return startOffset <= offset && offset <= endOffset;
    }

    public TextRange shiftRight(int delta) {
        return new TextRange(startOffset + delta, endOffset + delta);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextRange other)) return false;
        return startOffset == other.startOffset && endOffset == other.endOffset;
    }

    @Override
    public int hashCode() {
        return 31 * startOffset + endOffset;
    }

    @Override
    public String toString() {
        return "(" + startOffset + "," + endOffset + ")";
    }
}
