package com.tyron.snipj.core.snippet.parser;

/**
 * Signals that the text at the current {@code $} is not a snippet construct.
 * <p>
 * Never escapes {@link SnippetParser}: the parser catches it and degrades the span to literal text.
 */
final class SnippetSyntaxException extends Exception {

    private final boolean unterminated;

    private SnippetSyntaxException(String message, boolean unterminated) {
        super(message, null, false, false);
        this.unterminated = unterminated;
    }

    static SnippetSyntaxException mismatch(String message) {
        return new SnippetSyntaxException(message, false);
    }

    /**
     * The input ended inside a braced construct.
     */
    static SnippetSyntaxException unterminated() {
        return new SnippetSyntaxException("unterminated '${'", true);
    }

    boolean isUnterminated() {
        return unterminated;
    }
}
