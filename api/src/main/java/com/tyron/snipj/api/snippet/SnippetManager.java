package com.tyron.snipj.api.snippet;

import com.tyron.snipj.api.editor.Document;
import com.tyron.snipj.api.editor.Editor;

/**
 * Inserts snippets into editors and keeps at most one live snippet session per document.
 * <p>
 * Snippet bodies use the textmate syntax: {@code $1}, {@code ${1:default}}, {@code ${1|a,b|}},
 * {@code $NAME}, {@code ${NAME:default}} and {@code ${1/regex/format/flags}}.
 */
public interface SnippetManager {

    /**
     * Expands {@code body} at {@code offset}. Any session already running for the document is cancelled first.
     *
     * @param select whether the first tabstop's text is selected, or the caret placed after it
     * @return true when a session is now active (the snippet has at least one tabstop other than {@code $0})
     */
    boolean insertSnippet(Editor editor, String body, boolean select, int offset);

    /**
     * Expands {@code body} at the caret, using the configured selection behaviour.
     */
    boolean insertSnippet(Editor editor, String body);

    boolean isActive(Document document);

    void nextPlaceholder(Editor editor);

    void previousPlaceholder(Editor editor);

    void selectCurrentPlaceholder(Editor editor);

    /**
     * Ends the session when the caret has left the current tabstop.
     */
    void checkPosition(Editor editor);

    void cancel(Editor editor);
}
