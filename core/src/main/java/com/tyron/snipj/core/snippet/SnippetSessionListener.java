package com.tyron.snipj.core.snippet;

/**
 * Notified when a {@link SnippetSession} reaches a terminal state.
 */
@FunctionalInterface
public interface SnippetSessionListener {

    void sessionEnded(SnippetSession session, SessionState state);
}
