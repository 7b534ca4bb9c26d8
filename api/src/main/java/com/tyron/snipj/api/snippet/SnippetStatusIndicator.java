package com.tyron.snipj.api.snippet;

/**
 * UI hook showing that a snippet session is running in the focused editor.
 * <p>
 * Register an implementation as a project extension; the snippet manager shows and hides it.
 */
public interface SnippetStatusIndicator {

    void show(String text);

    void hide();
}
