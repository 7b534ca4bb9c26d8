package com.tyron.snipj.core.snippet;

/**
 * Lifecycle of a {@link SnippetSession}.
 * <pre>
 * IDLE --start--> ACTIVE --next past last tabstop--> FINISHED
 *   |               |----cancel / caret left / edit outside snippet--> CANCELLED
 *   '--start, no tabstop other than $0--> FINISHED
 * </pre>
 * FINISHED and CANCELLED are terminal.
 */
public enum SessionState {
    IDLE,
    ACTIVE,
    FINISHED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FINISHED || this == CANCELLED;
    }
}
