package com.tyron.snipj.api.completion;

/**
 * Custom logic run when a completion item is accepted.
 * <p>
 * Use this to handle side effects like expanding a snippet or moving the caret.
 * </p>
 */
@FunctionalInterface
public interface InsertHandler<T extends LookupElement> {
    /**
     * @param context The context containing the editor, document, and offsets.
     * @param item    The item that is being inserted.
     */
    void handleInsert(InsertionContext context, T item);
}
