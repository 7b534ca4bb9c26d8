package com.tyron.snipj.core.completion;

import com.tyron.snipj.api.completion.InsertHandler;
import com.tyron.snipj.api.completion.InsertionContext;
import com.tyron.snipj.api.completion.LookupElement;
import com.tyron.snipj.api.completion.LookupElementBuilder;
import com.tyron.snipj.api.editor.Document;
import com.tyron.snipj.api.snippet.SnippetManager;
import com.tyron.snipj.core.service.ProjectServiceManager;
import com.tyron.snipj.core.snippet.SnippetSettings;
import com.tyron.snipj.core.snippet.parser.SnippetParser;

import java.util.Objects;

/**
 * Expands a snippet when its completion item is accepted.
 * <p>
 * The text between the start and tail offsets (the typed prefix) is removed and the snippet body is
 * inserted in its place through the project's {@link SnippetManager}. The tail offset is moved to the
 * end of the inserted text.
 */
public final class SnippetInsertHandler implements InsertHandler<LookupElement> {

    private final String body;

    public SnippetInsertHandler(String body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    /**
     * Completion item for a snippet: filtered by {@code prefix}, expanding {@code body}.
     */
    public static LookupElement createLookupElement(String prefix, String body, String description) {
        return LookupElementBuilder.create(body, prefix)
                .withTailText(" " + description)
                .withTypeText("Snippet")
                .withIcon("snippet")
                .withInsertHandler(new SnippetInsertHandler(body));
    }

    public String getBody() {
        return body;
    }

    /**
     * @return the body as plain text, for a preview in the completion popup.
     */
    public String getPreviewText() {
        return new SnippetParser().parse(body).render();
    }

    @Override
    public void handleInsert(InsertionContext context, LookupElement item) {
        Document document = context.getDocument();
        int start = context.getStartOffset();
        document.deleteString(start, context.getTailOffset());

        int lengthBefore = document.getTextLength();
        SnippetManager manager = ProjectServiceManager.getService(context.getProject(), SnippetManager.class);
        boolean select = SnippetSettings.of(context.getProject()).isSelectOnInsert();
        manager.insertSnippet(context.getEditor(), body, select, start);

        context.setTailOffset(start + document.getTextLength() - lengthBefore);
    }
}
