package com.tyron.snipj.core.completion;

import com.tyron.snipj.api.completion.InsertionContext;
import com.tyron.snipj.api.completion.LookupElement;
import com.tyron.snipj.api.completion.LookupElementPresentation;
import com.tyron.snipj.testFramework.BaseSnippetTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SnippetInsertHandlerTest extends BaseSnippetTest {

    private static final String FORI = "for (int ${1:i} = 0; $1 < ${2:n}; $1++) {\n\t$0\n}";

    @Test
    public void acceptingItemExpandsSnippet() {
        configureByText("x fo<caret>");
        LookupElement item = SnippetInsertHandler.createLookupElement("fori", FORI, "indexed loop");

        InsertionContext context = new InsertionContext(project, editor, '\t', 2, 4);
        item.handleInsert(context);

        checkResult("x for (int <selection>i</selection> = 0; i < n; i++) {\n\t\n}");
        assertEquals(2 + "for (int i = 0; i < n; i++) {\n\t\n}".length(), context.getTailOffset());
        assertTrue(snippets().isActive(document));

        type("j");
        checkResult("x for (int j<caret> = 0; j < n; j++) {\n\t\n}");
    }

    @Test
    public void presentation() {
        LookupElement item = SnippetInsertHandler.createLookupElement("fori", FORI, "indexed loop");
        LookupElementPresentation presentation = new LookupElementPresentation();

        item.renderElement(presentation);

        assertEquals("fori", item.getLookupString());
        assertEquals("fori", presentation.getItemText());
        assertEquals("Snippet", presentation.getTypeText());
        assertEquals(" indexed loop", presentation.getTailText());
        assertEquals(FORI, item.getObject());
    }

    @Test
    public void previewText() {
        SnippetInsertHandler handler = new SnippetInsertHandler("${1:a} + ${2|b,c|}");
        assertEquals("a + b", handler.getPreviewText());
    }
}
