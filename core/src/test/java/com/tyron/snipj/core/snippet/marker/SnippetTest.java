package com.tyron.snipj.core.snippet.marker;

import com.tyron.snipj.api.editor.TextRange;
import com.tyron.snipj.api.snippet.VariableResolver;
import com.tyron.snipj.core.snippet.parser.SnippetParser;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SnippetTest {

    private static final VariableResolver NAMES = name -> Optional.ofNullable(Map.of("NAME", "ada").get(name));

    private static Snippet parse(String template) {
        return new SnippetParser().parse(template);
    }

    @Test
    public void computesOffsets() {
        Snippet snippet = parse("ab${1:cd}ef$0");

        assertEquals(16, snippet.computeOffsets(10));
        assertEquals(new TextRange(10, 16), snippet.getRange());

        Placeholder first = snippet.getPlaceholders().get(0);
        Placeholder last = snippet.getPlaceholders().get(1);
        assertEquals(new TextRange(12, 14), snippet.getRange(first));
        assertEquals(new TextRange(16, 16), snippet.getRange(last));
    }

    @Test
    public void idsFollowPreOrder() {
        Snippet snippet = parse("${1:a${2:b}}c");

        assertEquals(0, snippet.getId());
        for (int i = 0; i < snippet.getMarkers().size(); i++) {
            assertSame(snippet.getMarker(i), snippet.getMarkers().get(i));
            assertEquals(i, snippet.getMarker(i).getId());
        }
        Placeholder outer = snippet.getPlaceholders().get(0);
        Placeholder inner = snippet.getPlaceholders().get(1);
        assertSame(outer, snippet.getParent(inner));
        assertSame(snippet, snippet.getParent(outer));
        assertNull(snippet.getParent(snippet));
        assertEquals(2, snippet.getDepth(inner));
        assertTrue(snippet.isAncestor(outer, inner));
        assertFalse(snippet.isAncestor(inner, outer));
    }

    @Test
    public void derivedTextHasNoInnerSpans() {
        Snippet snippet = parse("${1:abc}${1/b/X/}");
        snippet.computeOffsets(0);

        Placeholder mirror = snippet.getPlaceholders().get(1);
        assertEquals("aXc", mirror.render());
        assertEquals(new TextRange(3, 6), snippet.getRange(mirror));
        assertNull(snippet.getRange(mirror.getChildren().get(0)));
    }

    @Test
    public void renderMatchesSpans() {
        Snippet snippet = parse("x ${1:one ${2:two}} $TM_X ${3|a,b|} ${1/o/0/g}");
        snippet.resolveVariables(VariableResolver.NONE);
        int end = snippet.computeOffsets(0);
        String text = snippet.render();

        assertEquals(text.length(), end);
        for (Marker marker : snippet.getMarkers()) {
            TextRange range = snippet.getRange(marker);
            if (range != null) {
                assertEquals(marker.render(), text.substring(range.getStartOffset(), range.getEndOffset()), marker.toString());
            }
        }
    }

    @Test
    public void replaceSwapsMarker() {
        Snippet snippet = parse("a$NAME b");
        Variable variable = (Variable) snippet.getChildren().get(1);

        snippet.replace(variable, new Text("x"));

        assertEquals("ax b", snippet.render());
        assertFalse(snippet.owns(variable));
        assertThrows(IllegalArgumentException.class, () -> snippet.replace(variable, new Text("y")));
    }

    @Test
    public void resolvesVariables() {
        Snippet snippet = parse("Hi ${NAME:you} ${OTHER:there} $MISSING${1:$NAME}");
        snippet.resolveVariables(NAMES);

        assertEquals("Hi ada there ada", snippet.render());
    }

    @Test
    public void resolvedVariableThroughTransform() {
        Snippet snippet = parse("${NAME/(.*)/${1:/capitalize}/}");
        snippet.resolveVariables(NAMES);

        assertEquals("Ada", snippet.render());
    }

    @Test
    public void setTextContentCollapsesChildren() {
        Snippet snippet = parse("${1:a${2:b}}");
        Placeholder outer = snippet.getPlaceholders().get(0);

        outer.setTextContent("z");
        snippet.reindex();

        assertEquals("z", snippet.render());
        assertEquals(1, snippet.getPlaceholders().size());
        assertEquals("${1:z}", snippet.toTemplateString());
    }
}
