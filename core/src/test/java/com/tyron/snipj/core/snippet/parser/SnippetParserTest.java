package com.tyron.snipj.core.snippet.parser;

import com.tyron.snipj.core.snippet.marker.Marker;
import com.tyron.snipj.core.snippet.marker.Placeholder;
import com.tyron.snipj.core.snippet.marker.Snippet;
import com.tyron.snipj.core.snippet.marker.Text;
import com.tyron.snipj.core.snippet.marker.Variable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SnippetParserTest {

    private static Snippet parse(String template) {
        return new SnippetParser().parse(template);
    }

    @Test
    public void plainText() {
        Snippet snippet = parse("hello world");

        assertEquals("hello world", snippet.render());
        assertEquals(1, snippet.getChildren().size());
        assertInstanceOf(Text.class, snippet.getChildren().get(0));
    }

    @Test
    public void emptyTemplate() {
        Snippet snippet = parse("");
        assertEquals("", snippet.render());
        assertTrue(snippet.getChildren().isEmpty());
    }

    @Test
    public void tabstopsPlaceholdersAndMirrors() {
        Snippet snippet = parse("for (${1:i} = 0; $1 < ${2:n}; $1++) {\n\t$0\n}");

        assertEquals("for (i = 0; i < n; i++) {\n\t\n}", snippet.render());
        List<Placeholder> placeholders = snippet.getPlaceholders();
        assertEquals(5, placeholders.size());
        assertEquals(List.of(1, 1, 2, 1, 0), placeholders.stream().map(Placeholder::getIndex).toList());
    }

    @Test
    public void nestedPlaceholder() {
        Snippet snippet = parse("${1:outer ${2:inner}}");

        Placeholder outer = (Placeholder) snippet.getChildren().get(0);
        assertEquals(2, outer.getChildren().size());
        assertEquals("outer ", ((Text) outer.getChildren().get(0)).getValue());
        assertEquals(2, ((Placeholder) outer.getChildren().get(1)).getIndex());
        assertEquals("outer inner", snippet.render());
    }

    @Test
    public void choices() {
        Snippet snippet = parse("${1|red,green,blue|}");

        Placeholder choice = (Placeholder) snippet.getChildren().get(0);
        assertEquals(List.of("red", "green", "blue"), choice.getChoices());
        assertTrue(choice.getChildren().isEmpty());
        assertEquals("red", snippet.render());
    }

    @Test
    public void choiceEscapes() {
        Placeholder choice = (Placeholder) parse("${1|a\\,b,c\\|d|}").getChildren().get(0);
        assertEquals(List.of("a,b", "c|d"), choice.getChoices());
    }

    @Test
    public void variables() {
        Snippet snippet = parse("$TM_FILENAME ${USER:anon}");

        Variable file = (Variable) snippet.getChildren().get(0);
        Variable user = (Variable) snippet.getChildren().get(2);
        assertEquals("TM_FILENAME", file.getName());
        assertEquals("USER", user.getName());
        assertEquals(" anon", snippet.render());
    }

    @Test
    public void textEscapes() {
        Snippet snippet = parse("\\$1 \\} \\\\ \\x");

        assertEquals("$1 } \\ \\x", snippet.render());
        assertTrue(snippet.getPlaceholders().isEmpty());
    }

    @Test
    public void unterminatedPlaceholderBecomesText() {
        Snippet snippet = parse("a ${1:foo");

        assertEquals("a ${1:foo", snippet.render());
        assertTrue(snippet.getPlaceholders().isEmpty());
    }

    @Test
    public void strayDollarIsLiteral() {
        Snippet snippet = parse("cost: $ 5 and ${ x} $");

        assertEquals("cost: $ 5 and ${ x} $", snippet.render());
        assertTrue(snippet.getPlaceholders().isEmpty());
    }

    @Test
    public void invalidRegexIsLiteral() {
        Snippet snippet = parse("${1/(/x/}");

        assertEquals("${1/(/x/}", snippet.render());
        assertTrue(snippet.getPlaceholders().isEmpty());
    }

    @Test
    public void placeholderAfterMalformedText() {
        Snippet snippet = parse("$ ${1:a}");

        assertEquals("$ a", snippet.render());
        assertEquals(1, snippet.getPlaceholders().size());
    }

    @Test
    public void finalTabstopAppendedOnRequest() {
        Snippet snippet = new SnippetParser().parse("a$1", true);

        List<Marker> children = snippet.getChildren();
        Placeholder last = (Placeholder) children.get(children.size() - 1);
        assertTrue(last.isFinalTabstop());

        Snippet withFinal = new SnippetParser().parse("a$0b$1", true);
        assertEquals(1, withFinal.getPlaceholders().stream().filter(Placeholder::isFinalTabstop).count());

        assertFalse(parse("a$1").hasFinalTabstop());
    }

    @Test
    public void transformMirror() {
        Snippet snippet = parse("${1:foo} ${1/(.*)/${1:/upcase}/}");

        assertEquals("foo FOO", snippet.render());
        Placeholder mirror = snippet.getPlaceholders().get(1);
        assertTrue(mirror.hasTransform());
        assertEquals("foo", mirror.getValue());
    }

    @Test
    public void singleCharacterCaseEscapes() {
        assertEquals("helloHello", parse("${1:hello}${1/(.*)/\\u$1/}").render());
        assertEquals("HELLOhELLO", parse("${1:HELLO}${1/(.*)/\\l$1/}").render());
    }

    @Test
    public void conditionalFormat() {
        assertEquals("fooyes", parse("${1:foo}${1/(f)?oo/${1:?yes:no}/}").render());
        assertEquals("barbar", parse("${1:bar}${1/(f)?oo/${1:?yes:no}/}").render());
    }

    @Test
    public void emptyMirrorsTakeNestedDefault() {
        Snippet snippet = parse("${1:${2:x}} $1 $2");
        assertEquals("x x x", snippet.render());
    }

    @Test
    public void laterMirrorsTakeFirstDefault() {
        Snippet snippet = parse("${1:foo} and ${1:bar ${2:x}} ${1|a,b|}");

        assertEquals("foo and foo foo", snippet.render());
        assertEquals(List.of(1, 1, 1), snippet.getPlaceholders().stream().map(Placeholder::getIndex).toList());
    }

    @Test
    public void mirrorInsideItsSourceKeepsItsValue() {
        assertEquals("a b", parse("${1:a ${1:b}}").render());
    }

    @Test
    public void renderOfLiteralSnippetParsesBackToSameRender() {
        String rendered = parse("a ${1:b} c $2 ${3|x,y|}").render();

        assertEquals("a b c  x", rendered);
        assertEquals(rendered, parse(rendered).render());
    }

    @Test
    public void renderOfResolvedSnippetParsesBackToSameRender() {
        Snippet snippet = parse("${NAME:you} says ${1:$NAME} ${UNKNOWN:there}");
        snippet.resolveVariables(name -> "NAME".equals(name) ? Optional.of("ada") : Optional.empty());
        String rendered = snippet.render();

        assertEquals("ada says ada there", rendered);
        Snippet reparsed = parse(rendered);
        assertEquals(rendered, reparsed.render());
        assertTrue(reparsed.getPlaceholders().isEmpty());
    }

    @Test
    public void variableTransform() {
        Snippet snippet = parse("${TM_FILENAME/(.*)\\..+$/$1/}");

        Variable variable = (Variable) snippet.getChildren().get(0);
        assertNotNull(variable.getTransform());
        assertEquals("(.*)\\..+$", variable.getTransform().getRegex().pattern());
    }

    @Test
    public void toTemplateStringKeepsStructure() {
        String template = "${1:a} ${2|x,y|} ${FOO} ${3/a/b/g} \\$";
        assertEquals(template, parse(template).toTemplateString());
        assertEquals("${1} ${FOO}", parse("$1 $FOO").toTemplateString());
    }

    @Test
    public void escapeProducesLiteralText() {
        String text = "a$b}c\\d";

        assertEquals("a\\$b\\}c\\\\d", SnippetParser.escape(text));
        Snippet snippet = parse(SnippetParser.escape(text));
        assertEquals(text, snippet.render());
        assertTrue(snippet.getPlaceholders().isEmpty());
    }
}
