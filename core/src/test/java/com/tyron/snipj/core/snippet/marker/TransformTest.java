package com.tyron.snipj.core.snippet.marker;

import com.tyron.snipj.core.snippet.marker.FormatPart.CaseMode;
import com.tyron.snipj.core.snippet.marker.FormatPart.CaseSwitch;
import com.tyron.snipj.core.snippet.marker.FormatPart.GroupReference;
import com.tyron.snipj.core.snippet.marker.FormatPart.Literal;
import com.tyron.snipj.core.snippet.marker.FormatPart.Shape;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;

public class TransformTest {

    @Test
    public void replacesFirstMatchUnlessGlobal() {
        List<FormatPart> zero = List.of(new Literal("0"));

        assertEquals("f0o", Transform.create("o", zero, "").resolve("foo"));
        assertEquals("f00", Transform.create("o", zero, "g").resolve("foo"));
        assertEquals("bar", Transform.create("o", zero, "g").resolve("bar"));
    }

    @Test
    public void caseInsensitiveFlag() {
        Transform transform = Transform.create("HELLO", List.of(new Literal("x")), "i");
        assertEquals("say x", transform.resolve("say hello"));
    }

    @Test
    public void nextCharacterCaseEscape() {
        Transform transform = Transform.create("(\\w+)",
                List.of(new CaseSwitch(CaseMode.NEXT_UPPER), new GroupReference(1)), "g");
        assertEquals("Hello World", transform.resolve("hello world"));
    }

    @Test
    public void upperUntilEnd() {
        Transform transform = Transform.create("(\\w+) (\\w+)", List.of(
                new CaseSwitch(CaseMode.UPPER), new GroupReference(1), new CaseSwitch(CaseMode.END),
                new Literal("-"), new GroupReference(2)), "");
        assertEquals("AB-cd", transform.resolve("ab cd"));
    }

    @Test
    public void shapes() {
        assertEquals("HELLO", Shape.UPCASE.apply("hello"));
        assertEquals("hello", Shape.DOWNCASE.apply("HeLLo"));
        assertEquals("Hello", Shape.CAPITALIZE.apply("hello"));
        assertEquals("FooBarBaz", Shape.PASCALCASE.apply("foo-bar baz"));
        assertEquals("fooBarBaz", Shape.CAMELCASE.apply("foo-bar baz"));
        assertEquals("", Shape.CAPITALIZE.apply(""));
    }

    @Test
    public void conditionalReferences() {
        GroupReference ifElse = new GroupReference(1, Shape.NONE, "yes", "no");
        assertEquals("yes", ifElse.resolve("x"));
        assertEquals("no", ifElse.resolve(null));
        assertEquals("no", ifElse.resolve(""));

        Transform elseOnly = Transform.create("(x)?y",
                List.of(new GroupReference(1, Shape.NONE, null, "none")), "");
        assertEquals("none", elseOnly.resolve("y"));
        assertEquals("", elseOnly.resolve("xy"));
    }

    @Test
    public void missingGroupIsEmpty() {
        Transform transform = Transform.create("a", List.of(new GroupReference(3)), "");
        assertEquals("bc", transform.resolve("abc"));
    }

    @Test
    public void invalidRegexThrows() {
        assertThrows(PatternSyntaxException.class, () -> Transform.create("(", List.of(), ""));
    }

    @Test
    public void templateString() {
        Transform transform = Transform.create("a/b", List.of(new Literal("c"), new GroupReference(0, Shape.UPCASE, null, null)), "g");
        assertEquals("/a\\/b/c${0:/upcase}/g", transform.toTemplateString());
        assertTrue(transform.isGlobal());
    }
}
