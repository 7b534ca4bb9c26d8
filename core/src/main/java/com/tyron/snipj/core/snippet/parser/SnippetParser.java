package com.tyron.snipj.core.snippet.parser;

import com.tyron.snipj.core.snippet.marker.FormatPart;
import com.tyron.snipj.core.snippet.marker.Marker;
import com.tyron.snipj.core.snippet.marker.MarkerContainer;
import com.tyron.snipj.core.snippet.marker.Placeholder;
import com.tyron.snipj.core.snippet.marker.Snippet;
import com.tyron.snipj.core.snippet.marker.Text;
import com.tyron.snipj.core.snippet.marker.Transform;
import com.tyron.snipj.core.snippet.marker.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Parses textmate snippet syntax into a {@link Snippet}.
 * <pre>
 * any         ::= tabstop | placeholder | choice | variable | text
 * tabstop     ::= '$' int | '${' int '}' | '${' int transform '}'
 * placeholder ::= '${' int ':' any* '}'
 * choice      ::= '${' int '|' text (',' text)* '|}'
 * variable    ::= '$' var | '${' var '}' | '${' var ':' any* '}' | '${' var transform '}'
 * transform   ::= '/' regex '/' format '/' flags
 * </pre>
 * Parsing never fails. A {@code $} that does not start a valid construct is literal text, and a
 * {@code ${} left open until the end of the input turns everything from the {@code $} on into text.
 * <p>
 * Instances are not thread-safe; use one parser per thread.
 */
public final class SnippetParser {

    private String input = "";
    private int pos;

    /**
     * Same as {@code parse(template, false)}.
     */
    public Snippet parse(String template) {
        return parse(template, false);
    }

    /**
     * @param insertFinalTabstop append an empty {@code $0} when the template declares none
     */
    public Snippet parse(String template, boolean insertFinalTabstop) {
        this.input = template != null ? template : "";
        this.pos = 0;

        Snippet snippet = new Snippet();
        parseSequence(snippet, false);
        snippet.reindex();

        snippet.copyMirrorDefaults();

        if (insertFinalTabstop && !snippet.hasFinalTabstop()) {
            snippet.appendChild(new Placeholder(0));
        }
        snippet.reindex();
        return snippet;
    }

    /**
     * Escapes text so that it parses back into a single text marker.
     */
    public static String escape(String text) {
        return Text.escape(text);
    }

    /**
     * Reads markers into {@code parent} until the input ends or, when {@code nested}, until an unescaped closing brace.
     *
     * @return true if a closing brace ended the sequence
     */
    private boolean parseSequence(MarkerContainer parent, boolean nested) {
        StringBuilder text = new StringBuilder();
        while (hasRemaining()) {
            char c = peekChar();
            if (c == '\\') {
                pos++;
                if (hasRemaining() && isTextEscape(peekChar())) {
                    text.append(readChar());
                } else {
                    text.append('\\');
                }
            } else if (c == '}' && nested) {
                pos++;
                flushText(parent, text);
                return true;
            } else if (c == '$') {
                int dollar = pos;
                try {
                    Marker marker = parseDollarExpression();
                    flushText(parent, text);
                    parent.appendChild(marker);
                } catch (SnippetSyntaxException e) {
                    if (e.isUnterminated()) {
                        text.append(input, dollar, input.length());
                        pos = input.length();
                    } else {
                        text.append('$');
                        pos = dollar + 1;
                    }
                }
            } else {
                text.append(c);
                pos++;
            }
        }
        flushText(parent, text);
        return false;
    }

    private static boolean isTextEscape(char c) {
        return c == '$' || c == '}' || c == '\\';
    }

    private static void flushText(MarkerContainer parent, StringBuilder text) {
        if (text.length() > 0) {
            parent.appendChild(new Text(text.toString()));
            text.setLength(0);
        }
    }

    private Marker parseDollarExpression() throws SnippetSyntaxException {
        pos++; // '$'
        if (!hasRemaining()) {
            throw SnippetSyntaxException.mismatch("'$' at end of input");
        }
        char first = peekChar();
        if (isDigit(first)) {
            return new Placeholder(readIndex());
        }
        if (isVariableStart(first)) {
            return new Variable(readVariableName());
        }
        if (first == '{') {
            pos++;
            return parseBracedExpression();
        }
        throw SnippetSyntaxException.mismatch("no tabstop or variable after '$'");
    }

    private Marker parseBracedExpression() throws SnippetSyntaxException {
        requireRemaining();
        char first = peekChar();
        if (isDigit(first)) {
            return parseBracedTabstop(readIndex());
        }
        if (isVariableStart(first)) {
            return parseBracedVariable(readVariableName());
        }
        throw SnippetSyntaxException.mismatch("no tabstop or variable after '${'");
    }

    private Placeholder parseBracedTabstop(int index) throws SnippetSyntaxException {
        requireRemaining();
        char c = readChar();
        switch (c) {
            case '}':
                return new Placeholder(index);
            case ':': {
                Placeholder placeholder = new Placeholder(index);
                if (!parseSequence(placeholder, true)) {
                    throw SnippetSyntaxException.unterminated();
                }
                return placeholder;
            }
            case '|': {
                List<String> choices = parseChoices();
                return new Placeholder(index, choices, null);
            }
            case '/': {
                Transform transform = parseTransform();
                return new Placeholder(index, List.of(), transform);
            }
            default:
                throw SnippetSyntaxException.mismatch("unexpected '" + c + "' after tabstop index");
        }
    }

    private Variable parseBracedVariable(String name) throws SnippetSyntaxException {
        requireRemaining();
        char c = readChar();
        switch (c) {
            case '}':
                return new Variable(name);
            case ':': {
                Variable variable = new Variable(name);
                if (!parseSequence(variable, true)) {
                    throw SnippetSyntaxException.unterminated();
                }
                return variable;
            }
            case '/':
                return new Variable(name, parseTransform());
            default:
                throw SnippetSyntaxException.mismatch("unexpected '" + c + "' after variable name");
        }
    }

    /**
     * Reads {@code a,b,c|}} after the opening pipe.
     */
    private List<String> parseChoices() throws SnippetSyntaxException {
        List<String> choices = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        while (true) {
            requireRemaining();
            char c = readChar();
            if (c == '\\') {
                if (hasRemaining() && isChoiceEscape(peekChar())) {
                    current.append(readChar());
                } else {
                    current.append('\\');
                }
            } else if (c == ',') {
                choices.add(current.toString());
                current.setLength(0);
            } else if (c == '|') {
                choices.add(current.toString());
                requireRemaining();
                if (readChar() != '}') {
                    throw SnippetSyntaxException.mismatch("choice list must end with '|}'");
                }
                return choices;
            } else {
                current.append(c);
            }
        }
    }

    private static boolean isChoiceEscape(char c) {
        return c == ',' || c == '|' || c == '\\' || c == '$' || c == '}';
    }

    /**
     * Reads {@code regex/format/flags}} after the first slash.
     */
    private Transform parseTransform() throws SnippetSyntaxException {
        String regex = readRegex();
        List<FormatPart> format = parseFormat();

        StringBuilder flags = new StringBuilder();
        while (true) {
            requireRemaining();
            char c = readChar();
            if (c == '}') {
                break;
            }
            if (!Character.isLetter(c)) {
                throw SnippetSyntaxException.mismatch("invalid transform flag '" + c + "'");
            }
            flags.append(c);
        }

        try {
            return Transform.create(regex, format, flags.toString());
        } catch (PatternSyntaxException e) {
            throw SnippetSyntaxException.mismatch("invalid regex: " + e.getDescription());
        }
    }

    private String readRegex() throws SnippetSyntaxException {
        StringBuilder regex = new StringBuilder();
        while (true) {
            requireRemaining();
            char c = readChar();
            if (c == '/') {
                return regex.toString();
            }
            if (c == '\\' && hasRemaining()) {
                char next = readChar();
                if (next != '/') {
                    regex.append('\\');
                }
                regex.append(next);
            } else {
                regex.append(c);
            }
        }
    }

    private List<FormatPart> parseFormat() throws SnippetSyntaxException {
        List<FormatPart> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        while (true) {
            requireRemaining();
            char c = readChar();
            if (c == '/') {
                flushLiteral(parts, literal);
                return parts;
            }
            if (c == '\\') {
                requireRemaining();
                char next = readChar();
                FormatPart.CaseMode mode = FormatPart.CaseMode.forEscape(next);
                if (mode != null) {
                    flushLiteral(parts, literal);
                    parts.add(new FormatPart.CaseSwitch(mode));
                } else if (next == 'n') {
                    literal.append('\n');
                } else if (next == 't') {
                    literal.append('\t');
                } else if (next == '/' || next == '\\' || next == '$') {
                    literal.append(next);
                } else {
                    literal.append('\\').append(next);
                }
            } else if (c == '$') {
                int dollar = pos;
                try {
                    FormatPart reference = parseGroupReference();
                    flushLiteral(parts, literal);
                    parts.add(reference);
                } catch (SnippetSyntaxException e) {
                    if (e.isUnterminated()) {
                        throw e;
                    }
                    literal.append('$');
                    pos = dollar;
                }
            } else {
                literal.append(c);
            }
        }
    }

    private static void flushLiteral(List<FormatPart> parts, StringBuilder literal) {
        if (literal.length() > 0) {
            parts.add(new FormatPart.Literal(literal.toString()));
            literal.setLength(0);
        }
    }

    /**
     * Reads a back-reference after its {@code $}: {@code 1}, {@code {1}}, {@code {1:/upcase}},
     * {@code {1:+if}}, {@code {1:?if:else}}, {@code {1:-else}} or {@code {1:else}}.
     */
    private FormatPart parseGroupReference() throws SnippetSyntaxException {
        requireRemaining();
        if (isDigit(peekChar())) {
            return new FormatPart.GroupReference(readIndex());
        }
        if (peekChar() != '{') {
            throw SnippetSyntaxException.mismatch("no group after '$'");
        }
        pos++;
        requireRemaining();
        if (!isDigit(peekChar())) {
            throw SnippetSyntaxException.mismatch("no group after '${'");
        }
        int group = readIndex();
        requireRemaining();
        char c = readChar();
        if (c == '}') {
            return new FormatPart.GroupReference(group);
        }
        if (c != ':') {
            throw SnippetSyntaxException.mismatch("unexpected '" + c + "' in group reference");
        }

        requireRemaining();
        char kind = peekChar();
        if (kind == '/') {
            pos++;
            String keyword = readUntil('}');
            FormatPart.Shape shape = FormatPart.Shape.forKeyword(keyword);
            if (shape == null) {
                throw SnippetSyntaxException.mismatch("unknown case shape '" + keyword + "'");
            }
            return new FormatPart.GroupReference(group, shape, null, null);
        }
        if (kind == '+') {
            pos++;
            return new FormatPart.GroupReference(group, FormatPart.Shape.NONE, readUntil('}'), null);
        }
        if (kind == '?') {
            pos++;
            String ifValue = readUntil(':');
            String elseValue = readUntil('}');
            return new FormatPart.GroupReference(group, FormatPart.Shape.NONE, ifValue, elseValue);
        }
        if (kind == '-') {
            pos++;
        }
        return new FormatPart.GroupReference(group, FormatPart.Shape.NONE, null, readUntil('}'));
    }

    /**
     * Reads text up to and including {@code terminator}, honouring backslash escapes.
     *
     * @return the text without the terminator
     */
    private String readUntil(char terminator) throws SnippetSyntaxException {
        StringBuilder sb = new StringBuilder();
        while (true) {
            requireRemaining();
            char c = readChar();
            if (c == terminator) {
                return sb.toString();
            }
            if (c == '\\' && hasRemaining()) {
                sb.append(readChar());
            } else {
                sb.append(c);
            }
        }
    }

    private int readIndex() throws SnippetSyntaxException {
        int start = pos;
        while (hasRemaining() && isDigit(peekChar())) {
            pos++;
        }
        try {
            return Integer.parseInt(input.substring(start, pos));
        } catch (NumberFormatException e) {
            throw SnippetSyntaxException.mismatch("tabstop index out of range");
        }
    }

    private String readVariableName() {
        int start = pos;
        while (hasRemaining() && isVariablePart(peekChar())) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isVariableStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isVariablePart(char c) {
        return isVariableStart(c) || isDigit(c);
    }

    private void requireRemaining() throws SnippetSyntaxException {
        if (!hasRemaining()) {
            throw SnippetSyntaxException.unterminated();
        }
    }

    private boolean hasRemaining() {
        return pos < input.length();
    }

    private char peekChar() {
        return input.charAt(pos);
    }

    private char readChar() {
        return input.charAt(pos++);
    }
}
