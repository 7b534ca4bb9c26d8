package com.tyron.snipj.core.snippet.marker;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One fragment of a transform's format string.
 */
public interface FormatPart {

    String toTemplateString();

    /**
     * Literal output text.
     */
    record Literal(String text) implements FormatPart {
        @Override
        public String toTemplateString() {
            StringBuilder sb = new StringBuilder(text.length());
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '$' || c == '/' || c == '\\') {
                    sb.append('\\');
                }
                sb.append(c);
            }
            return sb.toString();
        }
    }

    /**
     * A TextMate case escape: <code>&#92;U</code> and <code>&#92;L</code> apply until <code>&#92;E</code>; <code>&#92;u</code> and <code>&#92;l</code>
     * apply to the next character only.
     */
    record CaseSwitch(CaseMode mode) implements FormatPart {
        @Override
        public String toTemplateString() {
            return "\\" + mode.escape;
        }
    }

    /**
     * A capture group reference, optionally shaped or conditional.
     * <ul>
     *   <li>{@code $1}, {@code ${1}} - the group as is</li>
     *   <li>{@code ${1:/upcase}} - the group with a {@link Shape}</li>
     *   <li>{@code ${1:+yes}}, {@code ${1:?yes:no}}, {@code ${1:-no}} - text chosen by whether the group matched</li>
     * </ul>
     */
    record GroupReference(int group, Shape shape, @Nullable String ifValue, @Nullable String elseValue)
            implements FormatPart {

        public GroupReference(int group) {
            this(group, Shape.NONE, null, null);
        }

        public boolean isConditional() {
            return ifValue != null || elseValue != null;
        }

        public String resolve(@Nullable String captured) {
            boolean matched = captured != null && !captured.isEmpty();
            if (isConditional()) {
                String chosen = matched ? ifValue : elseValue;
                return chosen != null ? chosen : "";
            }
            return captured == null ? "" : shape.apply(captured);
        }

        @Override
        public String toTemplateString() {
            if (ifValue != null && elseValue != null) {
                return "${" + group + ":?" + escape(ifValue, ':') + ":" + escape(elseValue, '}') + "}";
            }
            if (ifValue != null) {
                return "${" + group + ":+" + escape(ifValue, '}') + "}";
            }
            if (elseValue != null) {
                return "${" + group + ":-" + escape(elseValue, '}') + "}";
            }
            if (shape != Shape.NONE) {
                return "${" + group + ":/" + shape.keyword + "}";
            }
            return "${" + group + "}";
        }

        private static String escape(String text, char terminator) {
            StringBuilder sb = new StringBuilder(text.length());
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == terminator || c == '}' || c == '\\') {
                    sb.append('\\');
                }
                sb.append(c);
            }
            return sb.toString();
        }
    }

    enum CaseMode {
        UPPER('U'),
        LOWER('L'),
        END('E'),
        NEXT_UPPER('u'),
        NEXT_LOWER('l');

        private final char escape;

        CaseMode(char escape) {
            this.escape = escape;
        }

        public static CaseMode forEscape(char c) {
            for (CaseMode mode : values()) {
                if (mode.escape == c) {
                    return mode;
                }
            }
            return null;
        }
    }

    enum Shape {
        NONE(""),
        UPCASE("upcase"),
        DOWNCASE("downcase"),
        CAPITALIZE("capitalize"),
        PASCALCASE("pascalcase"),
        CAMELCASE("camelcase");

        private static final Pattern WORD = Pattern.compile("[\\p{Alnum}]+");

        private final String keyword;

        Shape(String keyword) {
            this.keyword = keyword;
        }

        public static Shape forKeyword(String keyword) {
            for (Shape shape : values()) {
                if (shape != NONE && shape.keyword.equals(keyword)) {
                    return shape;
                }
            }
            return null;
        }

        public String apply(String value) {
            switch (this) {
                case UPCASE:
                    return value.toUpperCase(Locale.ROOT);
                case DOWNCASE:
                    return value.toLowerCase(Locale.ROOT);
                case CAPITALIZE:
                    return value.isEmpty() ? value : value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
                case PASCALCASE:
                    return joinWords(value, true);
                case CAMELCASE:
                    return joinWords(value, false);
                default:
                    return value;
            }
        }

        private static String joinWords(String value, boolean capitalizeFirst) {
            Matcher m = WORD.matcher(value);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                String word = m.group();
                if (sb.length() == 0 && !capitalizeFirst) {
                    sb.append(word.substring(0, 1).toLowerCase(Locale.ROOT)).append(word.substring(1));
                } else {
                    sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
                }
            }
            return sb.toString();
        }
    }
}
