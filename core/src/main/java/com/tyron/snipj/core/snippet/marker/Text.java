package com.tyron.snipj.core.snippet.marker;

import java.util.Objects;

/**
 * Immutable literal text.
 */
public final class Text extends Marker {

    private final String value;

    public Text(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public String render() {
        return value;
    }

    @Override
    public String toTemplateString() {
        return escape(value);
    }

    /**
     * Escapes the characters that are significant in snippet text: {@code $}, {@code \} and {@code &#125;}.
     */
    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '$' || c == '}' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Text('" + value + "')";
    }
}
