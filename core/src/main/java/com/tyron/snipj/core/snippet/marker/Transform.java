package com.tyron.snipj.core.snippet.marker;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A regex substitution {@code /regex/format/flags} applied to the plain value of a placeholder or variable.
 * <p>
 * Resolving never mutates the input; the result is only displayed by the owning marker.
 */
public final class Transform {

    private final Pattern regex;
    private final List<FormatPart> format;
    private final String flags;
    private final boolean global;

    public Transform(Pattern regex, List<FormatPart> format, String flags) {
        this.regex = Objects.requireNonNull(regex, "regex");
        this.format = List.copyOf(format);
        this.flags = Objects.requireNonNull(flags, "flags");
        this.global = flags.indexOf('g') >= 0;
    }

    /**
     * Compiles {@code source} with the given flags. {@code i}, {@code m} and {@code s} map to the
     * matching {@link Pattern} flags, {@code g} replaces every match; other letters are ignored.
     *
     * @throws java.util.regex.PatternSyntaxException if the regex is invalid
     */
    public static Transform create(String source, List<FormatPart> format, String flags) {
        return new Transform(Pattern.compile(source, toPatternFlags(flags)), format, flags);
    }

    static int toPatternFlags(String flags) {
        int result = 0;
        for (int i = 0; i < flags.length(); i++) {
            switch (flags.charAt(i)) {
                case 'i':
                    result |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                    break;
                case 'm':
                    result |= Pattern.MULTILINE;
                    break;
                case 's':
                    result |= Pattern.DOTALL;
                    break;
                default:
                    break;
            }
        }
        return result;
    }

    public Pattern getRegex() {
        return regex;
    }

    public List<FormatPart> getFormat() {
        return format;
    }

    public String getFlags() {
        return flags;
    }

    public boolean isGlobal() {
        return global;
    }

    public String resolve(String value) {
        Matcher matcher = regex.matcher(value);
        StringBuilder out = new StringBuilder(value.length());
        int last = 0;
        while (matcher.find()) {
            out.append(value, last, matcher.start());
            out.append(format(matcher));
            last = matcher.end();
            if (!global) {
                break;
            }
        }
        out.append(value, last, value.length());
        return out.toString();
    }

    private String format(Matcher matcher) {
        CaseWriter writer = new CaseWriter();
        for (FormatPart part : format) {
            if (part instanceof FormatPart.Literal literal) {
                writer.write(literal.text());
            } else if (part instanceof FormatPart.CaseSwitch caseSwitch) {
                writer.switchCase(caseSwitch.mode());
            } else if (part instanceof FormatPart.GroupReference reference) {
                String captured = reference.group() <= matcher.groupCount() ? matcher.group(reference.group()) : null;
                writer.write(reference.resolve(captured));
            }
        }
        return writer.toString();
    }

    public String toTemplateString() {
        StringBuilder sb = new StringBuilder("/");
        String source = regex.pattern();
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\\' && i + 1 < source.length()) {
                sb.append(c).append(source.charAt(++i));
                continue;
            }
            if (c == '/') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('/');
        for (FormatPart part : format) {
            sb.append(part.toTemplateString());
        }
        return sb.append('/').append(flags).toString();
    }

    /**
     * Applies the TextMate case escapes to text as it is written.
     */
    private static final class CaseWriter {
        private final StringBuilder out = new StringBuilder();
        private FormatPart.CaseMode mode = FormatPart.CaseMode.END;
        private FormatPart.CaseMode pending;

        void switchCase(FormatPart.CaseMode newMode) {
            if (newMode == FormatPart.CaseMode.NEXT_UPPER || newMode == FormatPart.CaseMode.NEXT_LOWER) {
                pending = newMode;
            } else {
                mode = newMode;
            }
        }

        void write(String text) {
            if (text.isEmpty()) {
                return;
            }
            String shaped = text;
            if (mode == FormatPart.CaseMode.UPPER) {
                shaped = shaped.toUpperCase(Locale.ROOT);
            } else if (mode == FormatPart.CaseMode.LOWER) {
                shaped = shaped.toLowerCase(Locale.ROOT);
            }
            if (pending != null) {
                String first = shaped.substring(0, 1);
                first = pending == FormatPart.CaseMode.NEXT_UPPER
                        ? first.toUpperCase(Locale.ROOT)
                        : first.toLowerCase(Locale.ROOT);
                shaped = first + shaped.substring(1);
                pending = null;
            }
            out.append(shaped);
        }

        @Override
        public String toString() {
            return out.toString();
        }
    }
}
