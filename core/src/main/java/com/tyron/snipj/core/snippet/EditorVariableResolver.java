package com.tyron.snipj.core.snippet;

import com.tyron.snipj.api.editor.Document;
import com.tyron.snipj.api.editor.Editor;
import com.tyron.snipj.api.editor.FileDocumentManager;
import com.tyron.snipj.api.project.Project;
import com.tyron.snipj.api.snippet.Clipboard;
import com.tyron.snipj.api.snippet.VariableResolver;
import com.tyron.snipj.core.service.ApplicationServiceManager;
import com.tyron.snipj.core.service.ProjectServiceManager;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the TextMate snippet variables from an editor's state, its file, the clipboard and the clock.
 * <p>
 * Variables without a meaningful value (no selection, no word at the caret, no backing file) stay unresolved,
 * so the snippet's own default applies.
 */
public final class EditorVariableResolver implements VariableResolver {

    private final Editor editor;
    @Nullable
    private final Path file;
    @Nullable
    private final Clipboard clipboard;
    private final Clock clock;

    public EditorVariableResolver(Editor editor, @Nullable Path file, @Nullable Clipboard clipboard, Clock clock) {
        this.editor = Objects.requireNonNull(editor, "editor");
        this.file = file;
        this.clipboard = clipboard;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Resolver for an editor of the project, using the application clipboard and the system clock.
     */
    public static EditorVariableResolver forEditor(Project project, Editor editor) {
        FileDocumentManager documents = ProjectServiceManager.getService(project, FileDocumentManager.class);
        Path file = documents.getFile(editor.getDocument());
        Clipboard clipboard = ApplicationServiceManager.getService(Clipboard.class);
        return new EditorVariableResolver(editor, file, clipboard, Clock.systemDefaultZone());
    }

    @Override
    public Optional<String> resolve(String name) {
        switch (name) {
            case "TM_SELECTED_TEXT":
                return nonEmpty(editor.getSelectionModel().getSelectedText(editor.getDocument()));
            case "TM_CURRENT_LINE":
                return Optional.of(currentLine());
            case "TM_CURRENT_WORD":
                return nonEmpty(currentWord());
            case "TM_LINE_INDEX":
                return Optional.of(String.valueOf(lineIndex()));
            case "TM_LINE_NUMBER":
                return Optional.of(String.valueOf(lineIndex() + 1));
            case "TM_FILENAME":
                return fileName().map(Object::toString);
            case "TM_FILENAME_BASE":
                return fileName().map(Object::toString).map(EditorVariableResolver::stripExtension);
            case "TM_DIRECTORY":
                return Optional.ofNullable(file).map(Path::getParent).map(Path::toString);
            case "TM_FILEPATH":
                return Optional.ofNullable(file).map(Path::toString);
            case "CLIPBOARD":
                return clipboard == null ? Optional.empty() : nonEmpty(clipboard.getContents());
            case "UUID":
                return Optional.of(UUID.randomUUID().toString());
            default:
                return resolveDate(name);
        }
    }

    private Optional<String> resolveDate(String name) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        switch (name) {
            case "CURRENT_YEAR":
                return Optional.of(String.valueOf(now.getYear()));
            case "CURRENT_YEAR_SHORT":
                return Optional.of(twoDigits(now.getYear() % 100));
            case "CURRENT_MONTH":
                return Optional.of(twoDigits(now.getMonthValue()));
            case "CURRENT_DATE":
                return Optional.of(twoDigits(now.getDayOfMonth()));
            case "CURRENT_HOURS":
                return Optional.of(twoDigits(now.getHour()));
            case "CURRENT_MINUTES":
                return Optional.of(twoDigits(now.getMinute()));
            case "CURRENT_SECONDS":
                return Optional.of(twoDigits(now.getSecond()));
            case "CURRENT_DAY_NAME":
                return Optional.of(now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
            case "CURRENT_DAY_NAME_SHORT":
                return Optional.of(now.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH));
            case "CURRENT_MONTH_NAME":
                return Optional.of(now.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
            case "CURRENT_MONTH_NAME_SHORT":
                return Optional.of(now.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH));
            default:
                return Optional.empty();
        }
    }

    private int caretOffset() {
        Document document = editor.getDocument();
        return Math.max(0, Math.min(editor.getCaretModel().getOffset(), document.getTextLength()));
    }

    private int lineIndex() {
        String text = editor.getDocument().getText();
        int caret = caretOffset();
        int line = 0;
        for (int i = 0; i < caret; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private String currentLine() {
        String text = editor.getDocument().getText();
        int caret = caretOffset();
        int start = text.lastIndexOf('\n', caret - 1) + 1;
        int end = text.indexOf('\n', caret);
        if (end < 0) {
            end = text.length();
        }
        String line = text.substring(start, end);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private String currentWord() {
        String text = editor.getDocument().getText();
        int caret = caretOffset();
        int start = caret;
        while (start > 0 && isWordPart(text.charAt(start - 1))) {
            start--;
        }
        int end = caret;
        while (end < text.length() && isWordPart(text.charAt(end))) {
            end++;
        }
        return text.substring(start, end);
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private Optional<Path> fileName() {
        return Optional.ofNullable(file).map(Path::getFileName);
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String twoDigits(int value) {
        return value < 10 ? "0" + value : String.valueOf(value);
    }

    private static Optional<String> nonEmpty(@Nullable String value) {
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
