package com.tyron.snipj.core.editor;

import com.tyron.snipj.api.editor.Document;
import com.tyron.snipj.api.editor.Editor;
import com.tyron.snipj.api.editor.EditorManager;
import com.tyron.snipj.api.editor.EditorManagerListener;
import com.tyron.snipj.api.project.Project;
import com.tyron.snipj.api.service.Disposable;
import com.tyron.snipj.core.service.ProjectServiceManager;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Core implementation of {@link EditorManager}.
 *
 * This is a non-UI editor registry. Lifecycle changes are forwarded to {@link EditorManagerListener} extensions.
 */
public final class EditorManagerImpl implements EditorManager, Disposable {

    public static EditorManagerImpl getInstance(Project project) {
        return (EditorManagerImpl) ProjectServiceManager.getService(project, EditorManager.class);
    }

    private final Project project;
    private final FileDocumentManagerImpl fileDocumentManager;

    private final Object lock = new Object();
    private final Map<Document, List<Editor>> editorsByDocument = new IdentityHashMap<>();
    private final List<Editor> allEditors = new ArrayList<>();
    private Editor focusedEditor;

    public EditorManagerImpl(Project project) {
        this.project = Objects.requireNonNull(project, "project");
        this.fileDocumentManager = FileDocumentManagerImpl.getInstance(project);
    }

    @Override
    public Editor openEditor(Path file) throws IOException {
        Document doc = fileDocumentManager.getDocument(file);
        return createEditor(doc);
    }

    @Override
    public Editor createEditor(Document document) {
        Objects.requireNonNull(document, "document");
        Editor editor = new SimpleEditor(document);

        synchronized (lock) {
            allEditors.add(editor);
            editorsByDocument.computeIfAbsent(document, d -> new ArrayList<>()).add(editor);
        }

        for (EditorManagerListener listener : listeners()) {
            listener.editorCreated(editor);
        }
        return editor;
    }

    @Override
    public void releaseEditor(Editor editor) {
        Objects.requireNonNull(editor, "editor");

        synchronized (lock) {
            if (!allEditors.remove(editor)) {
                return;
            }
            List<Editor> list = editorsByDocument.get(editor.getDocument());
            if (list != null) {
                list.remove(editor);
                if (list.isEmpty()) {
                    editorsByDocument.remove(editor.getDocument());
                }
            }
            if (focusedEditor == editor) {
                focusedEditor = null;
            }
        }

        if (editor instanceof Disposable disposable) {
            disposable.dispose();
        }
        for (EditorManagerListener listener : listeners()) {
            listener.editorReleased(editor);
        }
    }

    @Override
    public void focusEditor(Editor editor) {
        Objects.requireNonNull(editor, "editor");
        synchronized (lock) {
            if (!allEditors.contains(editor)) {
                throw new IllegalArgumentException("Editor is not managed by this project");
            }
            focusedEditor = editor;
        }
        for (EditorManagerListener listener : listeners()) {
            listener.editorFocused(editor);
        }
    }

    @Override
    public Editor getFocusedEditor() {
        synchronized (lock) {
            return focusedEditor;
        }
    }

    @Override
    public List<Editor> getEditors(Document document) {
        Objects.requireNonNull(document, "document");
        synchronized (lock) {
            List<Editor> list = editorsByDocument.get(document);
            return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
        }
    }

    @Override
    public List<Editor> getAllEditors() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(allEditors));
        }
    }

    @Override
    public void dispose() {
        for (Editor editor : getAllEditors()) {
            if (editor instanceof Disposable disposable) {
                disposable.dispose();
            }
        }
        synchronized (lock) {
            allEditors.clear();
            editorsByDocument.clear();
            focusedEditor = null;
        }
    }

    private List<EditorManagerListener> listeners() {
        return ProjectServiceManager.getExtensions(project, EditorManagerListener.class);
    }
}
