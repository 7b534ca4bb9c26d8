package com.tyron.snipj.core.snippet;

import com.tyron.snipj.api.editor.Document;
import com.tyron.snipj.api.editor.DocumentListener;
import com.tyron.snipj.api.editor.Editor;
import com.tyron.snipj.api.editor.EditorManager;
import com.tyron.snipj.api.editor.ObservableDocument;
import com.tyron.snipj.api.project.Project;
import com.tyron.snipj.api.service.Disposable;
import com.tyron.snipj.api.snippet.SnippetManager;
import com.tyron.snipj.api.snippet.SnippetStatusIndicator;
import com.tyron.snipj.api.snippet.VariableResolver;
import com.tyron.snipj.core.service.ProjectServiceManager;
import com.tyron.snipj.core.snippet.marker.Snippet;
import com.tyron.snipj.core.snippet.parser.SnippetParser;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Project-scoped registry of snippet sessions, at most one per document.
 * <p>
 * While a session is registered, changes of its document are routed to
 * {@link SnippetSession#synchronizeUpdatedPlaceholders} and explicit caret moves in its editor to
 * {@link SnippetSession#checkPosition()}. A session is unregistered as soon as it finishes or is cancelled.
 * <p>
 * Variables are resolved by the project's {@link VariableResolver} extensions first,
 * then by {@link EditorVariableResolver}.
 */
public final class SnippetManagerImpl implements SnippetManager, Disposable {

    private static final Logger LOG = Logger.getLogger(SnippetManagerImpl.class.getName());

    public static SnippetManagerImpl getInstance(Project project) {
        return (SnippetManagerImpl) ProjectServiceManager.getService(project, SnippetManager.class);
    }

    private final Project project;

    private final Object lock = new Object();
    private final Map<Document, Registration> sessions = new IdentityHashMap<>();

    public SnippetManagerImpl(Project project) {
        this.project = Objects.requireNonNull(project, "project");
    }

    @Override
    public boolean insertSnippet(Editor editor, String body, boolean select, int offset) {
        Objects.requireNonNull(editor, "editor");
        Objects.requireNonNull(body, "body");
        if (!(editor.getDocument() instanceof ObservableDocument document)) {
            throw new IllegalArgumentException("Snippet sessions need an ObservableDocument: " + editor.getDocument());
        }

        Registration existing = getRegistration(document);
        if (existing != null) {
            existing.session.cancel();
        }

        SnippetSettings settings = SnippetSettings.of(project);
        SnippetSession session = new SnippetSession(editor, createResolver(editor), settings.isInsertFinalTabstop());
        if (!session.start(body, select, offset)) {
            return false;
        }

        Registration registration = new Registration(document, session);
        synchronized (lock) {
            sessions.put(document, registration);
        }
        registration.attach();
        session.addListener((ended, state) -> sessionEnded(registration));

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("snippetManager registered document=" + document + " tabstop=" + session.getActiveIndex());
        }
        showIndicator();
        return true;
    }

    @Override
    public boolean insertSnippet(Editor editor, String body) {
        int offset = editor.getCaretModel().getOffset();
        return insertSnippet(editor, body, SnippetSettings.of(project).isSelectOnInsert(), offset);
    }

    /**
     * Parses {@code body} with a final tabstop and resolves its variables for {@code editor}, without inserting it.
     */
    public Snippet resolveSnippet(String body, Editor editor) {
        Snippet snippet = new SnippetParser().parse(body, true);
        snippet.resolveVariables(createResolver(editor));
        return snippet;
    }

    @Override
    public boolean isActive(Document document) {
        SnippetSession session = getSession(document);
        return session != null && session.isActive();
    }

    /**
     * @return the session registered for the document, or null.
     */
    @Nullable
    public SnippetSession getSession(Document document) {
        Registration registration = getRegistration(document);
        return registration == null ? null : registration.session;
    }

    /**
     * @return the active session of the editor's document, or null.
     */
    @Nullable
    public SnippetSession getActiveSession(Editor editor) {
        SnippetSession session = getSession(editor.getDocument());
        return session != null && session.isActive() ? session : null;
    }

    @Override
    public void nextPlaceholder(Editor editor) {
        SnippetSession session = getActiveSession(editor);
        if (session == null) {
            hideIndicator();
            return;
        }
        session.nextPlaceholder();
    }

    @Override
    public void previousPlaceholder(Editor editor) {
        SnippetSession session = getActiveSession(editor);
        if (session == null) {
            hideIndicator();
            return;
        }
        session.previousPlaceholder();
    }

    @Override
    public void selectCurrentPlaceholder(Editor editor) {
        SnippetSession session = getActiveSession(editor);
        if (session != null) {
            session.selectCurrentPlaceholder();
        }
    }

    @Override
    public void checkPosition(Editor editor) {
        SnippetSession session = getActiveSession(editor);
        if (session != null) {
            session.checkPosition();
        }
    }

    @Override
    public void cancel(Editor editor) {
        SnippetSession session = getActiveSession(editor);
        if (session == null) {
            hideIndicator();
            return;
        }
        session.cancel();
    }

    /**
     * Drops the session of a closed editor.
     */
    public void editorReleased(Editor editor) {
        Registration registration = getRegistration(editor.getDocument());
        if (registration != null && registration.session.getEditor() == editor) {
            registration.session.cancel();
        }
    }

    /**
     * Shows the status indicator if the focused editor has an active session, hides it otherwise.
     */
    public void editorFocused(Editor editor) {
        if (isActive(editor.getDocument())) {
            showIndicator();
        } else {
            hideIndicator();
        }
    }

    @Override
    public void dispose() {
        List<Registration> registrations;
        synchronized (lock) {
            registrations = new ArrayList<>(sessions.values());
            sessions.clear();
        }
        for (Registration registration : registrations) {
            registration.detach();
            registration.session.cancel();
        }
    }

    private void sessionEnded(Registration registration) {
        boolean removed;
        synchronized (lock) {
            removed = sessions.remove(registration.document, registration);
        }
        registration.detach();
        if (!removed) {
            return;
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("snippetManager unregistered document=" + registration.document
                    + " state=" + registration.session.getState());
        }
        if (isFocused(registration.session.getEditor())) {
            hideIndicator();
        }
    }

    @Nullable
    private Registration getRegistration(Document document) {
        synchronized (lock) {
            return sessions.get(document);
        }
    }

    private boolean isFocused(Editor editor) {
        Editor focused = ProjectServiceManager.getService(project, EditorManager.class).getFocusedEditor();
        return focused == null || focused == editor;
    }

    private VariableResolver createResolver(Editor editor) {
        List<VariableResolver> resolvers =
                new ArrayList<>(ProjectServiceManager.getExtensions(project, VariableResolver.class));
        resolvers.add(EditorVariableResolver.forEditor(project, editor));
        return new CompositeVariableResolver(resolvers);
    }

    private void showIndicator() {
        String text = SnippetSettings.of(project).getStatusText();
        for (SnippetStatusIndicator indicator : indicators()) {
            indicator.show(text);
        }
    }

    private void hideIndicator() {
        for (SnippetStatusIndicator indicator : indicators()) {
            indicator.hide();
        }
    }

    private List<SnippetStatusIndicator> indicators() {
        return ProjectServiceManager.getExtensions(project, SnippetStatusIndicator.class);
    }

    /**
     * A registered session with the listeners that feed it.
     */
    private static final class Registration {
        private final ObservableDocument document;
        private final SnippetSession session;
        private final DocumentListener documentListener;
        private final Editor.CaretListener caretListener;

        Registration(ObservableDocument document, SnippetSession session) {
            this.document = document;
            this.session = session;
            this.documentListener = session::synchronizeUpdatedPlaceholders;
            this.caretListener = (editor, oldOffset, newOffset) -> session.checkPosition();
        }

        void attach() {
            document.addDocumentListener(documentListener);
            session.getEditor().getCaretModel().addCaretListener(caretListener);
        }

        void detach() {
            document.removeDocumentListener(documentListener);
            session.getEditor().getCaretModel().removeCaretListener(caretListener);
        }
    }
}
