package com.tyron.snipj.core.snippet;

import com.tyron.snipj.api.editor.Document;
import com.tyron.snipj.api.editor.DocumentEvent;
import com.tyron.snipj.api.editor.Editor;
import com.tyron.snipj.api.editor.TextRange;
import com.tyron.snipj.api.snippet.VariableResolver;
import com.tyron.snipj.core.snippet.marker.Marker;
import com.tyron.snipj.core.snippet.marker.Placeholder;
import com.tyron.snipj.core.snippet.marker.Snippet;
import com.tyron.snipj.core.snippet.marker.Text;
import com.tyron.snipj.core.snippet.parser.SnippetParser;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One live snippet expansion in an editor.
 * <p>
 * The session inserts the rendered snippet, then keeps its marker tree in step with the document:
 * edits inside a tabstop are written into the tree and copied to every mirror of that tabstop,
 * edits it cannot place cancel the session. Navigation walks the tabstops in ascending order and
 * ends at {@code $0}.
 * <p>
 * Not thread-safe. Events must be delivered one at a time, each after the previous one was handled.
 */
public final class SnippetSession {

    private static final Logger LOG = Logger.getLogger(SnippetSession.class.getName());

    private final Editor editor;
    private final VariableResolver variableResolver;
    private final boolean insertFinalTabstop;
    private final List<SnippetSessionListener> listeners = new CopyOnWriteArrayList<>();

    private SessionState state = SessionState.IDLE;
    private Snippet snippet;
    private PlaceholderGroupIndex groups;
    private int activeIndex = -1;

    /**
     * True while the session itself edits the document or moves the caret; events caused by that are ignored.
     */
    private boolean selfChange;

    public SnippetSession(Editor editor, VariableResolver variableResolver) {
        this(editor, variableResolver, true);
    }

    public SnippetSession(Editor editor, VariableResolver variableResolver, boolean insertFinalTabstop) {
        this.editor = Objects.requireNonNull(editor, "editor");
        this.variableResolver = Objects.requireNonNull(variableResolver, "variableResolver");
        this.insertFinalTabstop = insertFinalTabstop;
    }

    public void addListener(SnippetSessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(SnippetSessionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Parses {@code template}, resolves its variables and inserts the result at {@code offset}.
     * <p>
     * When the snippet has a tabstop other than {@code $0}, the session becomes active on the lowest one,
     * selecting its text if {@code selectOnInsert}, otherwise putting the caret after it. Otherwise the caret
     * goes to {@code $0} (or the end of the inserted text) and the session finishes immediately.
     *
     * @return true if the session is active
     * @throws IllegalStateException if the session was already started
     */
    public boolean start(String template, boolean selectOnInsert, int offset) {
        if (state != SessionState.IDLE) {
            throw new IllegalStateException("Snippet session already started, state=" + state);
        }
        Document document = editor.getDocument();

        Snippet parsed = new SnippetParser().parse(template, insertFinalTabstop);
        parsed.resolveVariables(variableResolver);
        String text = parsed.render();

        editDocument(() -> document.insertString(offset, text));

        this.snippet = parsed;
        snippet.computeOffsets(offset);
        groups = PlaceholderGroupIndex.build(snippet);

        if (!groups.hasNonFinalTabstops()) {
            activeIndex = 0;
            selectTabstop(0, selectOnInsert);
            transition(SessionState.FINISHED, "no tabstops");
            return false;
        }

        activeIndex = groups.getNavigationOrder().get(0);
        state = SessionState.ACTIVE;
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("snippetSession start offset=" + offset + " length=" + text.length()
                    + " tabstops=" + groups.getNavigationOrder() + " active=" + activeIndex);
        }
        selectTabstop(activeIndex, selectOnInsert);
        return true;
    }

    /**
     * Applies one document change to the snippet and updates the mirrors of the edited tabstop.
     */
    public void synchronizeUpdatedPlaceholders(DocumentEvent change) {
        synchronizeUpdatedPlaceholders(List.of(change));
    }

    /**
     * Applies document changes in order, each relative to the document as left by the previous one,
     * then updates mirrors once. If any change cannot be placed inside a single marker of the snippet,
     * the session is cancelled and no mirror is written.
     */
    public void synchronizeUpdatedPlaceholders(List<DocumentEvent> changes) {
        if (state != SessionState.ACTIVE || selfChange) {
            return;
        }

        Map<Integer, String> groupValues = new HashMap<>();
        for (DocumentEvent change : changes) {
            if (change.getDocument() != null && change.getDocument() != editor.getDocument()) {
                continue;
            }
            if (!applyChange(change, groupValues)) {
                transition(SessionState.CANCELLED, "edit outside tracked markers " + change);
                return;
            }
        }
        propagateMirrors(groupValues);
    }

    /**
     * Writes one change into the tree without touching the document.
     *
     * @return false if the change does not fall inside a single editable marker
     */
    private boolean applyChange(DocumentEvent change, Map<Integer, String> groupValues) {
        TextRange range = change.getRange();
        if (!snippet.getRange().contains(range)) {
            return false;
        }

        Placeholder target = findTargetPlaceholder(range);
        if (target != null) {
            if (target.hasTransform()) {
                // Transformed text cannot be mapped back to a value.
                return false;
            }
            String edited = splice(target.getValue(), snippet.getRange(target), change);
            if (edited == null) {
                return false;
            }
            target.setTextContent(edited);
            if (groups.isCanonical(target)) {
                groupValues.remove(target.getIndex());
            } else {
                groupValues.put(target.getIndex(), edited);
            }
            if (target.getIndex() != 0) {
                activeIndex = target.getIndex();
            }
        } else {
            Marker container = findTopLevelContainer(range);
            if (container == null) {
                return false;
            }
            String edited = splice(container.render(), snippet.getRange(container), change);
            if (edited == null) {
                return false;
            }
            snippet.replace(container, new Text(edited));
        }

        relayout();
        return true;
    }

    /**
     * The active tabstop if it contains the range, else the innermost placeholder containing it,
     * the first in document order on ties.
     */
    @Nullable
    private Placeholder findTargetPlaceholder(TextRange range) {
        Placeholder active = groups.getPrimary(activeIndex);
        if (active != null && !active.hasTransform()) {
            TextRange activeRange = snippet.getRange(active);
            if (activeRange != null && activeRange.contains(range)) {
                return active;
            }
        }

        Placeholder best = null;
        int bestDepth = -1;
        for (Placeholder placeholder : snippet.getPlaceholders()) {
            TextRange placeholderRange = snippet.getRange(placeholder);
            if (placeholderRange == null || !placeholderRange.contains(range)) {
                continue;
            }
            int depth = snippet.getDepth(placeholder);
            if (depth > bestDepth) {
                best = placeholder;
                bestDepth = depth;
            }
        }
        return best;
    }

    /**
     * The top-level text or variable containing the range, or null if the range crosses marker boundaries.
     */
    @Nullable
    private Marker findTopLevelContainer(TextRange range) {
        for (Marker child : snippet.getChildren()) {
            TextRange childRange = snippet.getRange(child);
            if (childRange != null && childRange.contains(range)) {
                return child instanceof Placeholder ? null : child;
            }
        }
        return null;
    }

    @Nullable
    private static String splice(String text, @Nullable TextRange span, DocumentEvent change) {
        if (span == null || span.getLength() != text.length()) {
            return null;
        }
        int from = change.getStartOffset() - span.getStartOffset();
        int to = change.getEndOffset() - span.getStartOffset();
        return text.substring(0, from) + change.getNewText() + text.substring(to);
    }

    /**
     * Rewrites every mirror whose value differs from its group's value until all groups agree.
     * A group's value is the canonical mirror's, unless another mirror of it was edited in this batch.
     */
    private void propagateMirrors(Map<Integer, String> groupValues) {
        int limit = snippet.getMarkers().size() + 1;
        for (int pass = 0; pass < limit; pass++) {
            if (!propagateOnce(groupValues)) {
                return;
            }
            if (state != SessionState.ACTIVE) {
                return;
            }
        }
        LOG.warning("snippetSession mirrors did not settle after " + limit + " passes");
    }

    private boolean propagateOnce(Map<Integer, String> groupValues) {
        for (Map.Entry<Integer, List<Placeholder>> group : groups.asMap().entrySet()) {
            List<Placeholder> members = group.getValue();
            Placeholder canonical = members.get(0);
            String value = groupValues.getOrDefault(group.getKey(), canonical.getValue());
            for (Placeholder member : members) {
                if (member.getValue().equals(value)) {
                    continue;
                }
                if (member != canonical && snippet.isAncestor(canonical, member)) {
                    // A mirror inside its own canonical mirror would grow forever.
                    continue;
                }
                writeMirror(member, value);
                return true;
            }
        }
        return false;
    }

    private void writeMirror(Placeholder mirror, String value) {
        Marker anchor = mirror;
        TextRange span = snippet.getRange(anchor);
        while (span == null) {
            anchor = Objects.requireNonNull(snippet.getParent(anchor), "untracked root");
            span = snippet.getRange(anchor);
        }
        String before = anchor.render();

        mirror.setTextContent(value);
        String after = anchor.render();
        relayout();

        if (!before.equals(after)) {
            TextRange target = span;
            editDocument(() -> editor.getDocument().replace(target.getStartOffset(), target.getEndOffset(), after));
        }
    }

    private void relayout() {
        snippet.reindex();
        snippet.computeOffsets(snippet.getStartOffset());
        groups = PlaceholderGroupIndex.build(snippet);
    }

    /**
     * Moves to the next tabstop. Leaving the last one activates {@code $0} and finishes the session.
     */
    public void nextPlaceholder() {
        if (state != SessionState.ACTIVE) {
            return;
        }
        int next = 0;
        for (int index : groups.getNavigationOrder()) {
            if (index != 0 && index > activeIndex) {
                next = index;
                break;
            }
        }
        activeIndex = next;
        selectTabstop(next, true);
        if (next == 0) {
            transition(SessionState.FINISHED, "reached final tabstop");
        }
    }

    /**
     * Moves to the previous tabstop; does nothing on the first one.
     */
    public void previousPlaceholder() {
        if (state != SessionState.ACTIVE) {
            return;
        }
        int previous = -1;
        for (int index : groups.getNavigationOrder()) {
            if (index != 0 && index < activeIndex) {
                previous = index;
            }
        }
        if (previous < 0) {
            return;
        }
        activeIndex = previous;
        selectTabstop(previous, true);
    }

    /**
     * Selects the active tabstop again, e.g. after the editor regained focus.
     */
    public void selectCurrentPlaceholder() {
        if (state != SessionState.ACTIVE) {
            return;
        }
        selectTabstop(activeIndex, true);
    }

    /**
     * Cancels the session when the caret is no longer inside the active tabstop.
     */
    public void checkPosition() {
        if (state != SessionState.ACTIVE || selfChange) {
            return;
        }
        TextRange range = getTabstopRange(activeIndex);
        int caret = editor.getCaretModel().getOffset();
        if (range == null || !range.containsOffset(caret)) {
            transition(SessionState.CANCELLED, "caret left tabstop caret=" + caret + " range=" + range);
        }
    }

    /**
     * Ends the session. The inserted text stays as it is.
     */
    public void cancel() {
        if (state.isTerminal()) {
            return;
        }
        transition(SessionState.CANCELLED, "cancelled");
    }

    /**
     * Same as {@link #cancel()}.
     */
    public void deactivate() {
        cancel();
    }

    private void selectTabstop(int index, boolean select) {
        TextRange range = getTabstopRange(index);
        if (range == null) {
            return;
        }
        selfChange = true;
        try {
            Editor.Selection selection = editor.getSelectionModel();
            if (select && !range.isEmpty()) {
                selection.setSelection(range.getStartOffset(), range.getEndOffset());
            } else {
                selection.removeSelection();
                editor.getCaretModel().moveToOffset(range.getEndOffset());
            }
            editor.scrollToCaret();
        } finally {
            selfChange = false;
        }
    }

    /**
     * @return the span of the tabstop's primary mirror; for a missing {@code $0}, the end of the snippet.
     */
    @Nullable
    public TextRange getTabstopRange(int index) {
        if (snippet == null) {
            return null;
        }
        Placeholder placeholder = groups.getPrimary(index);
        if (placeholder != null) {
            return snippet.getRange(placeholder);
        }
        return index == 0 ? TextRange.empty(snippet.getEndOffset()) : null;
    }

    private void editDocument(Runnable edit) {
        selfChange = true;
        try {
            edit.run();
        } finally {
            selfChange = false;
        }
    }

    private void transition(SessionState newState, String reason) {
        state = newState;
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("snippetSession " + newState.name().toLowerCase() + " reason=" + reason);
        }
        for (SnippetSessionListener listener : listeners) {
            listener.sessionEnded(this, newState);
        }
    }

    public SessionState getState() {
        return state;
    }

    public boolean isActive() {
        return state == SessionState.ACTIVE;
    }

    public Editor getEditor() {
        return editor;
    }

    /**
     * @return the tabstop the user is in, or -1 before the session started.
     */
    public int getActiveIndex() {
        return activeIndex;
    }

    @Nullable
    public Placeholder getCurrentPlaceholder() {
        return groups == null ? null : groups.getPrimary(activeIndex);
    }

    @Nullable
    public Snippet getSnippet() {
        return snippet;
    }

    @Nullable
    public PlaceholderGroupIndex getGroups() {
        return groups;
    }

    /**
     * @return the document span of the inserted snippet, or null before start.
     */
    @Nullable
    public TextRange getRange() {
        return snippet == null ? null : snippet.getRange();
    }
}
