package com.tyron.snipj.core.snippet.marker;

import com.tyron.snipj.api.editor.TextRange;
import com.tyron.snipj.api.snippet.VariableResolver;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of a parsed snippet and arena of all its markers.
 * <p>
 * Every marker reachable from the root gets an id equal to its pre-order position; parent links and
 * document spans are stored here by id rather than on the markers. Call {@link #reindex()} after any
 * structural change and {@link #computeOffsets(int)} after any change of rendered text.
 */
public final class Snippet extends MarkerContainer {

    private final List<Marker> markers = new ArrayList<>();
    private int[] parents = new int[0];
    private int[] starts = new int[0];
    private int[] ends = new int[0];
    private int startOffset;

    @Override
    public String render() {
        return renderChildren();
    }

    @Override
    public String toTemplateString() {
        return childrenToTemplateString();
    }

    /**
     * Rebuilds the arena from the current tree. Offsets are reset and must be recomputed.
     */
    public void reindex() {
        for (Marker marker : markers) {
            marker.id = -1;
        }
        markers.clear();
        List<Integer> parentIds = new ArrayList<>();
        collect(this, -1, parentIds);

        parents = new int[markers.size()];
        for (int i = 0; i < parents.length; i++) {
            parents[i] = parentIds.get(i);
        }
        starts = new int[markers.size()];
        ends = new int[markers.size()];
        Arrays.fill(starts, -1);
        Arrays.fill(ends, -1);
    }

    private void collect(Marker marker, int parentId, List<Integer> parentIds) {
        marker.id = markers.size();
        markers.add(marker);
        parentIds.add(parentId);
        for (Marker child : marker.getChildren()) {
            collect(child, marker.id, parentIds);
        }
    }

    /**
     * Assigns each marker its half-open span in a document where the snippet text starts at {@code startOffset}.
     * Children of a marker whose text is derived (a transform, or a choice shown by default) get no span.
     *
     * @return the end offset of the snippet
     */
    public int computeOffsets(int startOffset) {
        if (markers.isEmpty() || markers.get(0) != this) {
            reindex();
        }
        this.startOffset = startOffset;
        return layout(this, startOffset);
    }

    private int layout(Marker marker, int offset) {
        starts[marker.id] = offset;
        int end = offset;
        if (marker instanceof Text text) {
            end += text.length();
        } else if (marker.rendersChildren()) {
            for (Marker child : marker.getChildren()) {
                end = layout(child, end);
            }
        } else {
            end += marker.render().length();
            for (Marker child : marker.getChildren()) {
                untrack(child);
            }
        }
        ends[marker.id] = end;
        return end;
    }

    private void untrack(Marker marker) {
        starts[marker.id] = -1;
        ends[marker.id] = -1;
        for (Marker child : marker.getChildren()) {
            untrack(child);
        }
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return ends.length == 0 ? startOffset : ends[0];
    }

    public TextRange getRange() {
        return new TextRange(getStartOffset(), getEndOffset());
    }

    /**
     * @return the document span of the marker, or null if it is not part of this snippet or has no span.
     */
    @Nullable
    public TextRange getRange(Marker marker) {
        if (!owns(marker) || starts[marker.id] < 0) {
            return null;
        }
        return new TextRange(starts[marker.id], ends[marker.id]);
    }

    public boolean owns(Marker marker) {
        return marker.id >= 0 && marker.id < markers.size() && markers.get(marker.id) == marker;
    }

    /**
     * @return all markers in pre-order; index {@code i} holds the marker with id {@code i}.
     */
    public List<Marker> getMarkers() {
        return Collections.unmodifiableList(markers);
    }

    public Marker getMarker(int id) {
        return markers.get(id);
    }

    @Nullable
    public MarkerContainer getParent(Marker marker) {
        if (!owns(marker) || parents[marker.id] < 0) {
            return null;
        }
        return (MarkerContainer) markers.get(parents[marker.id]);
    }

    public int getDepth(Marker marker) {
        int depth = 0;
        int current = marker.id;
        while (parents[current] >= 0) {
            current = parents[current];
            depth++;
        }
        return depth;
    }

    public boolean isAncestor(Marker ancestor, Marker marker) {
        int current = parents[marker.id];
        while (current >= 0) {
            if (current == ancestor.id) {
                return true;
            }
            current = parents[current];
        }
        return false;
    }

    /**
     * @return every placeholder in document order.
     */
    public List<Placeholder> getPlaceholders() {
        List<Placeholder> result = new ArrayList<>();
        for (Marker marker : markers) {
            if (marker instanceof Placeholder placeholder) {
                result.add(placeholder);
            }
        }
        return result;
    }

    public boolean hasFinalTabstop() {
        for (Placeholder placeholder : getPlaceholders()) {
            if (placeholder.isFinalTabstop()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces a marker in its parent. The snippet is reindexed afterwards.
     */
    public void replace(Marker oldMarker, Marker newMarker) {
        MarkerContainer parent = getParent(oldMarker);
        if (parent == null) {
            throw new IllegalArgumentException("Cannot replace " + oldMarker + ": not a child marker of this snippet");
        }
        parent.replaceChild(oldMarker, newMarker);
        reindex();
    }

    /**
     * Fills every variable from the resolver. Resolved variables show the resolved value; the others keep
     * their declared default, or render empty. Mirrors are then refreshed from their sources.
     * This runs once before the first insertion.
     */
    public void resolveVariables(VariableResolver resolver) {
        resolveIn(this, resolver);
        reindex();
        copyMirrorDefaults();
    }

    /**
     * Gives every placeholder the value of the first untransformed placeholder of the same index that has
     * content. Later mirrors lose their own defaults, nested tabstops included. Runs until stable so that
     * defaults nested inside other defaults settle. The snippet is reindexed afterwards.
     */
    public void copyMirrorDefaults() {
        int limit = (markers.size() + 1) * (markers.size() + 1);
        for (int round = 0; round < limit; round++) {
            boolean changed = copyFirstMirrorDefault();
            reindex();
            if (!changed) {
                return;
            }
        }
    }

    private boolean copyFirstMirrorDefault() {
        List<Placeholder> placeholders = getPlaceholders();
        Map<Integer, Placeholder> sources = new HashMap<>();
        for (Placeholder placeholder : placeholders) {
            boolean hasContent = !placeholder.getChildren().isEmpty() || placeholder.hasChoices();
            if (hasContent && !placeholder.hasTransform()) {
                sources.putIfAbsent(placeholder.getIndex(), placeholder);
            }
        }
        for (Placeholder mirror : placeholders) {
            Placeholder source = sources.get(mirror.getIndex());
            if (source == null || source == mirror || isAncestor(source, mirror) || isAncestor(mirror, source)) {
                continue;
            }
            String value = source.getValue();
            if (!mirror.getValue().equals(value)) {
                mirror.setTextContent(value);
                return true;
            }
        }
        return false;
    }

    private static void resolveIn(Marker container, VariableResolver resolver) {
        for (Marker child : new ArrayList<>(container.getChildren())) {
            if (child instanceof Variable variable && variable.resolve(resolver)) {
                continue;
            }
            resolveIn(child, resolver);
        }
    }
}
