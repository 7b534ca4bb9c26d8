package com.tyron.snipj.core.snippet;

import com.tyron.snipj.core.snippet.marker.Placeholder;
import com.tyron.snipj.core.snippet.marker.Snippet;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps each tabstop index to the placeholders ("mirrors") sharing it, by marker id, in document order.
 * <p>
 * The first mirror of an index is canonical: its value is authoritative for the whole group.
 * The index is a snapshot; rebuild it whenever the snippet is reindexed.
 */
public final class PlaceholderGroupIndex {

    private final Snippet snippet;
    private final TreeMap<Integer, List<Integer>> members = new TreeMap<>();

    private PlaceholderGroupIndex(Snippet snippet) {
        this.snippet = snippet;
    }

    public static PlaceholderGroupIndex build(Snippet snippet) {
        PlaceholderGroupIndex index = new PlaceholderGroupIndex(snippet);
        for (Placeholder placeholder : snippet.getPlaceholders()) {
            index.members.computeIfAbsent(placeholder.getIndex(), k -> new ArrayList<>()).add(placeholder.getId());
        }
        return index;
    }

    public boolean contains(int index) {
        return members.containsKey(index);
    }

    /**
     * @return tabstop indices in ascending order, including 0 when present.
     */
    public List<Integer> getIndices() {
        return List.copyOf(members.keySet());
    }

    /**
     * Ascending indices other than 0, followed by 0, which is always the terminal stop even when the
     * snippet has no {@code $0} marker.
     */
    public List<Integer> getNavigationOrder() {
        List<Integer> order = new ArrayList<>();
        for (Integer index : members.keySet()) {
            if (index != 0) {
                order.add(index);
            }
        }
        order.add(0);
        return Collections.unmodifiableList(order);
    }

    public boolean hasNonFinalTabstops() {
        return members.keySet().stream().anyMatch(index -> index != 0);
    }

    public List<Placeholder> getMembers(int index) {
        List<Integer> ids = members.get(index);
        if (ids == null) {
            return List.of();
        }
        List<Placeholder> result = new ArrayList<>(ids.size());
        for (int id : ids) {
            result.add((Placeholder) snippet.getMarker(id));
        }
        return result;
    }

    public boolean isMirrored(int index) {
        List<Integer> ids = members.get(index);
        return ids != null && ids.size() > 1;
    }

    @Nullable
    public Placeholder getCanonical(int index) {
        List<Integer> ids = members.get(index);
        return ids == null ? null : (Placeholder) snippet.getMarker(ids.get(0));
    }

    public boolean isCanonical(Placeholder placeholder) {
        return getCanonical(placeholder.getIndex()) == placeholder;
    }

    /**
     * The mirror the caret goes to: the canonical one unless it shows transformed text,
     * then the first untransformed mirror, if any.
     */
    @Nullable
    public Placeholder getPrimary(int index) {
        Placeholder canonical = getCanonical(index);
        if (canonical == null || !canonical.hasTransform()) {
            return canonical;
        }
        for (Placeholder member : getMembers(index)) {
            if (!member.hasTransform()) {
                return member;
            }
        }
        return canonical;
    }

    /**
     * @return groups keyed by index, for iteration in ascending index order.
     */
    public Map<Integer, List<Placeholder>> asMap() {
        Map<Integer, List<Placeholder>> result = new TreeMap<>();
        for (Integer index : members.keySet()) {
            result.put(index, getMembers(index));
        }
        return result;
    }
}
