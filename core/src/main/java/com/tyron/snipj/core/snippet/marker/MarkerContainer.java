package com.tyron.snipj.core.snippet.marker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A marker owning an ordered list of child markers.
 */
public abstract class MarkerContainer extends Marker {

    private final List<Marker> children = new ArrayList<>();

    @Override
    public final List<Marker> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Appends a child; adjacent {@link Text} children are merged.
     */
    public void appendChild(Marker child) {
        Objects.requireNonNull(child, "child");
        if (child instanceof Text text) {
            if (text.isEmpty()) {
                return;
            }
            if (!children.isEmpty() && children.get(children.size() - 1) instanceof Text last) {
                children.set(children.size() - 1, new Text(last.getValue() + text.getValue()));
                return;
            }
        }
        children.add(child);
    }

    /**
     * Replaces all children with a single text leaf holding {@code value}.
     */
    public void setTextContent(String value) {
        children.clear();
        children.add(new Text(value));
    }

    void replaceChild(Marker oldChild, Marker newChild) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == oldChild) {
                children.set(i, newChild);
                return;
            }
        }
        throw new IllegalArgumentException("Not a child of this marker: " + oldChild);
    }

    protected String renderChildren() {
        StringBuilder sb = new StringBuilder();
        for (Marker child : children) {
            sb.append(child.render());
        }
        return sb.toString();
    }

    protected String childrenToTemplateString() {
        StringBuilder sb = new StringBuilder();
        for (Marker child : children) {
            sb.append(child.toTemplateString());
        }
        return sb.toString();
    }
}
