package com.tyron.snipj.core.snippet.marker;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A numbered tabstop. Index 0 is the final caret position.
 * <p>
 * The plain value of a placeholder is its rendered children, or its first choice while it has no children.
 * The rendered text is that value passed through the {@link Transform}, if one is attached.
 */
public final class Placeholder extends MarkerContainer {

    private final int index;
    private final List<String> choices;
    @Nullable
    private final Transform transform;

    public Placeholder(int index) {
        this(index, List.of(), null);
    }

    public Placeholder(int index, List<String> choices, @Nullable Transform transform) {
        if (index < 0) {
            throw new IllegalArgumentException("index < 0: " + index);
        }
        this.index = index;
        this.choices = List.copyOf(choices);
        this.transform = transform;
    }

    public int getIndex() {
        return index;
    }

    public boolean isFinalTabstop() {
        return index == 0;
    }

    public List<String> getChoices() {
        return choices;
    }

    public boolean hasChoices() {
        return !choices.isEmpty();
    }

    @Nullable
    public Transform getTransform() {
        return transform;
    }

    public boolean hasTransform() {
        return transform != null;
    }

    /**
     * @return the untransformed value shared by every mirror of this tabstop.
     */
    public String getValue() {
        if (getChildren().isEmpty() && hasChoices()) {
            return choices.get(0);
        }
        return renderChildren();
    }

    /**
     * @return what this placeholder displays for the given group value.
     */
    public String renderValue(String value) {
        return transform != null ? transform.resolve(value) : value;
    }

    @Override
    public String render() {
        return renderValue(getValue());
    }

    @Override
    boolean rendersChildren() {
        return transform == null && !(getChildren().isEmpty() && hasChoices());
    }

    @Override
    public String toTemplateString() {
        if (transform != null) {
            return "${" + index + transform.toTemplateString() + "}";
        }
        if (hasChoices() && getChildren().isEmpty()) {
            StringBuilder sb = new StringBuilder("${").append(index).append('|');
            for (int i = 0; i < choices.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append(escapeChoice(choices.get(i)));
            }
            return sb.append("|}").toString();
        }
        if (getChildren().isEmpty()) {
            return "${" + index + "}";
        }
        return "${" + index + ":" + childrenToTemplateString() + "}";
    }

    private static String escapeChoice(String choice) {
        StringBuilder sb = new StringBuilder(choice.length());
        for (int i = 0; i < choice.length(); i++) {
            char c = choice.charAt(i);
            if (c == ',' || c == '|' || c == '\\' || c == '$' || c == '}') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Placeholder(" + index + ")";
    }
}
