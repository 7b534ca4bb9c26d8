package com.tyron.snipj.core.snippet.marker;

import com.tyron.snipj.api.snippet.VariableResolver;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * A named value such as {@code $TM_FILENAME}. Its children are the default used when the name is unresolved.
 */
public final class Variable extends MarkerContainer {

    private final String name;
    @Nullable
    private final Transform transform;

    public Variable(String name) {
        this(name, null);
    }

    public Variable(String name, @Nullable Transform transform) {
        this.name = Objects.requireNonNull(name, "name");
        this.transform = transform;
    }

    public String getName() {
        return name;
    }

    @Nullable
    public Transform getTransform() {
        return transform;
    }

    /**
     * Asks the resolver for this variable's value and, when one is known, replaces the default children with it.
     * The resolver is asked even when a default is declared; a resolved value always wins over the default.
     *
     * @return true if the resolver knew the variable
     */
    public boolean resolve(VariableResolver resolver) {
        Optional<String> value = resolver.resolve(name);
        if (value.isEmpty()) {
            return false;
        }
        setTextContent(value.get());
        return true;
    }

    @Override
    public String render() {
        String value = renderChildren();
        return transform != null ? transform.resolve(value) : value;
    }

    @Override
    boolean rendersChildren() {
        return transform == null;
    }

    @Override
    public String toTemplateString() {
        if (transform != null) {
            return "${" + name + transform.toTemplateString() + "}";
        }
        if (getChildren().isEmpty()) {
            return "${" + name + "}";
        }
        return "${" + name + ":" + childrenToTemplateString() + "}";
    }

    @Override
    public String toString() {
        return "Variable(" + name + ")";
    }
}
