package com.tyron.snipj.core.snippet.marker;

import java.util.List;

/**
 * A node of a parsed snippet.
 * <p>
 * Markers only hold downward links. Parents, offsets and tabstop groups are kept by the owning
 * {@link Snippet}, which addresses every marker by its arena id (pre-order position).
 */
public abstract class Marker {

    int id = -1;

    /**
     * @return the slot of this marker in its snippet's arena, or -1 before the snippet was indexed.
     */
    public final int getId() {
        return id;
    }

    public List<Marker> getChildren() {
        return List.of();
    }

    /**
     * @return the text this marker contributes to the inserted snippet.
     */
    public abstract String render();

    /**
     * @return snippet syntax that parses back into an equivalent marker.
     */
    public abstract String toTemplateString();

    /**
     * Whether the rendered text of this marker is exactly the concatenation of its children,
     * so that children can be mapped to document offsets.
     */
    boolean rendersChildren() {
        return true;
    }
}
