package org.pragmatica.kakapo.tree;

/**
 * A child position of a composite node: either a nested {@link Node} or a {@link Text} slot.
 */
public interface Element {

    void appendTo(StringBuilder out);

    /**
     * Source text of this element, exactly as it will be serialized.
     */
    default String text() {
        var out = new StringBuilder();
        appendTo(out);
        return out.toString();
    }
}
