package org.pragmatica.kakapo.tree;

import org.pragmatica.kakapo.error.StructuralAssumptionViolation;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Concrete syntax tree node.
 *
 * <p>The tree is lossless: {@link #text()} of a freshly parsed tree reproduces
 * the parsed input byte for byte. Every node knows its parent; formatting
 * mutates text slots and leaves in place and never moves nodes around.
 */
public abstract class Node implements Element {
    private Composite parent;

    public Optional<Composite> parent() {
        return Optional.ofNullable(parent);
    }

    void attachTo(Composite parent) {
        this.parent = parent;
    }

    /**
     * Nested nodes, in document order. Leaves have none.
     */
    public abstract Stream<Node> nodes();

    abstract Stream<Indented> descendantsWithIndent(int level);

    /**
     * All descendants, depth-first and pre-order. The node itself is not included.
     */
    public Stream<Node> descendants() {
        return nodes().flatMap(child -> Stream.concat(Stream.of(child), child.descendants()));
    }

    /**
     * Descendants of the requested concrete kinds (or their subtypes), depth-first and pre-order.
     */
    @SafeVarargs
    public final Stream<Node> iterate(Class<? extends Node>... kinds) {
        var wanted = Arrays.asList(kinds);
        return descendants().filter(node -> wanted.stream().anyMatch(kind -> kind.isInstance(node)));
    }

    public <T extends Node> Stream<T> iterate(Class<T> kind) {
        return descendants().filter(kind::isInstance)
                            .map(kind::cast);
    }

    /**
     * Descendants with their nesting level. Block bodies are one level deeper than the
     * block; clause keywords such as {@code elseif} stay at the level of their block.
     */
    public Stream<Indented> iterateWithIndent() {
        return descendantsWithIndent(0);
    }

    /**
     * The text slot right before this node inside its parent, if there is one.
     */
    public Optional<Text> predecessor() {
        return sibling(-1).filter(Text.class::isInstance)
                          .map(Text.class::cast);
    }

    public void setPredecessor(String value) {
        predecessor().orElseThrow(() -> new StructuralAssumptionViolation(
                         getClass().getSimpleName() + " has no preceding text slot"))
                     .set(value);
    }

    /**
     * The element right after this node inside its parent, if there is one.
     */
    public Optional<Element> successor() {
        return sibling(1);
    }

    private Optional<Element> sibling(int offset) {
        if (parent == null) {
            return Optional.empty();
        }
        List<Element> siblings = parent.children();
        int index = parent.indexOf(this) + offset;
        return index >= 0 && index < siblings.size()
               ? Optional.of(siblings.get(index))
               : Optional.empty();
    }

    /**
     * Multi-line dump of the tree structure, for debugging.
     */
    public String pretty() {
        var out = new StringBuilder();
        prettyTo(out, 0);
        return out.toString();
    }

    abstract void prettyTo(StringBuilder out, int depth);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + Text.of(text()) + ")";
    }
}
