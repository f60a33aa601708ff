package org.pragmatica.kakapo.tree;

import com.google.common.collect.ImmutableList;
import org.pragmatica.kakapo.error.StructuralAssumptionViolation;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Node with children. Each concrete kind has a fixed shape and exposes its
 * children through named accessors; {@link #children()} lists them in document order.
 *
 * <p>Two composites are equal when they have the same concrete type and equal children.
 *
 * <p>A child is attached to its parent when the parent is built. While a parse
 * backtracks, the packrat cache can hand one subtree to several candidate
 * parents, so the engine calls {@link #link()} on the finished tree. After that,
 * parent links no longer change.
 */
public abstract class Composite extends Node {

    /**
     * Children in document order. Absent optional parts are left out.
     */
    public abstract List<Element> children();

    /**
     * Nesting level of a direct child, given the level of this node.
     */
    protected int childLevel(Node child, int level) {
        return level;
    }

    protected final <T extends Node> T adopt(T child) {
        if (child != null) {
            child.attachTo(this);
        }
        return child;
    }

    protected final <T extends Node> List<T> adoptAll(List<T> children) {
        children.forEach(this::adopt);
        return ImmutableList.copyOf(children);
    }

    /**
     * Re-attach every descendant to its enclosing node. Runs once per parse, on the result.
     */
    public final void link() {
        nodes().forEach(child -> {
            child.attachTo(this);
            if (child instanceof Composite composite) {
                composite.link();
            }
        });
    }

    int indexOf(Node child) {
        var siblings = children();
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == child) {
                return i;
            }
        }
        throw new StructuralAssumptionViolation(
            child.getClass().getSimpleName() + " is not a child of " + getClass().getSimpleName());
    }

    @Override
    public Stream<Node> nodes() {
        return children().stream()
                         .filter(Node.class::isInstance)
                         .map(Node.class::cast);
    }

    @Override
    Stream<Indented> descendantsWithIndent(int level) {
        return nodes().flatMap(child -> {
            int childLevel = childLevel(child, level);
            return Stream.concat(Stream.of(new Indented(child, childLevel)),
                                 child.descendantsWithIndent(childLevel));
        });
    }

    @Override
    public void appendTo(StringBuilder out) {
        children().forEach(child -> child.appendTo(out));
    }

    @Override
    void prettyTo(StringBuilder out, int depth) {
        var indent = "    ".repeat(depth);
        out.append(indent)
           .append(getClass().getSimpleName())
           .append("[\n");
        for (var child : children()) {
            if (child instanceof Node node) {
                node.prettyTo(out, depth + 1);
            } else {
                out.append(indent)
                   .append("    ")
                   .append(child)
                   .append("\n");
            }
        }
        out.append(indent)
           .append("]\n");
    }

    /**
     * Flatten slots into a child list: elements are kept, {@code null} and empty
     * optionals are skipped, collections and present optionals are unpacked.
     */
    protected static List<Element> childrenOf(Object... slots) {
        var builder = ImmutableList.<Element>builder();
        for (var slot : slots) {
            addSlot(builder, slot);
        }
        return builder.build();
    }

    private static void addSlot(ImmutableList.Builder<Element> builder, Object slot) {
        if (slot == null) {
            return;
        }
        if (slot instanceof Element element) {
            builder.add(element);
        } else if (slot instanceof Optional<?> optional) {
            optional.ifPresent(value -> addSlot(builder, value));
        } else if (slot instanceof Collection<?> collection) {
            collection.forEach(value -> addSlot(builder, value));
        } else {
            throw StructuralAssumptionViolation.unexpected("child", slot, Element.class);
        }
    }

    /**
     * Interleave elements with the delimiters between them.
     */
    protected static List<Element> interleave(List<? extends Element> elements, List<? extends Element> delimiters) {
        var builder = ImmutableList.<Element>builder();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                builder.add(delimiters.get(i - 1));
            }
            builder.add(elements.get(i));
        }
        return builder.build();
    }

    protected static void checkAlternating(List<?> elements, List<?> delimiters, String kind) {
        boolean valid = elements.isEmpty()
                        ? delimiters.isEmpty()
                        : delimiters.size() == elements.size() - 1;
        if (!valid) {
            throw new StructuralAssumptionViolation(
                kind + " has " + elements.size() + " elements and " + delimiters.size() + " delimiters");
        }
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass() && children().equals(((Composite) o).children());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode() * 31 + children().hashCode();
    }
}
