package org.pragmatica.kakapo.action;

import com.google.common.collect.ImmutableList;
import org.pragmatica.kakapo.error.StructuralAssumptionViolation;
import org.pragmatica.kakapo.tree.Leaf;
import org.pragmatica.kakapo.tree.Node;
import org.pragmatica.kakapo.tree.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Values collected while matching a rule, in match order.
 *
 * <p>A part is either matched text ({@link String}), a node built by a nested rule,
 * or {@link #ABSENT} where an optional node was not there.
 */
public final class Parts {
    /**
     * Placeholder for an optional node that did not match.
     */
    public static final Object ABSENT = new Object() {
        @Override
        public String toString() {
            return "<absent>";
        }
    };

    private final List<Object> values;

    private Parts(List<Object> values) {
        this.values = values;
    }

    public static Parts of(List<Object> values) {
        return new Parts(ImmutableList.copyOf(values));
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }

    public boolean isAbsent(int index) {
        return values.get(index) == ABSENT;
    }

    public String string(int index) {
        if (values.get(index) instanceof String text) {
            return text;
        }
        throw StructuralAssumptionViolation.unexpected(slot(index), values.get(index), String.class);
    }

    public Text text(int index) {
        return Text.of(string(index));
    }

    /**
     * Part as a leaf. Matched text is wrapped into a new leaf.
     */
    public Leaf leaf(int index) {
        var value = values.get(index);
        if (value instanceof Leaf leaf) {
            return leaf;
        }
        if (value instanceof String text) {
            return new Leaf(text);
        }
        throw StructuralAssumptionViolation.unexpected(slot(index), value, Leaf.class);
    }

    public Node node(int index) {
        return node(index, Node.class);
    }

    public <T extends Node> T node(int index, Class<T> kind) {
        var value = values.get(index);
        if (kind.isInstance(value)) {
            return kind.cast(value);
        }
        throw StructuralAssumptionViolation.unexpected(slot(index), value, kind);
    }

    public <T extends Node> Optional<T> optional(int index, Class<T> kind) {
        return isAbsent(index)
               ? Optional.empty()
               : Optional.of(node(index, kind));
    }

    /**
     * Parts {@code from}, {@code from + 2}, ... below {@code to}, as nodes of the given kind.
     */
    public <T extends Node> List<T> nodes(int from, int to, Class<T> kind) {
        var result = new ArrayList<T>();
        for (int i = from; i < to; i += 2) {
            result.add(node(i, kind));
        }
        return result;
    }

    /**
     * Parts {@code from}, {@code from + 2}, ... below {@code to}, as leaves.
     */
    public List<Leaf> leaves(int from, int to) {
        var result = new ArrayList<Leaf>();
        for (int i = from; i < to; i += 2) {
            result.add(leaf(i));
        }
        return result;
    }

    /**
     * Parts {@code from}, {@code from + 2}, ... below {@code to}, as text slots.
     */
    public List<Text> texts(int from, int to) {
        var result = new ArrayList<Text>();
        for (int i = from; i < to; i += 2) {
            result.add(text(i));
        }
        return result;
    }

    private static String slot(int index) {
        return "#" + index;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
