package org.pragmatica.kakapo.tree;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Terminal token: keyword, identifier, number, string or operator, holding its exact source text.
 */
public final class Leaf extends Node {
    private String value;

    public Leaf(String value) {
        this.value = Objects.requireNonNull(value);
    }

    @Override
    public String text() {
        return value;
    }

    /**
     * Overwrite the token. Only used to write a keyword into a reserved empty slot.
     */
    public void setText(String value) {
        this.value = Objects.requireNonNull(value);
    }

    public boolean is(String token) {
        return value.equals(token);
    }

    @Override
    public Stream<Node> nodes() {
        return Stream.empty();
    }

    @Override
    Stream<Indented> descendantsWithIndent(int level) {
        return Stream.empty();
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append(value);
    }

    @Override
    void prettyTo(StringBuilder out, int depth) {
        out.append("    ".repeat(depth))
           .append("Leaf(")
           .append(value)
           .append(")\n");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Leaf other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
