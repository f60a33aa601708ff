package org.pragmatica.kakapo.tree;

import java.util.Objects;

/**
 * Text slot - whitespace, delimiter, punctuation, continuation marker or nothing,
 * held at a fixed position of its owner.
 *
 * <p>Formatting passes overwrite the value in place.
 */
public final class Text implements Element {
    private String value;

    private Text(String value) {
        this.value = Objects.requireNonNull(value);
    }

    public static Text of(String value) {
        return new Text(value);
    }

    @Override
    public String text() {
        return value;
    }

    public void set(String value) {
        this.value = Objects.requireNonNull(value);
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Text other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "'" + value.replace("\n", "\\n").replace("\t", "\\t") + "'";
    }
}
