package org.pragmatica.kakapo.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Elements separated by delimiter slots: {@code E (delimiter E)*}, or nothing at all.
 */
public final class DelimitedList extends Composite {
    private final List<Node> elements;
    private final List<Text> delimiters;
    private final List<Element> children;

    private DelimitedList(List<? extends Node> elements, List<Text> delimiters) {
        checkAlternating(elements, delimiters, "DelimitedList");
        this.elements = adoptAll(ImmutableList.copyOf(elements));
        this.delimiters = ImmutableList.copyOf(delimiters);
        this.children = interleave(this.elements, this.delimiters);
    }

    public static DelimitedList of(List<? extends Node> elements, List<Text> delimiters) {
        return new DelimitedList(elements, delimiters);
    }

    public static DelimitedList single(Node element) {
        return new DelimitedList(List.of(element), List.of());
    }

    public List<Node> elements() {
        return elements;
    }

    public Node element(int index) {
        return elements.get(index);
    }

    public List<Text> delimiters() {
        return delimiters;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
