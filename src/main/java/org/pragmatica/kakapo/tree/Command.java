package org.pragmatica.kakapo.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Command syntax: blank separated bare words such as {@code hold on} or {@code import pkg.*}.
 */
public final class Command extends Composite implements Construct {
    private final List<Leaf> words;
    private final List<Text> gaps;
    private final Text beforeSeparator;
    private final Text separator;
    private final List<Element> children;

    public Command(List<Leaf> words, List<Text> gaps, Text beforeSeparator, Text separator) {
        checkAlternating(words, gaps, "Command");
        this.words = adoptAll(ImmutableList.copyOf(words));
        this.gaps = ImmutableList.copyOf(gaps);
        this.beforeSeparator = beforeSeparator;
        this.separator = separator;
        this.children = childrenOf(interleave(this.words, this.gaps), beforeSeparator, separator);
    }

    public List<Leaf> words() {
        return words;
    }

    public List<Text> gaps() {
        return gaps;
    }

    public Text beforeSeparator() {
        return beforeSeparator;
    }

    public Text separator() {
        return separator;
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
