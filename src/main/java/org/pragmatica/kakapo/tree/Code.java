package org.pragmatica.kakapo.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Sequence of statements, commands, comments and blocks with the whitespace between them.
 */
public final class Code extends Composite {
    private final List<Node> constructs;
    private final List<Text> separators;
    private final List<Element> children;

    private Code(List<? extends Node> constructs, List<Text> separators) {
        checkAlternating(constructs, separators, "Code");
        this.constructs = adoptAll(ImmutableList.copyOf(constructs));
        this.separators = ImmutableList.copyOf(separators);
        this.children = interleave(this.constructs, this.separators);
    }

    public static Code of(List<? extends Node> constructs, List<Text> separators) {
        return new Code(constructs, separators);
    }

    public static Code empty() {
        return new Code(List.of(), List.of());
    }

    public List<Node> constructs() {
        return constructs;
    }

    public List<Text> separators() {
        return separators;
    }

    public boolean isEmpty() {
        return constructs.isEmpty();
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
