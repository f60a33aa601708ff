package org.pragmatica.kakapo.tree;

import java.util.List;

/**
 * Matrix {@code [1 2; 3 4]} or cell array {@code {a, 'b'}} literal.
 */
public final class Array extends ElementsList {
    private final List<Element> children;

    public Array(Parenthesized parenthesized) {
        super(parenthesized);
        this.children = childrenOf(parenthesized);
    }

    public boolean isCell() {
        return parenthesized().open().text().equals("{");
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
