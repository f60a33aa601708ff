package org.pragmatica.kakapo.tree;

import java.util.List;

/**
 * {@code (a, b)} or {@code {a, b}} after a name.
 */
public final class ArgumentsList extends ElementsList {
    private final List<Element> children;

    public ArgumentsList(Parenthesized parenthesized) {
        super(parenthesized);
        this.children = childrenOf(parenthesized);
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
