package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

/**
 * {@code catch} with an optional error variable. Without a variable the space after the keyword is empty.
 */
public final class CatchClause extends Clause {
    private final List<Element> children;

    public CatchClause(Leaf keyword, Text afterKeyword, Optional<Leaf> variable, Text beforeBody, Code body) {
        super(keyword, afterKeyword, variable, beforeBody, body);
        this.children = childrenOf(keyword, afterKeyword, variable, beforeBody, body);
    }

    public Optional<Leaf> variable() {
        return head().map(Leaf.class::cast);
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
