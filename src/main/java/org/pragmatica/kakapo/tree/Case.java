package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

/**
 * {@code case value} or {@code otherwise}. Ends where the next case, {@code otherwise} or {@code end} begins.
 */
public final class Case extends Block {
    private final List<Element> children;

    public Case(Leaf keyword, Text afterKeyword, Optional<Statement> value, Text beforeBody, Code body) {
        super(keyword, afterKeyword, value, beforeBody, body, Optional.empty());
        this.children = childrenOf(keyword, afterKeyword, value, beforeBody, body);
    }

    public Optional<Statement> value() {
        return head().map(Statement.class::cast);
    }

    public boolean isOtherwise() {
        return keyword().is("otherwise");
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
