package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

public final class ElseIfClause extends Clause {
    private final List<Element> children;

    public ElseIfClause(Leaf keyword, Text afterKeyword, Statement condition, Text beforeBody, Code body) {
        super(keyword, afterKeyword, Optional.of(condition), beforeBody, body);
        this.children = childrenOf(keyword, afterKeyword, condition, beforeBody, body);
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
