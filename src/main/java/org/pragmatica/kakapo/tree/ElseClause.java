package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

public final class ElseClause extends Clause {
    private final List<Element> children;

    public ElseClause(Leaf keyword, Text afterKeyword, Text beforeBody, Code body) {
        super(keyword, afterKeyword, Optional.empty(), beforeBody, body);
        this.children = childrenOf(keyword, afterKeyword, beforeBody, body);
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
