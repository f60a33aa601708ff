package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

public final class WhileLoop extends Block {
    private final List<Element> children;

    public WhileLoop(Leaf keyword,
                     Text afterKeyword,
                     Statement condition,
                     Text beforeBody,
                     Code body,
                     Terminator terminator) {
        super(keyword, afterKeyword, Optional.of(condition), beforeBody, body, Optional.of(terminator));
        this.children = childrenOf(keyword, afterKeyword, condition, beforeBody, body, terminatorSlots());
    }

    public Statement condition() {
        return (Statement) head().orElseThrow();
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
