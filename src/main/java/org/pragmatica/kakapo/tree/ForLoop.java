package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

/**
 * {@code for} or {@code parfor} loop.
 */
public final class ForLoop extends Block {
    private final List<Element> children;

    public ForLoop(Leaf keyword,
                   Text afterKeyword,
                   Statement iteration,
                   Text beforeBody,
                   Code body,
                   Terminator terminator) {
        super(keyword, afterKeyword, Optional.of(iteration), beforeBody, body, Optional.of(terminator));
        this.children = childrenOf(keyword, afterKeyword, iteration, beforeBody, body, terminatorSlots());
    }

    public Statement iteration() {
        return (Statement) head().orElseThrow();
    }

    public boolean isParallel() {
        return keyword().is("parfor");
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
