package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

/**
 * {@code spmd} block, optionally limited to a worker count or range: {@code spmd (4)}.
 */
public final class Spmd extends Block {
    private final List<Element> children;

    public Spmd(Leaf keyword,
                Text afterKeyword,
                Optional<ArgumentsList> workers,
                Text beforeBody,
                Code body,
                Terminator terminator) {
        super(keyword, afterKeyword, workers, beforeBody, body, Optional.of(terminator));
        this.children = childrenOf(keyword, afterKeyword, workers, beforeBody, body, terminatorSlots());
    }

    public Optional<ArgumentsList> workers() {
        return head().map(ArgumentsList.class::cast);
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
