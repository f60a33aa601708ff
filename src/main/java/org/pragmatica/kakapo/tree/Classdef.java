package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

/**
 * {@code classdef Name < Base}. Its body holds {@link Methods} and {@link Properties} blocks.
 */
public final class Classdef extends Block {
    private final List<Element> children;

    public Classdef(Leaf keyword,
                    Text afterKeyword,
                    Statement declaration,
                    Text beforeBody,
                    Code body,
                    Terminator terminator) {
        super(keyword, afterKeyword, Optional.of(declaration), beforeBody, body, Optional.of(terminator));
        this.children = childrenOf(keyword, afterKeyword, declaration, beforeBody, body, terminatorSlots());
    }

    public Statement declaration() {
        return (Statement) head().orElseThrow();
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
