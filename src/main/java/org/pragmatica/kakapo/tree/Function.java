package org.pragmatica.kakapo.tree;

import org.pragmatica.kakapo.error.StructuralAssumptionViolation;

import java.util.List;
import java.util.Optional;

/**
 * {@code function [outputs] = name(parameters)} with its body.
 * The head is a {@link Statement} without separator holding the signature.
 */
public final class Function extends Block {
    private final List<Element> children;

    public Function(Leaf keyword,
                    Text afterKeyword,
                    Statement signature,
                    Text beforeBody,
                    Code body,
                    Terminator terminator) {
        super(keyword, afterKeyword, Optional.of(signature), beforeBody, body, Optional.of(terminator));
        this.children = childrenOf(keyword, afterKeyword, signature, beforeBody, body, terminatorSlots());
    }

    public Statement signature() {
        return (Statement) head().orElseThrow();
    }

    public Call declaration() {
        if (signature().body() instanceof Call call) {
            return call;
        }
        throw StructuralAssumptionViolation.unexpected("declaration", signature().body(), Call.class);
    }

    public String name() {
        return declaration().identifier()
                            .text();
    }

    public Terminator end() {
        return terminator().orElseThrow();
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
