package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

/**
 * Clause that stands on its own in a {@link Code} sequence and is closed by a {@link Terminator}.
 * {@link Case} is the only block without one; it ends where the next case begins.
 */
public abstract class Block extends Clause implements Construct {
    private final Optional<Terminator> terminator;

    protected Block(Leaf keyword,
                    Text afterKeyword,
                    Optional<? extends Node> head,
                    Text beforeBody,
                    Code body,
                    Optional<Terminator> terminator) {
        super(keyword, afterKeyword, head, beforeBody, body);
        terminator.ifPresent(value -> adopt(value.keyword()));
        this.terminator = terminator;
    }

    public Optional<Terminator> terminator() {
        return terminator;
    }

    protected final List<Element> terminatorSlots() {
        return terminator.map(value -> List.<Element>of(value.before(), value.keyword(), value.punctuation()))
                         .orElse(List.of());
    }
}
