package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

/**
 * {@code switch} block. Its body holds the {@link Case} blocks and comments between them.
 */
public final class Switch extends Block {
    private final List<Element> children;

    public Switch(Leaf keyword,
                  Text afterKeyword,
                  Statement subject,
                  Text beforeBody,
                  Code cases,
                  Terminator terminator) {
        super(keyword, afterKeyword, Optional.of(subject), beforeBody, cases, Optional.of(terminator));
        this.children = childrenOf(keyword, afterKeyword, subject, beforeBody, cases, terminatorSlots());
    }

    public Statement subject() {
        return (Statement) head().orElseThrow();
    }

    public List<Case> cases() {
        return body().constructs()
                     .stream()
                     .filter(Case.class::isInstance)
                     .map(Case.class::cast)
                     .toList();
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
