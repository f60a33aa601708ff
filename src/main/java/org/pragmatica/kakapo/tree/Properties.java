package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

/**
 * {@code properties (Attributes)} section of a class definition.
 */
public final class Properties extends Block {
    private final List<Element> children;

    public Properties(Leaf keyword,
                      Text afterKeyword,
                      Optional<ArgumentsList> attributes,
                      Text beforeBody,
                      Code body,
                      Terminator terminator) {
        super(keyword, afterKeyword, attributes, beforeBody, body, Optional.of(terminator));
        this.children = childrenOf(keyword, afterKeyword, attributes, beforeBody, body, terminatorSlots());
    }

    public Optional<ArgumentsList> attributes() {
        return head().map(ArgumentsList.class::cast);
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
