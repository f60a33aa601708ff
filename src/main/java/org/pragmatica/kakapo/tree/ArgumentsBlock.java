package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

/**
 * {@code arguments (Input)} validation block at the start of a function body.
 * Its body holds {@link ArgumentDeclaration}s and comments.
 */
public final class ArgumentsBlock extends Block {
    private final List<Element> children;

    public ArgumentsBlock(Leaf keyword,
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

    public List<ArgumentDeclaration> declarations() {
        return body().constructs()
                     .stream()
                     .filter(ArgumentDeclaration.class::isInstance)
                     .map(ArgumentDeclaration.class::cast)
                     .toList();
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
