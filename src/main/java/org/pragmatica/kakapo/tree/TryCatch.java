package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

/**
 * {@code try} block with an optional {@code catch} clause. Without one, the gap before it is empty.
 */
public final class TryCatch extends Block {
    private final Text beforeCatch;
    private final Optional<CatchClause> catchClause;
    private final List<Element> children;

    public TryCatch(Leaf keyword,
                    Text afterKeyword,
                    Text beforeBody,
                    Code body,
                    Text beforeCatch,
                    Optional<CatchClause> catchClause,
                    Terminator terminator) {
        super(keyword, afterKeyword, Optional.empty(), beforeBody, body, Optional.of(terminator));
        this.beforeCatch = beforeCatch;
        this.catchClause = catchClause.map(this::adopt);
        this.children = childrenOf(keyword, afterKeyword, beforeBody, body, beforeCatch, catchClause, terminatorSlots());
    }

    public Text beforeCatch() {
        return beforeCatch;
    }

    public Optional<CatchClause> catchClause() {
        return catchClause;
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
