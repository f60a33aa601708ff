package org.pragmatica.kakapo.tree;

import java.util.List;

/**
 * Left-hand side of an assignment, {@code [a, ~] = } or {@code x = }.
 */
public final class OutputArguments extends ElementsList {
    private final Text beforeEquals;
    private final Text equalsSign;
    private final Text afterEquals;
    private final List<Element> children;

    public OutputArguments(Parenthesized parenthesized, Text beforeEquals, Text equalsSign, Text afterEquals) {
        super(parenthesized);
        this.beforeEquals = beforeEquals;
        this.equalsSign = equalsSign;
        this.afterEquals = afterEquals;
        this.children = childrenOf(parenthesized, beforeEquals, equalsSign, afterEquals);
    }

    public Text beforeEquals() {
        return beforeEquals;
    }

    public Text equalsSign() {
        return equalsSign;
    }

    public Text afterEquals() {
        return afterEquals;
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
