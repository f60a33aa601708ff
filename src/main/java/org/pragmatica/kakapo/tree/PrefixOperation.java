package org.pragmatica.kakapo.tree;

import java.util.List;

/**
 * Unary {@code -x} or {@code ~x}.
 */
public final class PrefixOperation extends Composite {
    private final Leaf operator;
    private final Node operand;
    private final List<Element> children;

    public PrefixOperation(Leaf operator, Node operand) {
        this.operator = adopt(operator);
        this.operand = adopt(operand);
        this.children = childrenOf(operator, operand);
    }

    public Leaf operator() {
        return operator;
    }

    public Node operand() {
        return operand;
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
