package org.pragmatica.kakapo.tree;

import java.util.List;

/**
 * Transpose {@code x'} or {@code x.'}.
 */
public final class PostfixOperation extends Composite {
    private final Node operand;
    private final Leaf operator;
    private final List<Element> children;

    public PostfixOperation(Node operand, Leaf operator) {
        this.operand = adopt(operand);
        this.operator = adopt(operator);
        this.children = childrenOf(operand, operator);
    }

    public Node operand() {
        return operand;
    }

    public Leaf operator() {
        return operator;
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
