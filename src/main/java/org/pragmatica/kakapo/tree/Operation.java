package org.pragmatica.kakapo.tree;

import org.pragmatica.kakapo.error.StructuralAssumptionViolation;

import java.util.List;

/**
 * Chain of binary operators, kept flat: {@code a + b * c} is one list of three
 * operands and two operator delimiters. No precedence is implied.
 */
public final class Operation extends Composite {
    private final DelimitedList operands;
    private final List<Element> children;

    public Operation(DelimitedList operands) {
        if (operands.size() < 2) {
            throw new StructuralAssumptionViolation("Operation needs at least two operands, got " + operands.size());
        }
        this.operands = adopt(operands);
        this.children = childrenOf(operands);
    }

    public DelimitedList operands() {
        return operands;
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
