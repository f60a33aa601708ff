package org.pragmatica.kakapo.tree;

import org.pragmatica.kakapo.error.StructuralAssumptionViolation;

/**
 * A bracketed {@link DelimitedList}: argument list, array or output clause.
 */
public abstract class ElementsList extends Composite {
    private final Parenthesized parenthesized;

    protected ElementsList(Parenthesized parenthesized) {
        this.parenthesized = adopt(parenthesized);
    }

    public Parenthesized parenthesized() {
        return parenthesized;
    }

    public DelimitedList elementsList() {
        if (parenthesized.content() instanceof DelimitedList list) {
            return list;
        }
        throw StructuralAssumptionViolation.unexpected("elementsList", parenthesized.content(), DelimitedList.class);
    }
}
