package org.pragmatica.kakapo.tree;

import com.google.common.collect.ImmutableList;
import org.pragmatica.kakapo.error.StructuralAssumptionViolation;

import java.util.List;
import java.util.Optional;

/**
 * Name optionally followed by a chain of argument lists and field selections,
 * as in {@code x}, {@code f(1)} or {@code s(2).data{3}}.
 */
public final class Call extends Composite {
    private final Leaf identifier;
    private final List<Node> selectors;
    private final List<Element> children;

    public Call(Leaf identifier, List<? extends Node> selectors) {
        for (var selector : selectors) {
            if (!(selector instanceof ArgumentsList) && !(selector instanceof Leaf)) {
                throw StructuralAssumptionViolation.unexpected("selector", selector, ArgumentsList.class);
            }
        }
        this.identifier = adopt(identifier);
        this.selectors = adoptAll(ImmutableList.copyOf(selectors));
        this.children = childrenOf(identifier, this.selectors);
    }

    public Leaf identifier() {
        return identifier;
    }

    public List<Node> selectors() {
        return selectors;
    }

    /**
     * The argument list right after the name, if there is one.
     */
    public Optional<ArgumentsList> argumentsList() {
        return selectors.stream()
                        .findFirst()
                        .filter(ArgumentsList.class::isInstance)
                        .map(ArgumentsList.class::cast);
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
