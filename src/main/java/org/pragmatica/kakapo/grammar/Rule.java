package org.pragmatica.kakapo.grammar;

import org.pragmatica.kakapo.action.NodeAction;

import java.util.Optional;

/**
 * A grammar rule: Name <- Expression { action }
 *
 * <p>A rule without action passes the parts of its body on to the rule that refers to it.
 */
public record Rule(String name, Expression expression, Optional<NodeAction> action) {

    public static Rule rule(String name, Expression expression) {
        return new Rule(name, expression, Optional.empty());
    }

    public static Rule rule(String name, Expression expression, NodeAction action) {
        return new Rule(name, expression, Optional.of(action));
    }
}
