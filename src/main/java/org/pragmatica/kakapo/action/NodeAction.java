package org.pragmatica.kakapo.action;

import org.pragmatica.kakapo.tree.Node;

/**
 * Builds a tree node from the parts collected while matching a rule.
 */
@FunctionalInterface
public interface NodeAction {
    Node apply(Parts parts);
}
