package org.pragmatica.kakapo.tree;

/**
 * A node paired with its nesting level, as produced by {@link Node#iterateWithIndent()}.
 */
public record Indented(Node node, int level) {}
