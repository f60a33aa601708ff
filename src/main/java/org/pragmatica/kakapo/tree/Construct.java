package org.pragmatica.kakapo.tree;

/**
 * Marker for nodes that stand on their own inside {@link Code}: statements,
 * commands, comments and blocks.
 */
public interface Construct {}
