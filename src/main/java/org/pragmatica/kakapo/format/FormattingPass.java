package org.pragmatica.kakapo.format;

import org.pragmatica.kakapo.tree.Node;

/**
 * One step of the formatting pipeline. A pass overwrites text slots and leaves
 * of the tree in place; it never adds or removes nodes.
 */
public interface FormattingPass {

    String name();

    void apply(Node root, FormatterConfig config);
}
