package org.pragmatica.kakapo.format;

import org.pragmatica.kakapo.tree.Node;
import org.pragmatica.kakapo.tree.Parenthesized;

/**
 * No space right inside brackets.
 */
final class ParenthesizedSpacing implements FormattingPass {

    @Override
    public String name() {
        return "parenthesized spacing";
    }

    @Override
    public void apply(Node root, FormatterConfig config) {
        root.iterate(Parenthesized.class)
            .forEach(parenthesized -> {
                parenthesized.innerLeading().set("");
                parenthesized.innerTrailing().set("");
            });
    }
}
