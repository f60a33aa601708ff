package org.pragmatica.kakapo.format;

import org.pragmatica.kakapo.tree.Function;
import org.pragmatica.kakapo.tree.Node;

/**
 * Writes the {@code end} of functions declared without one.
 */
final class FunctionTerminator implements FormattingPass {

    @Override
    public String name() {
        return "function terminator";
    }

    @Override
    public void apply(Node root, FormatterConfig config) {
        root.iterate(Function.class)
            .forEach(function -> {
                var end = function.end();
                if (end.before().isEmpty()) {
                    end.before().set("\n");
                }
                end.keyword().setText("end");
            });
    }
}
