package org.pragmatica.kakapo.format;

import org.pragmatica.kakapo.tree.Array;
import org.pragmatica.kakapo.tree.ElementsList;
import org.pragmatica.kakapo.tree.Node;
import org.pragmatica.kakapo.tree.Operation;

/**
 * One space after each list delimiter, one space around each binary operator.
 * A line break between array elements starts a new row and becomes {@code "; "}.
 */
final class DelimiterSpacing implements FormattingPass {

    @Override
    public String name() {
        return "delimiter spacing";
    }

    @Override
    public void apply(Node root, FormatterConfig config) {
        root.iterate(ElementsList.class)
            .forEach(list -> list.elementsList()
                                 .delimiters()
                                 .forEach(delimiter -> {
                                     if (list instanceof Array && Whitespace.breaksLine(delimiter.text())) {
                                         delimiter.set("; ");
                                         return;
                                     }
                                     var core = Whitespace.core(delimiter.text());
                                     delimiter.set(core.isEmpty() ? " " : core + " ");
                                 }));

        root.iterate(Operation.class)
            .forEach(operation -> operation.operands()
                                           .delimiters()
                                           .forEach(delimiter -> delimiter.set(" " + Whitespace.core(delimiter.text()) + " ")));
    }
}
