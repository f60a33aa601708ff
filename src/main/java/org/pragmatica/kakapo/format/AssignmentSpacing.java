package org.pragmatica.kakapo.format;

import org.pragmatica.kakapo.tree.ArgumentDeclaration;
import org.pragmatica.kakapo.tree.Node;
import org.pragmatica.kakapo.tree.OutputArguments;

/**
 * One space on each side of an assignment's {@code =}, and of the {@code =}
 * before an argument's default value.
 */
final class AssignmentSpacing implements FormattingPass {

    @Override
    public String name() {
        return "assignment spacing";
    }

    @Override
    public void apply(Node root, FormatterConfig config) {
        root.iterate(OutputArguments.class)
            .forEach(outputs -> {
                outputs.beforeEquals().set(" ");
                outputs.afterEquals().set(" ");
            });
        root.iterate(ArgumentDeclaration.class)
            .forEach(declaration -> declaration.gaps()
                                               .stream()
                                               .filter(gap -> Whitespace.core(gap.text()).equals("="))
                                               .forEach(gap -> gap.set(" = ")));
    }
}
