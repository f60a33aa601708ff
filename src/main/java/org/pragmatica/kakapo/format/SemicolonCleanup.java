package org.pragmatica.kakapo.format;

import org.pragmatica.kakapo.tree.ArgumentDeclaration;
import org.pragmatica.kakapo.tree.Block;
import org.pragmatica.kakapo.tree.Clause;
import org.pragmatica.kakapo.tree.Code;
import org.pragmatica.kakapo.tree.Command;
import org.pragmatica.kakapo.tree.Node;
import org.pragmatica.kakapo.tree.Statement;
import org.pragmatica.kakapo.tree.Text;

/**
 * Drops {@code ;} after block terminators and after clause heads such as an
 * {@code if} condition, removes empty statements ({@code x = 1;;}) and removes
 * blanks before the remaining separators.
 */
final class SemicolonCleanup implements FormattingPass {

    @Override
    public String name() {
        return "semicolon cleanup";
    }

    @Override
    public void apply(Node root, FormatterConfig config) {
        root.iterate(Block.class)
            .forEach(block -> block.terminator()
                                   .filter(terminator -> terminator.punctuation().text().equals(";"))
                                   .ifPresent(terminator -> terminator.punctuation().set("")));

        // A clause head is always followed by a line break once indented
        root.iterate(Clause.class)
            .forEach(clause -> clause.head()
                                     .filter(Statement.class::isInstance)
                                     .map(Statement.class::cast)
                                     .ifPresent(head -> head.separator().set("")));

        root.iterate(Statement.class)
            .forEach(statement -> statement.beforeSeparator().set(""));
        root.iterate(Command.class)
            .forEach(command -> command.beforeSeparator().set(""));
        root.iterate(ArgumentDeclaration.class)
            .forEach(declaration -> declaration.beforeSeparator().set(""));

        dropEmptyStatements(root);
    }

    /**
     * Empty statements live in the gaps between constructs: before and between the
     * constructs of a body, before a clause such as {@code else} and before {@code end}.
     */
    private static void dropEmptyStatements(Node root) {
        root.iterate(Code.class)
            .forEach(code -> {
                code.predecessor().ifPresent(SemicolonCleanup::dropSeparators);
                code.separators().forEach(SemicolonCleanup::dropSeparators);
            });
        root.iterate(Clause.class)
            .filter(clause -> !(clause instanceof Block))
            .forEach(clause -> clause.predecessor().ifPresent(SemicolonCleanup::dropSeparators));
        root.iterate(Block.class)
            .forEach(block -> block.terminator().ifPresent(terminator -> dropSeparators(terminator.before())));
    }

    private static void dropSeparators(Text slot) {
        slot.set(Whitespace.withoutSeparators(slot.text()));
    }
}
