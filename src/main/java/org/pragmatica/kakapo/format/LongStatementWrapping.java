package org.pragmatica.kakapo.format;

import org.pragmatica.kakapo.tree.Call;
import org.pragmatica.kakapo.tree.Clause;
import org.pragmatica.kakapo.tree.Node;
import org.pragmatica.kakapo.tree.Statement;

/**
 * Breaks a call statement that does not fit on a line into one argument per line.
 * Arguments go one level deeper; the closing bracket returns to the statement's level.
 */
final class LongStatementWrapping implements FormattingPass {
    private static final String BREAK = " ...\n";

    @Override
    public String name() {
        return "long statement wrapping";
    }

    @Override
    public void apply(Node root, FormatterConfig config) {
        root.iterateWithIndent()
            .filter(indented -> indented.node() instanceof Statement)
            .forEach(indented -> {
                var statement = (Statement) indented.node();
                int length = config.indent(indented.level()).length()
                             + leadingKeyword(statement).length()
                             + statement.text().length();
                if (length > config.maxLineLength()) {
                    wrap(statement, config.indent(indented.level()), config.indent(indented.level() + 1));
                }
            });
    }

    /**
     * What precedes a block head on its line, such as {@code "function "} or {@code "if "}.
     */
    private static String leadingKeyword(Statement statement) {
        return statement.parent()
                        .filter(Clause.class::isInstance)
                        .map(Clause.class::cast)
                        .filter(clause -> clause.isHead(statement))
                        .map(clause -> clause.keyword().text() + clause.afterKeyword().text())
                        .orElse("");
    }

    private static void wrap(Statement statement, String outer, String inner) {
        if (!(statement.body() instanceof Call call)) {
            return;
        }
        call.argumentsList()
            .filter(arguments -> !arguments.elementsList().isEmpty())
            .ifPresent(arguments -> {
                var parenthesized = arguments.parenthesized();
                parenthesized.innerLeading().set(BREAK + inner);
                arguments.elementsList()
                         .delimiters()
                         .forEach(delimiter -> delimiter.set(Whitespace.core(delimiter.text()) + BREAK + inner));
                parenthesized.innerTrailing().set(BREAK + outer);
            });
    }
}
