package org.pragmatica.kakapo.format;

import org.pragmatica.kakapo.tree.Block;
import org.pragmatica.kakapo.tree.Clause;
import org.pragmatica.kakapo.tree.Comment;
import org.pragmatica.kakapo.tree.Construct;
import org.pragmatica.kakapo.tree.Function;
import org.pragmatica.kakapo.tree.Leaf;
import org.pragmatica.kakapo.tree.Node;
import org.pragmatica.kakapo.tree.Text;

import java.util.Optional;

/**
 * Puts every construct, clause keyword and block terminator on its own line,
 * indented by its nesting level. Blank lines before a construct are kept;
 * a comment trailing code on the same line stays where it is. Empty bodies
 * collapse, so the closing keyword follows its clause on the next line.
 */
final class Reindentation implements FormattingPass {

    @Override
    public String name() {
        return "reindentation";
    }

    @Override
    public void apply(Node root, FormatterConfig config) {
        root.iterateWithIndent()
            .forEach(indented -> {
                var node = indented.node();
                if (isLineStart(node) && !isTrailingComment(node)) {
                    lineSlot(node).ifPresent(slot -> slot.set(Whitespace.lineStart(slot.text())
                                                              + config.indent(indented.level())));
                }
                if (node instanceof Clause clause && clause.body().isEmpty()) {
                    clause.beforeBody().set("");
                }
                if (node instanceof Function function) {
                    separateSignature(function, config.indent(indented.level() + 1));
                }
            });
    }

    /**
     * The slot holding the whitespace that precedes {@code node} on its line: its own
     * predecessor, or the parent's when the node comes first inside its parent.
     */
    static Optional<Text> lineSlot(Node node) {
        return node.predecessor()
                   .or(() -> node.parent().flatMap(Node::predecessor));
    }

    static boolean isTrailingComment(Node node) {
        return node instanceof Comment
               && lineSlot(node).map(slot -> !slot.text().contains("\n"))
                                .orElse(true);
    }

    private static boolean isLineStart(Node node) {
        var parent = node.parent();
        if (node instanceof Construct) {
            return parent.filter(Clause.class::isInstance)
                         .map(Clause.class::cast)
                         .map(clause -> !clause.isHead(node))
                         .orElse(true);
        }
        if (node instanceof Leaf) {
            return parent.map(owner -> isClauseKeyword(owner, node) || isTerminator(owner, node))
                         .orElse(false);
        }
        return false;
    }

    private static boolean isClauseKeyword(Node owner, Node leaf) {
        return owner instanceof Clause clause && !(owner instanceof Block) && clause.keyword() == leaf;
    }

    private static boolean isTerminator(Node owner, Node leaf) {
        return owner instanceof Block block
               && block.terminator()
                       .map(terminator -> terminator.keyword() == leaf)
                       .orElse(false);
    }

    /**
     * Exactly one blank line between a function signature and its first statement.
     */
    private static void separateSignature(Function function, String bodyIndent) {
        var body = function.body();
        if (!body.isEmpty() && !(body.constructs().get(0) instanceof Comment)) {
            function.beforeBody().set("\n\n" + bodyIndent);
        }
    }
}
