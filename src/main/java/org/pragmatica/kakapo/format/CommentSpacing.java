package org.pragmatica.kakapo.format;

import org.pragmatica.kakapo.tree.Code;
import org.pragmatica.kakapo.tree.Comment;
import org.pragmatica.kakapo.tree.Node;

/**
 * A blank line before each run of comment lines that follows code.
 */
final class CommentSpacing implements FormattingPass {

    @Override
    public String name() {
        return "comment spacing";
    }

    @Override
    public void apply(Node root, FormatterConfig config) {
        root.iterate(Comment.class)
            .filter(comment -> !Reindentation.isTrailingComment(comment))
            .filter(CommentSpacing::followsCode)
            .forEach(comment -> comment.predecessor()
                                       .filter(slot -> Whitespace.newlines(slot.text()) < 2)
                                       .ifPresent(slot -> slot.set("\n" + slot.text())));
    }

    private static boolean followsCode(Comment comment) {
        return comment.parent()
                      .filter(Code.class::isInstance)
                      .map(Code.class::cast)
                      .map(code -> {
                          var constructs = code.constructs();
                          for (int i = 1; i < constructs.size(); i++) {
                              if (constructs.get(i) == comment) {
                                  return !(constructs.get(i - 1) instanceof Comment);
                              }
                          }
                          return false;
                      })
                      .orElse(false);
    }
}
