package org.pragmatica.kakapo.format;

import org.pragmatica.kakapo.tree.File;
import org.pragmatica.kakapo.tree.Node;

/**
 * No whitespace at the start of a file and exactly one line break at its end.
 */
final class FileBoundary implements FormattingPass {

    @Override
    public String name() {
        return "file boundary";
    }

    @Override
    public void apply(Node root, FormatterConfig config) {
        if (root instanceof File file) {
            file.leading().set("");
            file.trailing().set("\n");
        }
    }
}
