package org.pragmatica.kakapo.tree;

import java.util.List;

/**
 * Root of a parsed source file.
 */
public final class File extends Composite {
    private final Text leading;
    private final Code code;
    private final Text trailing;
    private final List<Element> children;

    public File(Text leading, Code code, Text trailing) {
        this.leading = leading;
        this.code = adopt(code);
        this.trailing = trailing;
        this.children = childrenOf(leading, code, trailing);
    }

    public Text leading() {
        return leading;
    }

    public Code code() {
        return code;
    }

    public Text trailing() {
        return trailing;
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
