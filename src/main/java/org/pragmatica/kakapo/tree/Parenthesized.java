package org.pragmatica.kakapo.tree;

import java.util.List;

/**
 * Content between an opening and a closing bracket, with the space just inside each bracket.
 * Both brackets are empty for an unbracketed output clause.
 */
public final class Parenthesized extends Composite {
    private final Text open;
    private final Text innerLeading;
    private final Node content;
    private final Text innerTrailing;
    private final Text close;
    private final List<Element> children;

    public Parenthesized(Text open, Text innerLeading, Node content, Text innerTrailing, Text close) {
        this.open = open;
        this.innerLeading = innerLeading;
        this.content = adopt(content);
        this.innerTrailing = innerTrailing;
        this.close = close;
        this.children = childrenOf(open, innerLeading, content, innerTrailing, close);
    }

    public Text open() {
        return open;
    }

    public Text innerLeading() {
        return innerLeading;
    }

    public Node content() {
        return content;
    }

    public Text innerTrailing() {
        return innerTrailing;
    }

    public Text close() {
        return close;
    }

    public boolean isBare() {
        return open.isEmpty() && close.isEmpty();
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
