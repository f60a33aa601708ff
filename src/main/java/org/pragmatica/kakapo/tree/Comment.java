package org.pragmatica.kakapo.tree;

import java.util.List;

/**
 * {@code %} up to, but not including, the line break. A block comment runs from
 * a <code>%{</code> line to a <code>%}</code> line; its body holds everything in between verbatim.
 */
public final class Comment extends Composite implements Construct {
    private final Text marker;
    private final Text body;
    private final List<Element> children;

    public Comment(Text marker, Text body) {
        this.marker = marker;
        this.body = body;
        this.children = childrenOf(marker, body);
    }

    public boolean isBlock() {
        return marker.text().equals("%{");
    }

    public Text body() {
        return body;
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
