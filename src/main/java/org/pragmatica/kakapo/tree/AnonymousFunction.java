package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

/**
 * {@code @(x) x + 1} or a function handle such as {@code @sin}.
 */
public final class AnonymousFunction extends Composite {
    private final Text at;
    private final Text afterAt;
    private final Optional<ArgumentsList> parameters;
    private final Text beforeBody;
    private final Node body;
    private final List<Element> children;

    public AnonymousFunction(Text at, Text afterAt, Optional<ArgumentsList> parameters, Text beforeBody, Node body) {
        this.at = at;
        this.afterAt = afterAt;
        this.parameters = parameters.map(this::adopt);
        this.beforeBody = beforeBody;
        this.body = adopt(body);
        this.children = childrenOf(at, afterAt, parameters, beforeBody, body);
    }

    public Text afterAt() {
        return afterAt;
    }

    public Optional<ArgumentsList> parameters() {
        return parameters;
    }

    public Text beforeBody() {
        return beforeBody;
    }

    public Node body() {
        return body;
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
