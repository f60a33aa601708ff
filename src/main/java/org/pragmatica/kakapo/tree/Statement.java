package org.pragmatica.kakapo.tree;

import java.util.List;
import java.util.Optional;

/**
 * Expression or control keyword, optionally assigned to output arguments, with
 * the space before its separator and the separator ({@code ;}, {@code ,} or nothing).
 */
public final class Statement extends Composite implements Construct {
    private final Optional<OutputArguments> outputs;
    private final Node body;
    private final Text beforeSeparator;
    private final Text separator;
    private final List<Element> children;

    public Statement(Optional<OutputArguments> outputs, Node body, Text beforeSeparator, Text separator) {
        this.outputs = outputs.map(this::adopt);
        this.body = adopt(body);
        this.beforeSeparator = beforeSeparator;
        this.separator = separator;
        this.children = childrenOf(outputs, body, beforeSeparator, separator);
    }

    public Optional<OutputArguments> outputs() {
        return outputs;
    }

    public Node body() {
        return body;
    }

    public Text beforeSeparator() {
        return beforeSeparator;
    }

    public Text separator() {
        return separator;
    }

    /**
     * {@code return}, {@code break} or {@code continue} on its own.
     */
    public boolean isControl() {
        return body instanceof Leaf;
    }

    @Override
    public List<Element> children() {
        return children;
    }
}
