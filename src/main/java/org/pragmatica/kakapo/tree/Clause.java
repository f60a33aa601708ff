package org.pragmatica.kakapo.tree;

import java.util.Optional;

/**
 * Keyword, optional head and a body one level deeper than the keyword.
 */
public abstract class Clause extends Composite {
    private final Leaf keyword;
    private final Text afterKeyword;
    private final Optional<Node> head;
    private final Text beforeBody;
    private final Code body;

    protected Clause(Leaf keyword, Text afterKeyword, Optional<? extends Node> head, Text beforeBody, Code body) {
        this.keyword = adopt(keyword);
        this.afterKeyword = afterKeyword;
        this.head = head.<Node>map(this::adopt);
        this.beforeBody = beforeBody;
        this.body = adopt(body);
    }

    public Leaf keyword() {
        return keyword;
    }

    public Text afterKeyword() {
        return afterKeyword;
    }

    public Optional<Node> head() {
        return head;
    }

    public Text beforeBody() {
        return beforeBody;
    }

    public Code body() {
        return body;
    }

    /**
     * Whether {@code node} is the head of this clause.
     */
    public boolean isHead(Node node) {
        return head.isPresent() && head.get() == node;
    }

    @Override
    protected int childLevel(Node child, int level) {
        return child == body ? level + 1 : level;
    }
}
