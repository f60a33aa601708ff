package org.pragmatica.kakapo.tree;

/**
 * Closing {@code end} of a block, the space before it and its optional punctuation.
 * The keyword is empty for a function written without {@code end}.
 */
public record Terminator(Text before, Leaf keyword, Text punctuation) {

    public boolean isMissing() {
        return keyword.text().isEmpty();
    }
}
