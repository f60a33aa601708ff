package org.pragmatica.kakapo.grammar;

import com.google.common.base.Preconditions;
import org.pragmatica.kakapo.action.Parts;

import java.util.List;

/**
 * PEG expression types - the building blocks of grammar rules.
 *
 * <p>Only rule references, token boundaries and {@link Empty} contribute parts to
 * the enclosing rule's action; everything else just consumes input.
 */
public sealed interface Expression {

    // === Terminals ===

    /**
     * Literal string match: 'text'
     */
    record Literal(String text) implements Expression {}

    /**
     * Character class: [a-z], [^a-z]
     */
    record CharClass(String pattern, boolean negated) implements Expression {}

    /**
     * Any character: .
     */
    record Any() implements Expression {}

    /**
     * Rule reference: RuleName
     */
    record Reference(String ruleName) implements Expression {}

    /**
     * Longest of several words: 'word1' | 'word2' | 'word3'
     */
    record Dictionary(List<String> words) implements Expression {}

    // === Combinators ===

    /**
     * Sequence: e1 e2 e3
     */
    record Sequence(List<Expression> elements) implements Expression {}

    /**
     * Ordered choice: e1 / e2 / e3
     */
    record Choice(List<Expression> alternatives) implements Expression {}

    // === Repetition ===

    /**
     * Zero or more: e*
     */
    record ZeroOrMore(Expression expression) implements Expression {}

    /**
     * One or more: e+
     */
    record OneOrMore(Expression expression) implements Expression {}

    /**
     * Optional: e?
     */
    record Optional(Expression expression) implements Expression {}

    /**
     * Repetition with bounds: e{n,m}
     */
    record Repetition(Expression expression, int min, int max) implements Expression {}

    // === Predicates ===

    /**
     * Positive lookahead: &e
     */
    record And(Expression expression) implements Expression {}

    /**
     * Negative lookahead: !e
     */
    record Not(Expression expression) implements Expression {}

    // === Special ===

    /**
     * Token boundary: < e > - contributes the matched text as one part
     */
    record TokenBoundary(Expression expression) implements Expression {}

    /**
     * Matches nothing and contributes a fixed part.
     */
    record Empty(Object value) implements Expression {}

    // === Factories ===

    static Expression literal(String text) {
        return new Literal(text);
    }

    static Expression charClass(String pattern) {
        return new CharClass(pattern, false);
    }

    static Expression noneOf(String pattern) {
        return new CharClass(pattern, true);
    }

    static Expression any() {
        return new Any();
    }

    static Expression ref(String ruleName) {
        return new Reference(ruleName);
    }

    static Expression dictionary(String... words) {
        return new Dictionary(List.of(words));
    }

    static Expression seq(Expression... elements) {
        return elements.length == 1
               ? elements[0]
               : new Sequence(List.of(elements));
    }

    static Expression choice(Expression... alternatives) {
        return new Choice(List.of(alternatives));
    }

    static Expression zeroOrMore(Expression... expression) {
        return new ZeroOrMore(seq(expression));
    }

    static Expression oneOrMore(Expression... expression) {
        return new OneOrMore(seq(expression));
    }

    static Expression optional(Expression... expression) {
        return new Optional(seq(expression));
    }

    static Expression repeat(Expression expression, int min, int max) {
        Preconditions.checkArgument(min >= 0 && min <= max, "Invalid bounds {%s,%s}", min, max);
        return new Repetition(expression, min, max);
    }

    static Expression and(Expression... expression) {
        return new And(seq(expression));
    }

    static Expression not(Expression... expression) {
        return new Not(seq(expression));
    }

    static Expression token(Expression... expression) {
        return new TokenBoundary(seq(expression));
    }

    /**
     * Contributes an empty text part.
     */
    static Expression nothing() {
        return new Empty("");
    }

    /**
     * Contributes {@link Parts#ABSENT}.
     */
    static Expression absent() {
        return new Empty(Parts.ABSENT);
    }

    /**
     * End of input: !.
     */
    static Expression endOfInput() {
        return not(any());
    }
}
