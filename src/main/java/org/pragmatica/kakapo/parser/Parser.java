package org.pragmatica.kakapo.parser;

import org.pragmatica.kakapo.error.ParseException;
import org.pragmatica.kakapo.tree.Node;

/**
 * Parser interface - parses input text according to a grammar.
 *
 * <p>The whole input must be consumed, otherwise parsing fails.
 */
public interface Parser {

    /**
     * Parse input starting from the grammar's start rule.
     */
    Node parse(String input) throws ParseException;

    /**
     * Parse input starting from a specific rule.
     */
    Node parse(String input, String startRule) throws ParseException;
}
