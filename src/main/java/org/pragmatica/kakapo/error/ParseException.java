package org.pragmatica.kakapo.error;

import org.pragmatica.kakapo.tree.SourceLocation;

/**
 * Input does not match the grammar.
 *
 * <p>Carries the furthest position the parser reached, the text found there and
 * the constructs that would have been accepted. Not recoverable for that input.
 */
public final class ParseException extends Exception {
    private final SourceLocation location;
    private final String found;
    private final String expected;

    public ParseException(SourceLocation location, String found, String expected) {
        super(describe(location, found, expected));
        this.location = location;
        this.found = found;
        this.expected = expected;
    }

    public SourceLocation location() {
        return location;
    }

    /**
     * Text at the failure position, empty at end of input.
     */
    public String found() {
        return found;
    }

    public String expected() {
        return expected;
    }

    private static String describe(SourceLocation location, String found, String expected) {
        if (found.isEmpty()) {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
        return "Unexpected '" + found + "' at " + location + ", expected " + expected;
    }
}
