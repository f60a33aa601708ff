package org.pragmatica.kakapo.parser;

import org.pragmatica.kakapo.tree.SourceLocation;

import java.util.List;

/**
 * Result of parsing an expression - either success with its parts or failure.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Successful parse with the end position. Only rule results carry parts;
     * expressions inside a rule add theirs to the rule's collector directly.
     */
    record Success(SourceLocation endLocation, List<Object> values) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        public static Success at(SourceLocation endLocation) {
            return new Success(endLocation, List.of());
        }

        public static Success of(SourceLocation endLocation, List<Object> values) {
            return new Success(endLocation, List.copyOf(values));
        }
    }

    /**
     * Failed parse - no match at current position.
     */
    record Failure(SourceLocation location, String expected) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        public static Failure at(SourceLocation location, String expected) {
            return new Failure(location, expected);
        }
    }
}
