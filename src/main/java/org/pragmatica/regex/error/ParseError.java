package org.pragmatica.regex.error;

import org.pragmatica.regex.tree.SourceLocation;

/**
 * Reason a pattern could not be parsed, with the location it refers to.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Short label shown under the offending position in diagnostics.
     */
    default String label() {
        return message();
    }

    /**
     * Unexpected input character.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }

        @Override
        public String label() {
            return "expected " + expected;
        }
    }

    /**
     * Unexpected end of pattern.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of pattern at " + location + ", expected " + expected;
        }

        @Override
        public String label() {
            return "expected " + expected;
        }
    }

    /**
     * Backslash at the end of the pattern with nothing to escape.
     */
    record DanglingEscape(SourceLocation location) implements ParseError {
        @Override
        public String message() {
            return "Dangling escape at " + location + ", '\\' must be followed by a character";
        }

        @Override
        public String label() {
            return "nothing to escape";
        }
    }

    /**
     * Pattern parsed only partially.
     */
    record TrailingInput(
    SourceLocation location,
    String remaining) implements ParseError {
        @Override
        public String message() {
            return "Unparsed input '" + remaining + "' at " + location;
        }

        @Override
        public String label() {
            return "not part of the expression";
        }
    }

    /**
     * Groups nested deeper than the configured limit.
     */
    record NestingTooDeep(
    SourceLocation location,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "Group nesting exceeds limit of " + limit + " at " + location;
        }

        @Override
        public String label() {
            return "nesting limit " + limit + " reached here";
        }
    }

    /**
     * Pattern longer than the configured limit.
     */
    record InputTooLong(
    SourceLocation location,
    int length,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "Pattern length " + length + " exceeds maximum of " + limit + " characters";
        }
    }
}
