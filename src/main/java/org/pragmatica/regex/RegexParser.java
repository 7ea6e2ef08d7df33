package org.pragmatica.regex;

import org.pragmatica.regex.parser.ParseResult;
import org.pragmatica.regex.parser.Parser;
import org.pragmatica.regex.parser.ParserConfig;
import org.pragmatica.regex.parser.RegexEngine;
import org.pragmatica.regex.tree.RegexNode;

import java.util.Optional;

/**
 * Entry point for parsing patterns.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = RegexParser.parse("c|d(f?|g)");
 * var tree = result.tree().orElseThrow();
 *
 * var parser = RegexParser.builder()
 *                         .maxNestingDepth(16)
 *                         .strictEscapes(true)
 *                         .build();
 * }</pre>
 */
public final class RegexParser {
    private static final Parser DEFAULT_PARSER = RegexEngine.create(ParserConfig.DEFAULT);

    private RegexParser() {}

    /**
     * Create a parser with default configuration.
     */
    public static Parser create() {
        return DEFAULT_PARSER;
    }

    /**
     * Create a parser with custom configuration.
     */
    public static Parser create(ParserConfig config) {
        return RegexEngine.create(config);
    }

    /**
     * Parse the whole pattern with default configuration.
     */
    public static ParseResult parse(String pattern) {
        return DEFAULT_PARSER.parse(pattern);
    }

    /**
     * Parse the longest expression at the start of the pattern with default configuration.
     */
    public static ParseResult parsePrefix(String pattern) {
        return DEFAULT_PARSER.parsePrefix(pattern);
    }

    /**
     * Tree of the longest expression at the start of the pattern, if there is one.
     */
    public static Optional<RegexNode> tree(String pattern) {
        return DEFAULT_PARSER.tree(pattern);
    }

    /**
     * Create a builder for a custom parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxNestingDepth = ParserConfig.DEFAULT_MAX_NESTING_DEPTH;
        private int maxInputLength = ParserConfig.DEFAULT_MAX_INPUT_LENGTH;
        private boolean strictEscapes = false;

        private Builder() {}

        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        public Builder maxInputLength(int length) {
            this.maxInputLength = length;
            return this;
        }

        public Builder strictEscapes(boolean strict) {
            this.strictEscapes = strict;
            return this;
        }

        public Parser build() {
            return create(new ParserConfig(maxNestingDepth, maxInputLength, strictEscapes));
        }
    }
}
