package org.pragmatica.regex.parser;

import org.pragmatica.regex.tree.RegexNode;

import java.util.Optional;

/**
 * Parser interface - turns pattern text into a regex tree.
 */
public interface Parser {

    /**
     * Parse the whole pattern. Fails if any input is left after the expression.
     */
    ParseResult parse(String pattern);

    /**
     * Parse the longest expression at the start of the pattern.
     * On success the result tells how much of the pattern was consumed.
     */
    ParseResult parsePrefix(String pattern);

    /**
     * Tree of the longest expression at the start of the pattern, empty if there is none
     * (for example for an empty pattern).
     */
    default Optional<RegexNode> tree(String pattern) {
        return parsePrefix(pattern).tree();
    }

    ParserConfig config();
}
