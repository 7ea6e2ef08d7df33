package org.pragmatica.regex.parser;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Parser configuration options.
 *
 * @param maxNestingDepth deepest allowed group nesting, {@code ((a))} has depth 2
 * @param maxInputLength  longest accepted pattern, in characters
 * @param strictEscapes   whether a trailing lone backslash aborts the parse instead of
 *                        ending the expression before it
 */
public record ParserConfig(
    int maxNestingDepth,
    int maxInputLength,
    boolean strictEscapes
) {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;
    public static final int DEFAULT_MAX_INPUT_LENGTH = 1_000_000;

    public static final ParserConfig DEFAULT = new ParserConfig(
        DEFAULT_MAX_NESTING_DEPTH,
        DEFAULT_MAX_INPUT_LENGTH,
        false
    );

    public ParserConfig {
        checkArgument(maxNestingDepth > 0, "maxNestingDepth must be positive: %s", maxNestingDepth);
        checkArgument(maxInputLength > 0, "maxInputLength must be positive: %s", maxInputLength);
    }
}
