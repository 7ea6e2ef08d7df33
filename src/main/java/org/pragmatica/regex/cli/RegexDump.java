package org.pragmatica.regex.cli;

import org.pragmatica.regex.RegexParser;
import org.pragmatica.regex.error.Diagnostic;
import org.pragmatica.regex.parser.ParseResult;
import org.pragmatica.regex.parser.Parser;
import org.pragmatica.regex.tree.TreePrinter;

import java.io.PrintStream;
import java.util.logging.Logger;

/**
 * Command line tool printing the tree of a pattern.
 *
 * <p>Usage: {@code RegexDump [pattern]}. Without an argument the pattern {@code c|d(f?|g)} is used.
 * Exits with status 1 when no tree could be built.
 */
public final class RegexDump {
    public static final String DEFAULT_PATTERN = "c|d(f?|g)";

    private static final Logger logger = Logger.getLogger(RegexDump.class.getName());

    private final Parser parser;
    private final PrintStream out;
    private final PrintStream err;

    public RegexDump(Parser parser, PrintStream out, PrintStream err) {
        this.parser = parser;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int status = new RegexDump(RegexParser.create(), System.out, System.err).run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Parse the pattern given in {@code args}, or the default one, and print its tree.
     *
     * @return process exit status
     */
    public int run(String[] args) {
        var pattern = args.length > 0 ? args[0] : DEFAULT_PATTERN;
        logger.fine(() -> "Parsing pattern \"" + pattern + "\"");

        var result = parser.parsePrefix(pattern);
        if (!(result instanceof ParseResult.Success success)) {
            var error = result.error().orElseThrow();
            logger.fine(() -> "No expression found in pattern: " + error.message());
            err.print(Diagnostic.of(error).format(pattern, "pattern"));
            return 1;
        }
        if (success.consumed() < pattern.length()) {
            logger.warning("Pattern parsed up to offset " + success.consumed()
                           + ", ignoring \"" + pattern.substring(success.consumed()) + "\"");
        }
        out.print(TreePrinter.render(success.node()));
        out.flush();
        return 0;
    }
}
