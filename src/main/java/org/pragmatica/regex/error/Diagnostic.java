package org.pragmatica.regex.error;

import org.pragmatica.regex.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Human-readable report of a pattern error, formatted Rust style.
 *
 * <p>Example output:
 * <pre>
 * error: unbalanced parenthesis
 *   --> pattern:1:3
 *   |
 * 1 | ab)c
 *   |   ^ not part of the expression
 *   |
 *   = help: remove the ')' or escape it as '\)'
 * </pre>
 *
 * @param message  Primary message
 * @param location Position in the pattern the caret points at
 * @param label    Text shown next to the caret, may be empty
 * @param notes    Trailing notes and help lines
 */
public record Diagnostic(
    String message,
    SourceLocation location,
    String label,
    List<String> notes
) {
    public static Diagnostic error(String message, SourceLocation location) {
        return new Diagnostic(message, location, "", List.of());
    }

    /**
     * Build the diagnostic describing {@code error}.
     */
    public static Diagnostic of(ParseError error) {
        checkNotNull(error, "error");
        var location = error.location();
        if (error instanceof ParseError.UnexpectedInput) {
            return error("unexpected input", location).withLabel(error.label());
        }
        if (error instanceof ParseError.UnexpectedEof) {
            return error("unexpected end of pattern", location).withLabel(error.label());
        }
        if (error instanceof ParseError.DanglingEscape) {
            return error("dangling escape", location)
                .withLabel(error.label())
                .withHelp("write '\\\\' for a literal backslash");
        }
        if (error instanceof ParseError.TrailingInput trailing) {
            return trailingInput(trailing);
        }
        if (error instanceof ParseError.NestingTooDeep) {
            return error("groups nested too deeply", location)
                .withLabel(error.label())
                .withHelp("raise the nesting limit in the parser configuration");
        }
        return error("pattern too long", location).withNote(error.message());
    }

    private static Diagnostic trailingInput(ParseError.TrailingInput error) {
        var remaining = error.remaining();
        var next = remaining.isEmpty() ? ' ' : remaining.charAt(0);
        var base = switch (next) {
            case ')' -> error("unbalanced parenthesis", error.location())
                .withHelp("remove the ')' or escape it as '\\)'");
            case '|' -> error("unparsed alternative", error.location())
                .withHelp("a group holds at most two alternatives, wrap the rest in parentheses");
            case '+', '?', '*' -> error("repeated postfix operator", error.location())
                .withHelp("only one of '+', '?', '*' may follow an atom, wrap it in parentheses to repeat again");
            default -> error("unparsed input", error.location());
        };
        return base.withLabel(error.label());
    }

    public Diagnostic withLabel(String label) {
        return new Diagnostic(message, location, label, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, location, label, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic against the pattern it refers to.
     *
     * @param source the pattern text
     * @param name   name shown in the location line, e.g. {@code pattern}, or {@code null}
     */
    public String format(String source, String name) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var lineNum = location.line();
        var gutterWidth = String.valueOf(lineNum).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append("error: ").append(message).append("\n");
        sb.append("  --> ");
        if (name != null) {
            sb.append(name).append(":");
        }
        sb.append(location).append("\n");
        sb.append(gutter).append("|\n");

        if (lineNum >= 1 && lineNum <= lines.length) {
            sb.append(lineNum).append(" | ").append(lines[lineNum - 1]).append("\n");
            sb.append(gutter).append("| ").append(" ".repeat(location.column() - 1)).append('^');
            if (!label.isEmpty()) {
                sb.append(" ").append(label);
            }
            sb.append("\n");
            sb.append(gutter).append("|\n");
        }

        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }
}
