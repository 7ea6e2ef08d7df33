package org.pragmatica.regex.parser;

import org.pragmatica.regex.error.ParseError;
import org.pragmatica.regex.tree.NodeType;
import org.pragmatica.regex.tree.RegexNode;
import org.pragmatica.regex.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Recursive-descent parser for the pattern grammar:
 * <pre>
 * Alternation &lt;- Sequence ('|' Sequence)?
 * Sequence    &lt;- Postfix Sequence?
 * Postfix     &lt;- Atom ('+' / '?' / '*')?
 * Atom        &lt;- '(' Alternation ')' / '.' / EscapedChar
 * </pre>
 *
 * <p>Concatenation is right-nested: {@code abc} parses as {@code AND(a, AND(b, c))}.
 * An alternation holds at most two branches, so {@code a|b|c} parses {@code a|b} and
 * leaves {@code |c}.
 *
 * <p>The engine keeps no per-parse state and can be shared between threads.
 */
public final class RegexEngine implements Parser {

    /**
     * Characters that can not appear unescaped as literals.
     */
    static final String RESERVED = "|*+?()";

    private final ParserConfig config;

    private RegexEngine(ParserConfig config) {
        this.config = config;
    }

    public static RegexEngine create(ParserConfig config) {
        checkNotNull(config, "config");
        return new RegexEngine(config);
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    @Override
    public ParseResult parse(String pattern) {
        checkNotNull(pattern, "pattern");
        return checkLength(pattern) ? parseAll(new Rules(pattern, config)) : tooLong(pattern);
    }

    @Override
    public ParseResult parsePrefix(String pattern) {
        checkNotNull(pattern, "pattern");
        return checkLength(pattern) ? parsePrefix(new Rules(pattern, config)) : tooLong(pattern);
    }

    private boolean checkLength(String pattern) {
        return pattern.length() <= config.maxInputLength();
    }

    private ParseResult tooLong(String pattern) {
        return ParseResult.Failure.of(new ParseError.InputTooLong(SourceLocation.START,
                                                                  pattern.length(),
                                                                  config.maxInputLength()));
    }

    private static ParseResult parsePrefix(Rules rules) {
        var result = rules.alternation(SourceLocation.START);
        if (result instanceof ParseResult.Failure) {
            return ParseResult.Failure.of(rules.furthestFailure());
        }
        return result;
    }

    private static ParseResult parseAll(Rules rules) {
        var result = parsePrefix(rules);
        if (!(result instanceof ParseResult.Success success)) {
            return result;
        }
        var end = success.end();
        if (end.offset() == rules.cursor().input().length()) {
            return success;
        }
        // Report what stopped the expression when it went past the point where parsing ended
        var furthest = rules.furthestFailure();
        if (end.isBefore(furthest.location()) || furthest instanceof ParseError.DanglingEscape) {
            return ParseResult.Failure.of(furthest);
        }
        var remaining = rules.cursor().input().substring(end.offset());
        return ParseResult.Failure.of(new ParseError.TrailingInput(end, remaining));
    }

    /**
     * Map the character after a backslash to the character it denotes.
     */
    static char unescape(char c) {
        return switch (c) {
            case 'b' -> '\b';
            case 'n' -> '\n';
            case 'f' -> '\f';
            case 'r' -> '\r';
            case 't' -> '\t';
            default -> c;
        };
    }

    /**
     * Grammar rules bound to one pattern.
     *
     * <p>Every rule takes the location to start at and leaves the cursor just past the
     * matched text on success, or at the start location on failure.
     */
    static final class Rules {
        private final Cursor cursor;
        private final ParserConfig config;
        private int depth;
        private ParseError furthest;

        Rules(String pattern, ParserConfig config) {
            this.cursor = Cursor.over(pattern);
            this.config = config;
            this.depth = 0;
            this.furthest = null;
        }

        Cursor cursor() {
            return cursor;
        }

        ParseError furthestFailure() {
            return furthest != null
                   ? furthest
                   : new ParseError.UnexpectedEof(cursor.location(), "expression");
        }

        // === Rules ===

        ParseResult alternation(SourceLocation from) {
            var left = sequence(from);
            if (!(left instanceof ParseResult.Success lhs)) {
                return left;
            }
            cursor.restoreLocation(lhs.end());
            if (!cursor.matchChar('|')) {
                return lhs;
            }
            var right = sequence(cursor.location());
            if (right instanceof ParseResult.Fatal) {
                return right;
            }
            if (!(right instanceof ParseResult.Success rhs)) {
                cursor.restoreLocation(lhs.end());
                return lhs;
            }
            return success(new RegexNode.Or(lhs.node(), rhs.node()), from, rhs.end());
        }

        ParseResult sequence(SourceLocation from) {
            var first = postfix(from);
            if (!(first instanceof ParseResult.Success head)) {
                return first;
            }
            // Iterative form of Postfix Sequence?, so long patterns do not deepen the stack
            var elements = new ArrayList<RegexNode>();
            elements.add(head.node());
            var end = head.end();
            while (true) {
                var next = postfix(end);
                if (next instanceof ParseResult.Fatal) {
                    return next;
                }
                if (!(next instanceof ParseResult.Success tail)) {
                    break;
                }
                elements.add(tail.node());
                end = tail.end();
            }
            return success(concatenate(elements), from, end);
        }

        ParseResult postfix(SourceLocation from) {
            var atom = atom(from);
            if (!(atom instanceof ParseResult.Success operand)) {
                return atom;
            }
            cursor.restoreLocation(operand.end());
            var node = cursor.matchAnyCharIn(NodeType.POSTFIX_OPERATORS)
                             .map(op -> RegexNode.postfix(op, operand.node()))
                             .orElse(operand.node());
            return success(node, from, cursor.location());
        }

        ParseResult atom(SourceLocation from) {
            var group = group(from);
            if (!(group instanceof ParseResult.Failure)) {
                return group;
            }
            var any = wildcard(from);
            if (any.isSuccess()) {
                return any;
            }
            return literal(from);
        }

        ParseResult group(SourceLocation from) {
            cursor.restoreLocation(from);
            if (!cursor.matchChar('(')) {
                return fail(from, expected(from, "'('"));
            }
            if (depth >= config.maxNestingDepth()) {
                cursor.restoreLocation(from);
                return ParseResult.Fatal.of(new ParseError.NestingTooDeep(from, config.maxNestingDepth()));
            }
            depth++;
            ParseResult inner;
            try {
                inner = alternation(cursor.location());
            } finally {
                depth--;
            }
            if (inner instanceof ParseResult.Fatal) {
                return inner;
            }
            if (!(inner instanceof ParseResult.Success body)) {
                cursor.restoreLocation(from);
                return inner;
            }
            cursor.restoreLocation(body.end());
            if (!cursor.matchChar(')')) {
                return fail(from, expected(body.end(), "')'"));
            }
            return success(body.node(), from, cursor.location());
        }

        ParseResult wildcard(SourceLocation from) {
            cursor.restoreLocation(from);
            if (!cursor.matchChar('.')) {
                return fail(from, expected(from, "'.'"));
            }
            return success(RegexNode.CharRange.ANY, from, cursor.location());
        }

        ParseResult literal(SourceLocation from) {
            cursor.restoreLocation(from);
            var first = cursor.matchCharNotIn(RESERVED);
            if (first.isEmpty()) {
                return fail(from, expected(from, "character"));
            }
            char value = first.get();
            if (value == '\\') {
                var escaped = cursor.matchAnyChar();
                if (escaped.isEmpty()) {
                    var error = new ParseError.DanglingEscape(from);
                    if (config.strictEscapes()) {
                        cursor.restoreLocation(from);
                        return ParseResult.Fatal.of(error);
                    }
                    return fail(from, error);
                }
                value = unescape(escaped.get());
            }
            return success(RegexNode.CharRange.literal(value), from, cursor.location());
        }

        // === Helpers ===

        private ParseResult success(RegexNode node, SourceLocation from, SourceLocation end) {
            cursor.restoreLocation(end);
            return ParseResult.Success.of(node, from, end);
        }

        private ParseResult fail(SourceLocation from, ParseError error) {
            cursor.restoreLocation(from);
            recordFailure(error);
            return ParseResult.Failure.of(error);
        }

        private ParseError expected(SourceLocation at, String what) {
            var input = cursor.input();
            if (at.offset() >= input.length()) {
                return new ParseError.UnexpectedEof(at, what);
            }
            return new ParseError.UnexpectedInput(at, String.valueOf(input.charAt(at.offset())), what);
        }

        private void recordFailure(ParseError error) {
            if (furthest == null || furthest.location().isBefore(error.location())) {
                furthest = error;
            } else if (furthest.location().offset() == error.location().offset()) {
                furthest = merge(furthest, error);
            }
        }

        private static ParseError merge(ParseError current, ParseError next) {
            if (current instanceof ParseError.UnexpectedInput a && next instanceof ParseError.UnexpectedInput b) {
                return new ParseError.UnexpectedInput(a.location(), a.found(), mergeExpected(a.expected(), b.expected()));
            }
            if (current instanceof ParseError.UnexpectedEof a && next instanceof ParseError.UnexpectedEof b) {
                return new ParseError.UnexpectedEof(a.location(), mergeExpected(a.expected(), b.expected()));
            }
            // A dangling escape is more specific than any expectation at the same spot
            return next instanceof ParseError.DanglingEscape ? next : current;
        }

        private static String mergeExpected(String current, String next) {
            return current.contains(next) ? current : current + " or " + next;
        }

        private static RegexNode concatenate(List<RegexNode> elements) {
            var node = elements.get(elements.size() - 1);
            for (int i = elements.size() - 2; i >= 0; i--) {
                node = new RegexNode.And(elements.get(i), node);
            }
            return node;
        }
    }
}
