package org.pragmatica.regex.parser;

import org.pragmatica.regex.error.ParseError;
import org.pragmatica.regex.tree.RegexNode;
import org.pragmatica.regex.tree.SourceLocation;
import org.pragmatica.regex.tree.SourceSpan;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Result of parsing a pattern or a part of it - either a node or the reason there is none.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The parsed tree, if any.
     */
    Optional<RegexNode> tree();

    /**
     * The parse error, if any.
     */
    Optional<ParseError> error();

    /**
     * Successful parse with the node and the span of pattern it covers.
     */
    record Success(RegexNode node, SourceSpan span) implements ParseResult {
        public Success {
            checkNotNull(node, "node");
            checkNotNull(span, "span");
        }

        public static Success of(RegexNode node, SourceLocation start, SourceLocation end) {
            return new Success(node, SourceSpan.of(start, end));
        }

        public SourceLocation end() {
            return span.end();
        }

        /**
         * Number of pattern characters consumed.
         */
        public int consumed() {
            return span.length();
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<RegexNode> tree() {
            return Optional.of(node);
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.empty();
        }
    }

    /**
     * No match. Callers may try an alternative at the same position.
     */
    record Failure(ParseError reason) implements ParseResult {
        public Failure {
            checkNotNull(reason, "reason");
        }

        public static Failure of(ParseError reason) {
            return new Failure(reason);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<RegexNode> tree() {
            return Optional.empty();
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.of(reason);
        }
    }

    /**
     * Failure that ends the whole parse - no alternatives are tried after it.
     */
    record Fatal(ParseError reason) implements ParseResult {
        public Fatal {
            checkNotNull(reason, "reason");
        }

        public static Fatal of(ParseError reason) {
            return new Fatal(reason);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<RegexNode> tree() {
            return Optional.empty();
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.of(reason);
        }
    }
}
