package org.pragmatica.regex.parser;

import org.pragmatica.regex.tree.SourceLocation;
import org.pragmatica.regex.tree.SourceSpan;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Forward-only scanner over a pattern.
 *
 * <p>The cursor never copies the pattern and never backtracks on its own; callers save a
 * position with {@link #location()} and return to it with {@link #restoreLocation(SourceLocation)}.
 * Match operations that do not match leave the position unchanged.
 */
public final class Cursor {

    private final String input;
    private SourceLocation location;

    private Cursor(String input, SourceLocation location) {
        this.input = input;
        this.location = location;
    }

    public static Cursor over(String input) {
        checkNotNull(input, "input");
        return new Cursor(input, SourceLocation.START);
    }

    // === Position Management ===

    /**
     * Snapshot of the current position.
     */
    public SourceLocation location() {
        return location;
    }

    public void restoreLocation(SourceLocation loc) {
        checkNotNull(loc, "loc");
        checkArgument(loc.offset() >= 0 && loc.offset() <= input.length(),
                      "location %s is outside of the input", loc);
        this.location = loc;
    }

    public int pos() {
        return location.offset();
    }

    public boolean isAtEnd() {
        return pos() >= input.length();
    }

    public int remaining() {
        return input.length() - pos();
    }

    public String remainingInput() {
        return input.substring(pos());
    }

    public Optional<Character> peek() {
        return isAtEnd() ? Optional.empty() : Optional.of(input.charAt(pos()));
    }

    // === Matching ===

    /**
     * Consume and return the next character, or return empty at the end of input.
     */
    public Optional<Character> matchAnyChar() {
        if (isAtEnd()) {
            return Optional.empty();
        }
        return Optional.of(advance());
    }

    /**
     * Consume the next character if it is {@code c}.
     */
    public boolean matchChar(char c) {
        if (isAtEnd() || input.charAt(pos()) != c) {
            return false;
        }
        advance();
        return true;
    }

    /**
     * Consume and return the next character if it does not occur in {@code set}.
     */
    public Optional<Character> matchCharNotIn(String set) {
        if (isAtEnd() || set.indexOf(input.charAt(pos())) >= 0) {
            return Optional.empty();
        }
        return Optional.of(advance());
    }

    /**
     * Consume and return the next character if it occurs in {@code set}.
     */
    public Optional<Character> matchAnyCharIn(String set) {
        if (isAtEnd() || set.indexOf(input.charAt(pos())) < 0) {
            return Optional.empty();
        }
        return Optional.of(advance());
    }

    // === Accessors ===

    public String input() {
        return input;
    }

    public SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, location);
    }

    private char advance() {
        char c = input.charAt(pos());
        location = location.after(c);
        return c;
    }
}
