package org.pragmatica.regex.tree;

/**
 * A position in a pattern (line and column 1-based, offset 0-based).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location immediately after consuming {@code c} at this location.
     */
    public SourceLocation after(char c) {
        return c == '\n'
               ? new SourceLocation(line + 1, 1, offset + 1)
               : new SourceLocation(line, column + 1, offset + 1);
    }

    public boolean isBefore(SourceLocation other) {
        return offset < other.offset;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
