package org.pragmatica.regex.tree;

/**
 * Kinds of regex tree nodes with their display tag, fixed arity and operator symbol.
 */
public enum NodeType {
    OR("OR", 2, '|'),
    AND("AND", 2, '&'),
    OPT("OPT", 1, '?'),
    MANY("MANY", 1, '*'),
    NONZERO("NONZERO", 1, '+'),
    CHAR("CHAR", 0, '#');

    /**
     * Postfix operators in the order they are tried by the parser.
     */
    public static final String POSTFIX_OPERATORS = "+?*";

    private final String tag;
    private final int arity;
    private final char symbol;

    NodeType(String tag, int arity, char symbol) {
        this.tag = tag;
        this.arity = arity;
        this.symbol = symbol;
    }

    public String tag() {
        return tag;
    }

    public int arity() {
        return arity;
    }

    public char symbol() {
        return symbol;
    }

    public boolean isPostfix() {
        return arity == 1;
    }

    /**
     * Node type produced by a postfix operator character.
     *
     * @throws IllegalArgumentException if {@code c} is not one of {@code + ? *}
     */
    public static NodeType forPostfix(char c) {
        return switch (c) {
            case '+' -> NONZERO;
            case '?' -> OPT;
            case '*' -> MANY;
            default -> throw new IllegalArgumentException("Not a postfix operator: '" + c + "'");
        };
    }
}
