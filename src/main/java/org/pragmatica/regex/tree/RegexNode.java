package org.pragmatica.regex.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Regular expression syntax tree node.
 *
 * <p>Nodes are immutable and own their children exclusively. Grouping leaves no trace in
 * the tree, so {@code (a|b)} and {@code a|b} produce equal nodes. Equality and hashing are
 * structural and do not recurse, so they hold for trees of any depth; {@code toString}
 * describes one level only, use {@link TreePrinter} for the whole tree.
 */
public sealed interface RegexNode {

    /**
     * Kind of this node.
     */
    NodeType type();

    /**
     * Children of this node, always exactly {@code type().arity()} of them.
     */
    List<RegexNode> children();

    /**
     * Build a node of the given type from its children.
     *
     * @throws IllegalArgumentException if the number of children does not match the arity
     *                                  of {@code type}, or if {@code type} is {@link NodeType#CHAR}
     */
    static RegexNode of(NodeType type, List<RegexNode> children) {
        checkNotNull(type, "type");
        checkNotNull(children, "children");
        checkArgument(type != NodeType.CHAR, "CHAR nodes are built from a range, not from children");
        checkArgument(children.size() == type.arity(),
                      "%s expects %s children, got %s", type, type.arity(), children.size());
        return switch (type) {
            case OR -> new Or(children.get(0), children.get(1));
            case AND -> new And(children.get(0), children.get(1));
            case OPT -> new Optional(children.get(0));
            case MANY -> new ZeroOrMore(children.get(0));
            case NONZERO -> new OneOrMore(children.get(0));
            case CHAR -> throw new IllegalStateException("unreachable");
        };
    }

    /**
     * Wrap {@code child} into the repetition node denoted by a postfix operator.
     */
    static RegexNode postfix(char operator, RegexNode child) {
        return of(NodeType.forPostfix(operator), List.of(child));
    }

    /**
     * Characters in the half-open range {@code [begin, end)}.
     *
     * <p>Bounds are UTF-16 code units; {@code end} may be {@code Character.MAX_VALUE + 1}
     * so that the range can include the maximum character.
     */
    record CharRange(int begin, int end) implements RegexNode {
        public static final int DOMAIN_END = Character.MAX_VALUE + 1;

        /**
         * Wildcard range accepting every character.
         */
        public static final CharRange ANY = new CharRange(Character.MIN_VALUE, DOMAIN_END);

        public CharRange {
            checkArgument(begin >= Character.MIN_VALUE && begin < end && end <= DOMAIN_END,
                          "invalid character range [%s, %s)", begin, end);
        }

        public static CharRange literal(char c) {
            return new CharRange(c, c + 1);
        }

        public boolean isSingle() {
            return end - begin == 1;
        }

        public boolean contains(char c) {
            return c >= begin && c < end;
        }

        @Override
        public NodeType type() {
            return NodeType.CHAR;
        }

        @Override
        public String toString() {
            return "CHAR " + TreePrinter.boundary(begin) + " " + TreePrinter.boundary(end);
        }

        @Override
        public List<RegexNode> children() {
            return ImmutableList.of();
        }
    }

    /**
     * Alternation: {@code left|right}.
     */
    record Or(RegexNode left, RegexNode right) implements RegexNode {
        public Or {
            checkNotNull(left, "left");
            checkNotNull(right, "right");
        }

        @Override
        public NodeType type() {
            return NodeType.OR;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RegexNode other && TreeStructure.equal(this, other);
        }

        @Override
        public int hashCode() {
            return TreeStructure.hash(this);
        }

        @Override
        public String toString() {
            return TreeStructure.describe(this);
        }

        @Override
        public List<RegexNode> children() {
            return ImmutableList.of(left, right);
        }
    }

    /**
     * Concatenation: {@code first} followed by {@code second}.
     */
    record And(RegexNode first, RegexNode second) implements RegexNode {
        public And {
            checkNotNull(first, "first");
            checkNotNull(second, "second");
        }

        @Override
        public NodeType type() {
            return NodeType.AND;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RegexNode other && TreeStructure.equal(this, other);
        }

        @Override
        public int hashCode() {
            return TreeStructure.hash(this);
        }

        @Override
        public String toString() {
            return TreeStructure.describe(this);
        }

        @Override
        public List<RegexNode> children() {
            return ImmutableList.of(first, second);
        }
    }

    /**
     * Zero or one: {@code e?}
     */
    record Optional(RegexNode child) implements RegexNode {
        public Optional {
            checkNotNull(child, "child");
        }

        @Override
        public NodeType type() {
            return NodeType.OPT;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RegexNode other && TreeStructure.equal(this, other);
        }

        @Override
        public int hashCode() {
            return TreeStructure.hash(this);
        }

        @Override
        public String toString() {
            return TreeStructure.describe(this);
        }

        @Override
        public List<RegexNode> children() {
            return ImmutableList.of(child);
        }
    }

    /**
     * Zero or more: {@code e*}
     */
    record ZeroOrMore(RegexNode child) implements RegexNode {
        public ZeroOrMore {
            checkNotNull(child, "child");
        }

        @Override
        public NodeType type() {
            return NodeType.MANY;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RegexNode other && TreeStructure.equal(this, other);
        }

        @Override
        public int hashCode() {
            return TreeStructure.hash(this);
        }

        @Override
        public String toString() {
            return TreeStructure.describe(this);
        }

        @Override
        public List<RegexNode> children() {
            return ImmutableList.of(child);
        }
    }

    /**
     * One or more: {@code e+}
     */
    record OneOrMore(RegexNode child) implements RegexNode {
        public OneOrMore {
            checkNotNull(child, "child");
        }

        @Override
        public NodeType type() {
            return NodeType.NONZERO;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RegexNode other && TreeStructure.equal(this, other);
        }

        @Override
        public int hashCode() {
            return TreeStructure.hash(this);
        }

        @Override
        public String toString() {
            return TreeStructure.describe(this);
        }

        @Override
        public List<RegexNode> children() {
            return ImmutableList.of(child);
        }
    }
}
