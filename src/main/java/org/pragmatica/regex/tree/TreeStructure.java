package org.pragmatica.regex.tree;

import java.util.ArrayDeque;
import java.util.StringJoiner;

/**
 * Structural equality, hashing and description of regex trees.
 *
 * <p>Walks use an explicit stack; right-nested concatenation makes trees as deep as the
 * pattern is long.
 */
final class TreeStructure {
    private TreeStructure() {}

    static boolean equal(RegexNode left, RegexNode right) {
        var pending = new ArrayDeque<RegexNode[]>();
        pending.push(new RegexNode[]{left, right});
        while (!pending.isEmpty()) {
            var pair = pending.pop();
            var a = pair[0];
            var b = pair[1];
            if (a == b) {
                continue;
            }
            if (a.type() != b.type()) {
                return false;
            }
            if (a instanceof RegexNode.CharRange) {
                if (!a.equals(b)) {
                    return false;
                }
                continue;
            }
            var aChildren = a.children();
            var bChildren = b.children();
            for (int i = 0; i < aChildren.size(); i++) {
                pending.push(new RegexNode[]{aChildren.get(i), bChildren.get(i)});
            }
        }
        return true;
    }

    static int hash(RegexNode root) {
        var pending = new ArrayDeque<RegexNode>();
        pending.push(root);
        int h = 1;
        while (!pending.isEmpty()) {
            var node = pending.pop();
            h = 31 * h + (node instanceof RegexNode.CharRange ? node.hashCode() : node.type().ordinal());
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return h;
    }

    /**
     * One-level description, e.g. {@code AND[CHAR a b, OR]}.
     */
    static String describe(RegexNode node) {
        var joiner = new StringJoiner(", ", node.type().tag() + "[", "]");
        for (var child : node.children()) {
            joiner.add(child instanceof RegexNode.CharRange ? child.toString() : child.type().tag());
        }
        return joiner.toString();
    }
}
