package org.pragmatica.regex.tree;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Indented text rendering of a regex tree for human inspection.
 *
 * <p>Example output for {@code c|d}:
 * <pre>
 *  OR
 *   CHAR c d
 *   CHAR d e
 * </pre>
 *
 * <p>The format is not machine-readable and may change.
 */
public final class TreePrinter {
    private TreePrinter() {}

    /**
     * Render the tree rooted at {@code root}.
     */
    public static String render(RegexNode root) {
        var sb = new StringBuilder();
        renderTo(root, sb);
        return sb.toString();
    }

    /**
     * Render the tree rooted at {@code root} into {@code out}.
     */
    public static void renderTo(RegexNode root, Appendable out) {
        checkNotNull(root, "root");
        checkNotNull(out, "out");
        // Right-nested concatenation makes trees as deep as the pattern is long
        var pending = new ArrayDeque<Entry>();
        pending.push(new Entry(root, 0));
        try {
            while (!pending.isEmpty()) {
                var entry = pending.pop();
                appendLine(entry.node(), entry.depth(), out);
                var children = entry.node().children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.push(new Entry(children.get(i), entry.depth() + 1));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Printable form of a range boundary: printable ASCII as is, anything else as {@code \\uXXXX}.
     */
    public static String boundary(int c) {
        if (c > ' ' && c < 0x7F) {
            return String.valueOf((char) c);
        }
        return String.format("\\u%04x", c);
    }

    private static void appendLine(RegexNode node, int depth, Appendable out) throws IOException {
        out.append(" ".repeat(depth))
           .append(' ')
           .append(node.type().tag());
        if (node instanceof RegexNode.CharRange range) {
            out.append(' ')
               .append(boundary(range.begin()))
               .append(' ')
               .append(boundary(range.end()));
        }
        out.append('\n');
    }

    private record Entry(RegexNode node, int depth) {}
}
