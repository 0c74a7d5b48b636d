package com.kookykangaroo.markdown;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Pre-order walk over the parent/child pairs of a Markdown tree.
 *
 * Uses an explicit stack of (parent, next child index) frames so document depth
 * is bounded by heap rather than by the thread stack.
 */
public final class TreeWalker {

    private TreeWalker() {
    }

    /**
     * Callback for each parent/child pair, in pre-order of the child.
     * {@code position} is the child's index among its siblings.
     */
    @FunctionalInterface
    public interface EdgeVisitor {
        void visit(MarkdownNode parent, MarkdownNode child, int position);
    }

    public static void walk(MarkdownNode root, EdgeVisitor visitor) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 0));

        while (!stack.isEmpty()) {
            var frame = stack.pop();
            var children = frame.parent().getChildren();
            if (frame.childIndex() >= children.size()) {
                continue;
            }

            var child = children.get(frame.childIndex());
            stack.push(new Frame(frame.parent(), frame.childIndex() + 1));
            visitor.visit(frame.parent(), child, frame.childIndex());

            if (!child.getChildren().isEmpty()) {
                stack.push(new Frame(child, 0));
            }
        }
    }

    /**
     * Assigns {@code node_0} to the root and {@code node_1, node_2, ...} to the
     * remaining nodes in pre-order. Repeated calls on the same tree yield the same ids.
     *
     * @return the number of nodes in the tree
     */
    public static int assignIds(MarkdownNode root) {
        root.setId(nodeId(0));
        var counter = new int[]{1};
        walk(root, (parent, child, position) -> child.setId(nodeId(counter[0]++)));
        return counter[0];
    }

    public static String nodeId(int ordinal) {
        return "node_" + ordinal;
    }

    private record Frame(MarkdownNode parent, int childIndex) {
    }
}
