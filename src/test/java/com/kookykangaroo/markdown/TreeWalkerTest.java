package com.kookykangaroo.markdown;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class TreeWalkerTest {

    @Test
    void assignsIdsInPreOrder() {
        var root = MarkdownNode.root();
        var h1 = MarkdownNode.heading("Header 1", 1);
        var p1 = MarkdownNode.paragraph("Paragraph 1");
        var h2 = MarkdownNode.heading("Header 2", 2);
        var p2 = MarkdownNode.paragraph("Paragraph 2");
        var h3 = MarkdownNode.heading("Header 3", 1);
        root.addChild(h1);
        h1.addChild(p1);
        h1.addChild(h2);
        h2.addChild(p2);
        root.addChild(h3);

        int count = TreeWalker.assignIds(root);

        assertThat(count).isEqualTo(6);
        assertThat(root.getId()).isEqualTo("node_0");
        assertThat(h1.getId()).isEqualTo("node_1");
        assertThat(p1.getId()).isEqualTo("node_2");
        assertThat(h2.getId()).isEqualTo("node_3");
        assertThat(p2.getId()).isEqualTo("node_4");
        assertThat(h3.getId()).isEqualTo("node_5");
    }

    @Test
    void repeatedAssignmentYieldsSameIds() {
        var root = new MarkdownTreeBuilder().parse("# A\n\nx\n\n## B\n\ny\n\n# C\n");

        TreeWalker.assignIds(root);
        var first = new ArrayList<String>();
        TreeWalker.walk(root, (parent, child, position) -> first.add(child.getId()));

        TreeWalker.assignIds(root);
        var second = new ArrayList<String>();
        TreeWalker.walk(root, (parent, child, position) -> second.add(child.getId()));

        assertThat(second).isEqualTo(first).containsExactly("node_1", "node_2", "node_3", "node_4", "node_5");
    }

    @Test
    void reportsSiblingPositions() {
        var root = MarkdownNode.root();
        root.addChild(MarkdownNode.paragraph("a"));
        root.addChild(MarkdownNode.paragraph("b"));
        root.addChild(MarkdownNode.paragraph("c"));

        var positions = new ArrayList<Integer>();
        TreeWalker.walk(root, (parent, child, position) -> positions.add(position));

        assertThat(positions).containsExactly(0, 1, 2);
    }

    @Test
    void handlesVeryDeepTreesWithoutRecursion() {
        var root = MarkdownNode.root();
        var current = root;
        for (int i = 0; i < 100_000; i++) {
            var child = MarkdownNode.heading("h" + i, 1);
            current.addChild(child);
            current = child;
        }

        int count = TreeWalker.assignIds(root);

        assertThat(count).isEqualTo(100_001);
        assertThat(current.getId()).isEqualTo("node_100000");
    }
}
