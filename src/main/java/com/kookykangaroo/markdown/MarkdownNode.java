package com.kookykangaroo.markdown;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the in-memory Markdown tree.
 *
 * Children are owned by their parent. The parent reference is a non-owning back-reference
 * and takes no part in equality, so two trees are equal when their shape and content match.
 */
@Getter
@ToString(exclude = "parent")
@EqualsAndHashCode(exclude = {"parent", "id"})
public class MarkdownNode {

    private final NodeType type;
    private final String content;

    /**
     * Heading level 1-6; 0 for root and paragraphs.
     */
    private final int level;

    private final List<MarkdownNode> children = new ArrayList<>();

    private MarkdownNode parent;

    /**
     * Graph id, assigned right before the tree is written.
     */
    @Setter
    private String id;

    public MarkdownNode(NodeType type, String content, int level) {
        this.type = type;
        this.content = content == null ? "" : content;
        this.level = level;
    }

    public static MarkdownNode root() {
        return new MarkdownNode(NodeType.ROOT, "", 0);
    }

    public static MarkdownNode heading(String content, int level) {
        return new MarkdownNode(NodeType.HEADING, content, level);
    }

    public static MarkdownNode paragraph(String content) {
        return new MarkdownNode(NodeType.PARAGRAPH, content, 0);
    }

    public void addChild(MarkdownNode child) {
        child.parent = this;
        children.add(child);
    }

    public List<MarkdownNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isHeading() {
        return type == NodeType.HEADING;
    }
}
