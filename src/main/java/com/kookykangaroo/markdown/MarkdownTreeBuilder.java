package com.kookykangaroo.markdown;

import lombok.extern.slf4j.Slf4j;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Code;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.ListBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Builds a heading/paragraph tree from Markdown text.
 *
 * <p>Uses {@code commonmark-java} for block parsing. Headings nest under the nearest
 * preceding heading of a lower level; paragraphs attach to the most recent heading,
 * or to the root before the first heading. Code blocks, HTML blocks, thematic breaks
 * and tight list items carry no paragraphs and are dropped.
 */
@Slf4j
@Component
public class MarkdownTreeBuilder {

    private static final Parser PARSER = Parser.builder().build();

    /**
     * Parses Markdown text into a tree. Never fails: malformed input yields whatever
     * structure the parser recovers.
     */
    public MarkdownNode parse(String markdown) {
        var document = PARSER.parse(markdown == null ? "" : markdown);

        var visitor = new TreeVisitor();
        document.accept(visitor);

        log.debug("Parsed markdown: {} headings, {} paragraphs",
                visitor.headingCount, visitor.paragraphCount);
        return visitor.root;
    }

    // ==================== Inner Visitor ====================

    private static final class TreeVisitor extends AbstractVisitor {

        private final MarkdownNode root = MarkdownNode.root();
        private final Deque<MarkdownNode> headingStack = new ArrayDeque<>();
        private int headingCount = 0;
        private int paragraphCount = 0;

        TreeVisitor() {
            headingStack.push(root);
        }

        @Override
        public void visit(Heading heading) {
            var content = extractText(heading);
            if (content.isEmpty()) {
                return;
            }

            int level = heading.getLevel();
            while (headingStack.size() > 1 && headingStack.peek().getLevel() >= level) {
                headingStack.pop();
            }

            var node = MarkdownNode.heading(content, level);
            headingStack.peek().addChild(node);
            headingStack.push(node);
            headingCount++;
            log.trace("Heading (level {}): {}", level, content);
        }

        @Override
        public void visit(Paragraph paragraph) {
            if (isTightListItem(paragraph)) {
                return;
            }

            var content = extractText(paragraph);
            if (content.isEmpty()) {
                return;
            }

            headingStack.peek().addChild(MarkdownNode.paragraph(content));
            paragraphCount++;
            log.trace("Paragraph: {}", content);
        }

        private boolean isTightListItem(Paragraph paragraph) {
            return paragraph.getParent() instanceof ListItem item
                    && item.getParent() instanceof ListBlock list
                    && list.isTight();
        }

        private String extractText(Node node) {
            var sb = new StringBuilder();
            collectText(node, sb);
            return strip(sb);
        }

        /**
         * Strips Unicode whitespace including no-break spaces, which {@link String#strip()} keeps.
         */
        private static String strip(CharSequence text) {
            int start = 0;
            int end = text.length();
            while (start < end && isBlank(text.charAt(start))) {
                start++;
            }
            while (end > start && isBlank(text.charAt(end - 1))) {
                end--;
            }
            return text.subSequence(start, end).toString();
        }

        private static boolean isBlank(char c) {
            return Character.isWhitespace(c) || Character.isSpaceChar(c);
        }

        private void collectText(Node node, StringBuilder sb) {
            if (node instanceof Text text) {
                sb.append(text.getLiteral());
            } else if (node instanceof Code code) {
                sb.append(code.getLiteral());
            } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
                sb.append('\n');
            } else if (node instanceof Image || node instanceof HtmlInline) {
                // alt text and raw HTML are not document text
            } else {
                var child = node.getFirstChild();
                while (child != null) {
                    collectText(child, sb);
                    child = child.getNext();
                }
            }
        }
    }
}
