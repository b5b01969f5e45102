package org.dxworks.texmd.markdown;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.CustomBlock;
import org.commonmark.node.CustomNode;
import org.commonmark.node.Document;
import org.commonmark.node.Emphasis;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;

/**
 * Renders a converted Markdown tree to text.
 *
 * <p>Text literals are written as they are: converters emit Markdown-ready strings.
 * Blocks (headings, block quotes, display equations) are separated by one blank line.
 */
public class MarkdownPrinter {

    public String print(Node node) {
        PrintingVisitor visitor = new PrintingVisitor();
        node.accept(visitor);
        return finish(visitor.out);
    }

    private static String finish(StringBuilder out) {
        String text = out.toString().replaceAll("\n{3,}", "\n\n").strip();
        return text.isEmpty() ? "" : text + "\n";
    }

    private static class PrintingVisitor extends AbstractVisitor {
        private final StringBuilder out = new StringBuilder();

        @Override
        public void visit(Document document) {
            visitChildren(document);
        }

        @Override
        public void visit(Heading heading) {
            startBlock();
            String content = renderChildren(heading).replace('\n', ' ').strip();
            out.append("#".repeat(heading.getLevel())).append(' ').append(content);
            endBlock();
        }

        @Override
        public void visit(BlockQuote blockQuote) {
            startBlock();
            String[] lines = renderChildren(blockQuote).strip().split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) out.append('\n');
                String line = lines[i].stripTrailing();
                out.append(line.isEmpty() ? ">" : "> " + line);
            }
            endBlock();
        }

        @Override
        public void visit(StrongEmphasis strongEmphasis) {
            out.append(strongEmphasis.getOpeningDelimiter());
            visitChildren(strongEmphasis);
            out.append(strongEmphasis.getClosingDelimiter());
        }

        @Override
        public void visit(Emphasis emphasis) {
            out.append(emphasis.getOpeningDelimiter());
            visitChildren(emphasis);
            out.append(emphasis.getClosingDelimiter());
        }

        @Override
        public void visit(Text text) {
            out.append(text.getLiteral());
        }

        @Override
        public void visit(CustomNode customNode) {
            if (customNode instanceof InlineMath) {
                out.append('$').append(((InlineMath) customNode).getLiteral()).append('$');
                return;
            }
            super.visit(customNode);
        }

        @Override
        public void visit(CustomBlock customBlock) {
            if (customBlock instanceof DisplayEquation) {
                startBlock();
                out.append("$$\n").append(((DisplayEquation) customBlock).getLiteral().strip()).append("\n$$");
                endBlock();
                return;
            }
            super.visit(customBlock);
        }

        private String renderChildren(Node parent) {
            PrintingVisitor nested = new PrintingVisitor();
            for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
                child.accept(nested);
            }
            return finish(nested.out);
        }

        // Trailing whitespace before a block is dropped; the block starts after a blank line.
        private void startBlock() {
            int end = out.length();
            while (end > 0 && Character.isWhitespace(out.charAt(end - 1))) end--;
            out.setLength(end);
            if (end > 0) {
                out.append("\n\n");
            }
        }

        private void endBlock() {
            out.append("\n\n");
        }
    }
}
