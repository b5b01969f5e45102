package org.dxworks.texmd.markdown;

import org.commonmark.node.BlockQuote;
import org.commonmark.node.Document;
import org.commonmark.node.Emphasis;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;

import java.util.List;

/**
 * Factory methods for the commonmark nodes the converters emit.
 */
public final class MarkdownNodes {

    public static final int MAX_HEADING_LEVEL = 4;

    private MarkdownNodes() {
        // utility class
    }

    public static Text text(String literal) {
        return new Text(literal);
    }

    public static StrongEmphasis bold(String literal) {
        StrongEmphasis bold = new StrongEmphasis("**");
        bold.appendChild(new Text(literal));
        return bold;
    }

    public static Emphasis italic(String literal) {
        Emphasis italic = new Emphasis("*");
        italic.appendChild(new Text(literal));
        return italic;
    }

    public static Heading heading(int level, List<Node> children) {
        if (level < 1 || level > MAX_HEADING_LEVEL) {
            throw new IllegalArgumentException("Heading level must be between 1 and " + MAX_HEADING_LEVEL + ": " + level);
        }
        Heading heading = new Heading();
        heading.setLevel(level);
        appendAll(heading, children);
        return heading;
    }

    public static BlockQuote blockQuote(List<Node> children) {
        BlockQuote quote = new BlockQuote();
        appendAll(quote, children);
        return quote;
    }

    public static Document document(List<Node> children) {
        Document document = new Document();
        appendAll(document, children);
        return document;
    }

    private static void appendAll(Node parent, List<Node> children) {
        for (Node child : children) {
            parent.appendChild(child);
        }
    }
}
