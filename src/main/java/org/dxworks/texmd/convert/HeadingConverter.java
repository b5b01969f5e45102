package org.dxworks.texmd.convert;

import org.commonmark.node.Node;
import org.dxworks.texmd.markdown.MarkdownNodes;
import org.dxworks.texmd.tex.TexMacroNode;
import org.dxworks.texmd.tex.TexNode;
import org.dxworks.texmd.tex.TexParentNode;

import java.util.List;

/**
 * Converts {@code \title} and the sectioning macros into a heading of a fixed level.
 * The heading text comes from the last argument, which is the mandatory one even when a
 * star or a short title precedes it.
 */
public class HeadingConverter implements Converter {

    private final int level;

    public HeadingConverter(int level) {
        if (level < 1 || level > MarkdownNodes.MAX_HEADING_LEVEL) {
            throw new IllegalArgumentException("Unsupported heading level: " + level);
        }
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    @Override
    public List<Node> convert(TexNode node, ConversionContext context) {
        List<TexNode> arguments = ((TexMacroNode) node).getChildren();
        TexParentNode group = (TexParentNode) arguments.get(arguments.size() - 1);
        return List.of(MarkdownNodes.heading(level, context.convertAll(group.getChildren())));
    }
}
