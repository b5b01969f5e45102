package org.dxworks.texmd.convert;

import org.commonmark.node.Node;
import org.dxworks.texmd.markdown.MarkdownNodes;
import org.dxworks.texmd.tex.TexGroupNode;
import org.dxworks.texmd.tex.TexNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits the group's delimiters as text around its converted children.
 */
public class GroupNodeConverter implements Converter {

    @Override
    public List<Node> convert(TexNode node, ConversionContext context) {
        TexGroupNode group = (TexGroupNode) node;
        List<Node> result = new ArrayList<>();
        if (!group.getPrefix().isEmpty()) {
            result.add(MarkdownNodes.text(group.getPrefix()));
        }
        result.addAll(context.convertAll(group.getChildren()));
        if (!group.getSuffix().isEmpty()) {
            result.add(MarkdownNodes.text(group.getSuffix()));
        }
        return result;
    }
}
