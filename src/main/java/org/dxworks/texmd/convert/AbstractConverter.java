package org.dxworks.texmd.convert;

import org.commonmark.node.Node;
import org.dxworks.texmd.markdown.MarkdownNodes;
import org.dxworks.texmd.tex.TexEnvNode;
import org.dxworks.texmd.tex.TexNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the {@code abstract} environment as a block quote led by a bold "Abstract".
 */
public class AbstractConverter implements Converter {

    @Override
    public List<Node> convert(TexNode node, ConversionContext context) {
        List<Node> children = new ArrayList<>();
        children.add(MarkdownNodes.bold("Abstract"));
        children.add(MarkdownNodes.text(": "));
        children.addAll(context.convertAll(((TexEnvNode) node).getChildren()));
        return List.of(MarkdownNodes.blockQuote(children));
    }
}
