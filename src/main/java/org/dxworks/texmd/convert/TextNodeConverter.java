package org.dxworks.texmd.convert;

import org.commonmark.node.Node;
import org.dxworks.texmd.markdown.MarkdownNodes;
import org.dxworks.texmd.tex.TexNode;
import org.dxworks.texmd.tex.TexTextNode;

import java.util.List;

public class TextNodeConverter implements Converter {

    @Override
    public List<Node> convert(TexNode node, ConversionContext context) {
        return List.of(MarkdownNodes.text(((TexTextNode) node).getText()));
    }
}
