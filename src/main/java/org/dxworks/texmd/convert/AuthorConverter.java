package org.dxworks.texmd.convert;

import org.commonmark.node.Node;
import org.dxworks.texmd.markdown.MarkdownNodes;
import org.dxworks.texmd.tex.TexMacroNode;
import org.dxworks.texmd.tex.TexNode;
import org.dxworks.texmd.tex.TexParentNode;

import java.util.List;

public class AuthorConverter implements Converter {

    @Override
    public List<Node> convert(TexNode node, ConversionContext context) {
        TexMacroNode macro = (TexMacroNode) node;
        TexParentNode group = (TexParentNode) macro.getChildren().get(0);
        return List.of(MarkdownNodes.text("**Author:** " + group.groupLatex()));
    }
}
