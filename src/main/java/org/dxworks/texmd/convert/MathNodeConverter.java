package org.dxworks.texmd.convert;

import org.commonmark.node.Node;
import org.dxworks.texmd.markdown.InlineMath;
import org.dxworks.texmd.tex.TexMathNode;
import org.dxworks.texmd.tex.TexNode;

import java.util.List;

/**
 * Math stays LaTeX: the payload is the serialized content, not its conversion.
 */
public class MathNodeConverter implements Converter {

    @Override
    public List<Node> convert(TexNode node, ConversionContext context) {
        return List.of(new InlineMath(((TexMathNode) node).groupLatex()));
    }
}
