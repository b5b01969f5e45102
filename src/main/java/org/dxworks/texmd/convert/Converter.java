package org.dxworks.texmd.convert;

import org.commonmark.node.Node;
import org.dxworks.texmd.tex.TexNode;

import java.util.List;

/**
 * Turns one LaTeX AST node into zero or more Markdown nodes. Implementations keep no
 * state between calls; children are converted through the context.
 */
public interface Converter {

    List<Node> convert(TexNode node, ConversionContext context);
}
