package org.dxworks.texmd.convert;

import org.commonmark.node.Node;
import org.dxworks.texmd.markdown.MarkdownNodes;
import org.dxworks.texmd.tex.TexNode;
import org.dxworks.texmd.tex.TexSpecialsNode;

import java.util.List;
import java.util.Map;

/**
 * Replaces TeX quote ligatures with typographic quotes; other specials pass through.
 */
public class SpecialsNodeConverter implements Converter {

    static final Map<String, String> SPECIALS_MAPPING = Map.of(
            "``", "“",
            "''", "”");

    @Override
    public List<Node> convert(TexNode node, ConversionContext context) {
        String text = ((TexSpecialsNode) node).getText();
        return List.of(MarkdownNodes.text(SPECIALS_MAPPING.getOrDefault(text, text)));
    }
}
