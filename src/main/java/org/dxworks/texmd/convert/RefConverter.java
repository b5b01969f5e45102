package org.dxworks.texmd.convert;

import org.commonmark.node.Node;
import org.dxworks.texmd.markdown.MarkdownNodes;
import org.dxworks.texmd.tex.ReferenceIndex;
import org.dxworks.texmd.tex.TexMacroNode;
import org.dxworks.texmd.tex.TexNode;

import java.util.List;

/**
 * Resolves {@code \ref} and {@code \eqref} to the referenced equation's id.
 */
public class RefConverter implements Converter {

    public static final String UNKNOWN_REFERENCE = "(Unknown reference)";

    @Override
    public List<Node> convert(TexNode node, ConversionContext context) {
        String label = ReferenceIndex.argumentText((TexMacroNode) node);
        int id = context.getReferenceIndex().idOf(label);
        if (id == ReferenceIndex.UNKNOWN_ID) {
            return List.of(MarkdownNodes.italic(UNKNOWN_REFERENCE));
        }
        return List.of(MarkdownNodes.text("(" + id + ")"));
    }
}
