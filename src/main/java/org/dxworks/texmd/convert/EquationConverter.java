package org.dxworks.texmd.convert;

import org.commonmark.node.Node;
import org.dxworks.texmd.markdown.DisplayEquation;
import org.dxworks.texmd.markdown.MarkdownNodes;
import org.dxworks.texmd.tex.TexEnvNode;
import org.dxworks.texmd.tex.TexNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts equation-like environments into display equations.
 *
 * <p>The environment is starred in place first, so the LaTeX handed to the Markdown math
 * renderer carries no numbering of its own; a labeled equation is preceded by a bold
 * "Equation (id)" line taken from the reference index instead.
 */
public class EquationConverter implements Converter {

    @Override
    public List<Node> convert(TexNode node, ConversionContext context) {
        TexEnvNode env = (TexEnvNode) node;
        env.star();

        List<Node> result = new ArrayList<>();
        String label = context.getReferenceIndex().labelOf(env);
        if (!label.isEmpty()) {
            result.add(MarkdownNodes.bold("Equation (" + context.getReferenceIndex().idOf(label) + ")"));
        }
        result.add(new DisplayEquation(env.toLatex()));
        return result;
    }
}
