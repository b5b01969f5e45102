package org.dxworks.texmd.tex;

import org.dxworks.texmd.latex.LatexCharsNode;
import org.dxworks.texmd.latex.LatexCommentNode;
import org.dxworks.texmd.latex.LatexEnvironmentNode;
import org.dxworks.texmd.latex.LatexGroupNode;
import org.dxworks.texmd.latex.LatexMacroNode;
import org.dxworks.texmd.latex.LatexMathNode;
import org.dxworks.texmd.latex.LatexNode;
import org.dxworks.texmd.latex.LatexSpecialsNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the typed LaTeX AST from the walker's generic parse tree.
 */
public final class TexAstBuilder {

    private TexAstBuilder() {
        // utility class
    }

    /**
     * Converts one parse-tree node into zero or more AST nodes. Comments produce nothing;
     * a macro that swallowed trailing whitespace produces the macro followed by a text node
     * holding that whitespace.
     *
     * @throws UnsupportedConstructException for a parse-tree node kind without a conversion
     */
    public static List<TexNode> convert(LatexNode node) {
        if (node instanceof LatexGroupNode) {
            LatexGroupNode group = (LatexGroupNode) node;
            return List.of(new TexGroupNode(convertAll(group.getNodeList()),
                    group.getOpeningDelimiter(), group.getClosingDelimiter()));
        }
        if (node instanceof LatexMacroNode) {
            return convertMacro((LatexMacroNode) node);
        }
        if (node instanceof LatexEnvironmentNode) {
            LatexEnvironmentNode env = (LatexEnvironmentNode) node;
            List<TexNode> children = normalizeArguments(env.getArguments(), env.getArgumentSpacing());
            children.addAll(convertAll(env.getNodeList()));
            return List.of(new TexEnvNode(env.getEnvironmentName(), children,
                    env.getBeginSpacing(), env.getEndSpacing()));
        }
        if (node instanceof LatexCharsNode) {
            return List.of(new TexTextNode(node.latexVerbatim()));
        }
        if (node instanceof LatexSpecialsNode) {
            return List.of(new TexSpecialsNode(node.latexVerbatim()));
        }
        if (node instanceof LatexMathNode) {
            LatexMathNode math = (LatexMathNode) node;
            return List.of(new TexMathNode(convertAll(math.getNodeList()),
                    math.getOpeningDelimiter(), math.getClosingDelimiter()));
        }
        if (node instanceof LatexCommentNode) {
            return List.of();
        }
        throw new UnsupportedConstructException(node.getClass());
    }

    public static List<TexNode> convertAll(List<LatexNode> nodes) {
        List<TexNode> result = new ArrayList<>();
        for (LatexNode node : nodes) {
            result.addAll(convert(node));
        }
        return result;
    }

    private static List<TexNode> convertMacro(LatexMacroNode macro) {
        TexMacroNode converted = new TexMacroNode(macro.getMacroName(),
                normalizeArguments(macro.getArguments(), macro.getArgumentSpacing()));
        String postSpace = macro.getMacroPostSpace();
        if (postSpace == null || postSpace.isEmpty()) {
            return List.of(converted);
        }
        return List.of(converted, new TexTextNode(postSpace));
    }

    // Every argument becomes a group; absent optional slots are dropped. Text read before an
    // argument is kept in front of the group's opening delimiter.
    private static List<TexNode> normalizeArguments(List<LatexNode> arguments, List<String> spacing) {
        List<TexNode> groups = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            LatexNode argument = arguments.get(i);
            if (argument == null) continue;
            String leading = i < spacing.size() ? spacing.get(i) : "";
            for (TexNode value : convert(argument)) {
                groups.add(asGroup(value, leading));
                leading = "";
            }
        }
        return groups;
    }

    private static TexNode asGroup(TexNode value, String leading) {
        if (value instanceof TexGroupNode) {
            if (leading.isEmpty()) {
                return value;
            }
            TexGroupNode group = (TexGroupNode) value;
            return new TexGroupNode(group.getChildren(), leading + group.getPrefix(), group.getSuffix());
        }
        // A star keeps no braces so \section*{...} serializes unchanged.
        if (value instanceof TexTextNode && "*".equals(((TexTextNode) value).getText())) {
            return new TexGroupNode(List.of(value), leading, "");
        }
        return new TexGroupNode(List.of(value), leading + "{", "}");
    }
}
