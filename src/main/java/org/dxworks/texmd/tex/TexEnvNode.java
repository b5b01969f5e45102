package org.dxworks.texmd.tex;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code \begin{name} ... \end{name}} environment. Children are the argument groups
 * followed by the body.
 */
public class TexEnvNode extends TexNode implements TexParentNode, TexNamedNode {

    private String name;
    private final List<TexNode> children;
    private final String beginSpacing;
    private final String endSpacing;

    public TexEnvNode(String name, List<TexNode> children) {
        this(name, children, "", "");
    }

    /**
     * @param beginSpacing blanks written between {@code \begin} and the name's opening brace
     * @param endSpacing blanks written between {@code \end} and the name's opening brace
     */
    public TexEnvNode(String name, List<TexNode> children, String beginSpacing, String endSpacing) {
        this.name = name;
        this.children = new ArrayList<>(children);
        this.beginSpacing = beginSpacing;
        this.endSpacing = endSpacing;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Renames the environment to its starred form, e.g. {@code align} to {@code align*}.
     * A name already ending in {@code *} is left alone, so the node is starred at most once.
     *
     * @return true if the name changed
     */
    public boolean star() {
        if (name.endsWith("*")) {
            return false;
        }
        name = name + "*";
        return true;
    }

    public boolean isStarred() {
        return name.endsWith("*");
    }

    @Override
    public List<TexNode> getChildren() {
        return children;
    }

    @Override
    public TexNodeKind kind() {
        return TexNodeKind.ENVIRONMENT;
    }

    @Override
    public String toLatex() {
        return "\\begin" + beginSpacing + "{" + name + "}" + groupLatex() + "\\end" + endSpacing + "{" + name + "}";
    }
}
