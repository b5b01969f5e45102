package org.dxworks.texmd.tex;

import java.util.ArrayList;
import java.util.List;

/**
 * A macro such as {@code \section{Intro}}. Every child is an argument group.
 */
public class TexMacroNode extends TexNode implements TexParentNode, TexNamedNode {

    private final String name;
    private final List<TexNode> children;

    public TexMacroNode(String name, List<TexNode> children) {
        this.name = name;
        this.children = new ArrayList<>(children);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<TexNode> getChildren() {
        return children;
    }

    @Override
    public TexNodeKind kind() {
        return TexNodeKind.MACRO;
    }

    @Override
    public String toLatex() {
        return "\\" + name + groupLatex();
    }
}
