package org.dxworks.texmd.tex;

import java.util.ArrayList;
import java.util.List;

public class TexGroupNode extends TexNode implements TexParentNode {

    private final List<TexNode> children;
    private final String prefix;
    private final String suffix;

    public TexGroupNode(List<TexNode> children, String prefix, String suffix) {
        this.children = new ArrayList<>(children);
        this.prefix = prefix;
        this.suffix = suffix;
    }

    @Override
    public List<TexNode> getChildren() {
        return children;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getSuffix() {
        return suffix;
    }

    @Override
    public TexNodeKind kind() {
        return TexNodeKind.GROUP;
    }

    @Override
    public String toLatex() {
        return prefix + groupLatex() + suffix;
    }
}
