package org.dxworks.texmd.tex;

import java.util.ArrayList;
import java.util.List;

/**
 * Math region; prefix and suffix are its delimiters, e.g. {@code $} or {@code \[}/{@code \]}.
 */
public class TexMathNode extends TexNode implements TexParentNode {

    private final List<TexNode> children;
    private final String prefix;
    private final String suffix;

    public TexMathNode(List<TexNode> children, String prefix, String suffix) {
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
        return TexNodeKind.MATH;
    }

    @Override
    public String toLatex() {
        return prefix + groupLatex() + suffix;
    }
}
