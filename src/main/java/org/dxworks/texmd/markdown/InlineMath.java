package org.dxworks.texmd.markdown;

import org.commonmark.node.CustomNode;

/**
 * Inline math, printed as {@code $literal$}. The literal is LaTeX.
 */
public class InlineMath extends CustomNode {

    private String literal;

    public InlineMath(String literal) {
        this.literal = literal;
    }

    public String getLiteral() {
        return literal;
    }

    public void setLiteral(String literal) {
        this.literal = literal;
    }
}
