package org.dxworks.texmd.markdown;

import org.commonmark.node.CustomBlock;

/**
 * Display equation block, printed between {@code $$} lines. The literal is the full LaTeX
 * of the equation environment.
 */
public class DisplayEquation extends CustomBlock {

    private String literal;

    public DisplayEquation(String literal) {
        this.literal = literal;
    }

    public String getLiteral() {
        return literal;
    }

    public void setLiteral(String literal) {
        this.literal = literal;
    }
}
