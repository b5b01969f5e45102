package org.dxworks.texmd.latex;

public class LatexCharsNode extends LatexNode {

    public LatexCharsNode(String source, int start, int end) {
        super(source, start, end);
    }

    public String getChars() {
        return latexVerbatim();
    }
}
