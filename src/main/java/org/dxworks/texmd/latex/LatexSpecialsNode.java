package org.dxworks.texmd.latex;

/**
 * A character sequence with a special meaning in running text, such as {@code ``} or {@code ~}.
 */
public class LatexSpecialsNode extends LatexNode {

    public LatexSpecialsNode(String source, int start, int end) {
        super(source, start, end);
    }

    public String getSpecialsChars() {
        return latexVerbatim();
    }
}
