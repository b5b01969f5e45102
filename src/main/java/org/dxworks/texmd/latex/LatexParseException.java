package org.dxworks.texmd.latex;

import org.dxworks.texmd.TexmdException;

/**
 * Thrown by {@link LatexWalker} when the input is not well-formed LaTeX.
 */
public class LatexParseException extends TexmdException {

    private final int line;
    private final int column;

    public LatexParseException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
