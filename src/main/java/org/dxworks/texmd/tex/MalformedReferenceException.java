package org.dxworks.texmd.tex;

import org.dxworks.texmd.TexmdException;

/**
 * Thrown when a {@code \label}, {@code \ref} or {@code \eqref} macro does not carry
 * a single plain-text argument.
 */
public class MalformedReferenceException extends TexmdException {

    public MalformedReferenceException(String macroName, String latex) {
        super("Malformed \\" + macroName + " macro: " + latex);
    }
}
