package org.dxworks.texmd.tex;

import org.dxworks.texmd.TexmdException;

/**
 * Thrown when the AST builder meets a parse-tree node kind it has no conversion for.
 */
public class UnsupportedConstructException extends TexmdException {

    public UnsupportedConstructException(Class<?> nodeType) {
        super("Conversion not implemented for " + nodeType.getName());
    }
}
