package org.dxworks.texmd.tex;

/**
 * The closed set of LaTeX AST node variants. Together with a node's name it forms the
 * key used to pick a converter.
 */
public enum TexNodeKind {
    GROUP,
    MACRO,
    ENVIRONMENT,
    TEXT,
    SPECIALS,
    MATH
}
