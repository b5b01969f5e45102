package org.dxworks.texmd.tex;

/**
 * A node identified by a name, such as a macro or an environment.
 */
public interface TexNamedNode {

    String getName();
}
