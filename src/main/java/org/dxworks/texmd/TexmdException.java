package org.dxworks.texmd;

/**
 * Base class for every failure raised while turning LaTeX into Markdown.
 */
public class TexmdException extends RuntimeException {

    public TexmdException(String message) {
        super(message);
    }
}
