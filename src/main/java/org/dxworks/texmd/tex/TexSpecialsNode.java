package org.dxworks.texmd.tex;

/**
 * Raw specials token such as {@code ``} or {@code ~}. Serializes like text but is
 * dispatched separately.
 */
public class TexSpecialsNode extends TexNode {

    private final String text;

    public TexSpecialsNode(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public TexNodeKind kind() {
        return TexNodeKind.SPECIALS;
    }

    @Override
    public String toLatex() {
        return text;
    }
}
