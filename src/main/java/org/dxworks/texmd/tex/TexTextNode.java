package org.dxworks.texmd.tex;

public class TexTextNode extends TexNode {

    private final String text;

    public TexTextNode(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public TexNodeKind kind() {
        return TexNodeKind.TEXT;
    }

    @Override
    public String toLatex() {
        return text;
    }
}
