package org.dxworks.texmd.latex;

public class LatexCommentNode extends LatexNode {

    private final String comment;
    private final String commentPostSpace;

    public LatexCommentNode(String source, int start, int end, String comment, String commentPostSpace) {
        super(source, start, end);
        this.comment = comment;
        this.commentPostSpace = commentPostSpace;
    }

    public String getComment() {
        return comment;
    }

    public String getCommentPostSpace() {
        return commentPostSpace;
    }
}
