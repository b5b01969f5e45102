package org.dxworks.texmd.latex;

/**
 * A node of the generic parse tree produced by {@link LatexWalker}.
 * Every node knows the span of the source it was read from.
 */
public abstract class LatexNode {

    private final String source;
    private final int start;
    private final int end;

    protected LatexNode(String source, int start, int end) {
        this.source = source;
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * The exact LaTeX text this node was parsed from.
     */
    public String latexVerbatim() {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + start + ".." + end + "]";
    }
}
