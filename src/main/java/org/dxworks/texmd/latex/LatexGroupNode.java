package org.dxworks.texmd.latex;

import java.util.List;

/**
 * A braced group, or a bracketed optional argument.
 */
public class LatexGroupNode extends LatexNode {

    private final String openingDelimiter;
    private final String closingDelimiter;
    private final List<LatexNode> nodeList;

    public LatexGroupNode(String source, int start, int end,
                          String openingDelimiter, String closingDelimiter, List<LatexNode> nodeList) {
        super(source, start, end);
        this.openingDelimiter = openingDelimiter;
        this.closingDelimiter = closingDelimiter;
        this.nodeList = List.copyOf(nodeList);
    }

    public String getOpeningDelimiter() {
        return openingDelimiter;
    }

    public String getClosingDelimiter() {
        return closingDelimiter;
    }

    public List<LatexNode> getNodeList() {
        return nodeList;
    }
}
