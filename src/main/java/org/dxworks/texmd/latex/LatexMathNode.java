package org.dxworks.texmd.latex;

import java.util.List;

/**
 * A math region delimited by {@code $}, {@code $$}, {@code \(}/{@code \)} or {@code \[}/{@code \]}.
 */
public class LatexMathNode extends LatexNode {

    private final boolean display;
    private final String openingDelimiter;
    private final String closingDelimiter;
    private final List<LatexNode> nodeList;

    public LatexMathNode(String source, int start, int end, boolean display,
                         String openingDelimiter, String closingDelimiter, List<LatexNode> nodeList) {
        super(source, start, end);
        this.display = display;
        this.openingDelimiter = openingDelimiter;
        this.closingDelimiter = closingDelimiter;
        this.nodeList = List.copyOf(nodeList);
    }

    public boolean isDisplay() {
        return display;
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
