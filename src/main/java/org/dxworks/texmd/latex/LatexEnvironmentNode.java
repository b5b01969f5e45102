package org.dxworks.texmd.latex;

import java.util.Collections;
import java.util.List;

/**
 * A {@code \begin{name} ... \end{name}} block.
 */
public class LatexEnvironmentNode extends LatexNode {

    private final String environmentName;
    private final List<LatexNode> arguments;
    private final List<String> argumentSpacing;
    private final List<LatexNode> nodeList;
    private final String beginSpacing;
    private final String endSpacing;

    public LatexEnvironmentNode(String source, int start, int end, String environmentName,
                                List<LatexNode> arguments, List<String> argumentSpacing,
                                List<LatexNode> nodeList, String beginSpacing, String endSpacing) {
        super(source, start, end);
        this.environmentName = environmentName;
        this.arguments = Collections.unmodifiableList(arguments);
        this.argumentSpacing = List.copyOf(argumentSpacing);
        this.nodeList = List.copyOf(nodeList);
        this.beginSpacing = beginSpacing;
        this.endSpacing = endSpacing;
    }

    public String getEnvironmentName() {
        return environmentName;
    }

    /**
     * Arguments after {@code \begin{name}}; absent optional slots are {@code null}.
     */
    public List<LatexNode> getArguments() {
        return arguments;
    }

    public List<String> getArgumentSpacing() {
        return argumentSpacing;
    }

    public List<LatexNode> getNodeList() {
        return nodeList;
    }

    /**
     * Blanks between {@code \begin} and the opening brace of the name.
     */
    public String getBeginSpacing() {
        return beginSpacing;
    }

    public String getEndSpacing() {
        return endSpacing;
    }
}
