package org.dxworks.texmd.latex;

import java.util.Collections;
import java.util.List;

public class LatexMacroNode extends LatexNode {

    private final String macroName;
    private final List<LatexNode> arguments;
    private final List<String> argumentSpacing;
    private final String macroPostSpace;

    /**
     * @param arguments one entry per argument slot of the macro's spec, {@code null} for an absent optional slot
     * @param argumentSpacing for each slot, the whitespace and comments read before the argument
     */
    public LatexMacroNode(String source, int start, int end, String macroName,
                          List<LatexNode> arguments, List<String> argumentSpacing, String macroPostSpace) {
        super(source, start, end);
        this.macroName = macroName;
        this.arguments = Collections.unmodifiableList(arguments);
        this.argumentSpacing = List.copyOf(argumentSpacing);
        this.macroPostSpace = macroPostSpace;
    }

    public String getMacroName() {
        return macroName;
    }

    public List<LatexNode> getArguments() {
        return arguments;
    }

    public List<String> getArgumentSpacing() {
        return argumentSpacing;
    }

    public String getMacroPostSpace() {
        return macroPostSpace;
    }
}
