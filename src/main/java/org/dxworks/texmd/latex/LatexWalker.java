package org.dxworks.texmd.latex;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads LaTeX source into a generic parse tree of groups, macros, environments,
 * character runs, specials, math regions and comments.
 *
 * <p>The walker does not expand or interpret macros. Argument consumption is driven by
 * the specs of a {@link LatexContext}; every node keeps its exact source span so the
 * input can be reproduced verbatim.
 */
public class LatexWalker {

    // Longest first so "---" wins over "--".
    private static final String[] SPECIALS = {"---", "--", "``", "''", "!`", "?`", "~", "&"};

    private static final String END_ENVIRONMENT = "\\end";

    private final String source;
    private final LatexContext context;
    private int pos;

    public LatexWalker(String source) {
        this(source, LatexContext.defaultContext());
    }

    public LatexWalker(String source, LatexContext context) {
        this.source = source == null ? "" : source;
        this.context = context;
    }

    /**
     * Parses the whole input.
     *
     * @throws LatexParseException if the input is not well-formed
     */
    public List<LatexNode> getLatexNodes() {
        pos = 0;
        return readNodeList(null, 0);
    }

    private List<LatexNode> readNodeList(String closing, int openedAt) {
        List<LatexNode> nodes = new ArrayList<>();
        while (pos < source.length()) {
            if (closing != null && closesAt(closing, pos)) {
                return nodes;
            }
            nodes.add(readNode(closing));
        }
        if (closing != null) {
            throw error("Unterminated construct, expected '" + closing + "'", openedAt);
        }
        return nodes;
    }

    private LatexNode readNode(String closing) {
        char c = source.charAt(pos);
        switch (c) {
            case '%':
                return readComment();
            case '{':
                return readGroup();
            case '}':
                throw error("Unexpected '}'", pos);
            case '$':
                return readDollarMath();
            case '\\':
                return readBackslash();
            default:
                String specials = specialsAt(pos);
                if (specials != null) {
                    int start = pos;
                    pos += specials.length();
                    return new LatexSpecialsNode(source, start, pos);
                }
                return readChars(closing);
        }
    }

    private LatexCharsNode readChars(String closing) {
        int start = pos;
        while (pos < source.length()) {
            char ch = source.charAt(pos);
            if (ch == '\\' || ch == '{' || ch == '}' || ch == '$' || ch == '%') break;
            if (closing != null && closesAt(closing, pos)) break;
            if (specialsAt(pos) != null) break;
            pos++;
        }
        return new LatexCharsNode(source, start, pos);
    }

    private LatexCommentNode readComment() {
        int start = pos;
        int eol = source.indexOf('\n', pos);
        if (eol < 0) eol = source.length();
        String comment = source.substring(pos + 1, eol);
        pos = eol;
        if (pos < source.length()) {
            pos++;
            while (pos < source.length() && isBlank(source.charAt(pos))) pos++;
        }
        return new LatexCommentNode(source, start, pos, comment, source.substring(eol, pos));
    }

    private LatexGroupNode readGroup() {
        int start = pos;
        pos++;
        List<LatexNode> nodes = readNodeList("}", start);
        pos++;
        return new LatexGroupNode(source, start, pos, "{", "}", nodes);
    }

    private LatexGroupNode readOptionalGroup() {
        int start = pos;
        pos++;
        List<LatexNode> nodes = readNodeList("]", start);
        pos++;
        return new LatexGroupNode(source, start, pos, "[", "]", nodes);
    }

    private LatexMathNode readDollarMath() {
        if (source.startsWith("$$", pos)) {
            return readMath("$$", "$$", true);
        }
        return readMath("$", "$", false);
    }

    private LatexMathNode readMath(String opening, String closing, boolean display) {
        int start = pos;
        pos += opening.length();
        List<LatexNode> nodes = readNodeList(closing, start);
        pos += closing.length();
        return new LatexMathNode(source, start, pos, display, opening, closing, nodes);
    }

    private LatexNode readBackslash() {
        int start = pos;
        if (pos + 1 >= source.length()) {
            throw error("Lone backslash at end of input", pos);
        }
        char next = source.charAt(pos + 1);
        if (next == '(') return readMath("\\(", "\\)", false);
        if (next == '[') return readMath("\\[", "\\]", true);
        if (next == ')' || next == ']') {
            throw error("Unexpected '\\" + next + "'", pos);
        }

        int nameEnd = pos + 2;
        if (isLetter(next)) {
            while (nameEnd < source.length() && isLetter(source.charAt(nameEnd))) nameEnd++;
        }
        String name = source.substring(pos + 1, nameEnd);
        if (name.equals("begin")) {
            pos = nameEnd;
            return readEnvironment(start);
        }
        if (name.equals("end")) {
            throw error("Unexpected '\\end' without matching '\\begin'", pos);
        }
        pos = nameEnd;

        String spec = isLetter(next) ? context.macroSpec(name) : "";
        List<LatexNode> arguments = new ArrayList<>();
        List<String> argumentSpacing = new ArrayList<>();
        String postSpace = "";
        if (spec.isEmpty()) {
            if (isLetter(next)) {
                int spaceStart = pos;
                skipInlineWhitespace();
                postSpace = source.substring(spaceStart, pos);
            }
        } else {
            arguments = readArguments(spec, "\\" + name, argumentSpacing);
        }
        return new LatexMacroNode(source, start, pos, name, arguments, argumentSpacing, postSpace);
    }

    private LatexEnvironmentNode readEnvironment(int start) {
        String beginSpacing = skipBlanks();
        String name = readEnvironmentName("\\begin");
        String spec = context.environmentSpec(name);
        List<LatexNode> arguments = new ArrayList<>();
        List<String> argumentSpacing = new ArrayList<>();
        if (!spec.isEmpty()) {
            arguments = readArguments(spec, "\\begin{" + name + "}", argumentSpacing);
        }
        List<LatexNode> body = readNodeList(END_ENVIRONMENT, start);

        int endStart = pos;
        pos += END_ENVIRONMENT.length();
        String endSpacing = skipBlanks();
        String endName = readEnvironmentName("\\end");
        if (!endName.equals(name)) {
            throw error("'\\begin{" + name + "}' ended by '\\end{" + endName + "}'", endStart);
        }
        return new LatexEnvironmentNode(source, start, pos, name, arguments, argumentSpacing,
                body, beginSpacing, endSpacing);
    }

    private String skipBlanks() {
        int start = pos;
        while (pos < source.length() && isBlank(source.charAt(pos))) pos++;
        return source.substring(start, pos);
    }

    private String readEnvironmentName(String command) {
        if (pos >= source.length() || source.charAt(pos) != '{') {
            throw error("Expected '{' after '" + command + "'", pos);
        }
        int close = source.indexOf('}', pos);
        if (close < 0) {
            throw error("Unterminated environment name", pos);
        }
        String name = source.substring(pos + 1, close);
        pos = close + 1;
        return name;
    }

    /**
     * Reads one argument per spec slot. The text skipped before each argument (whitespace
     * and comments) goes into {@code spacing}, so the macro can be written back unchanged.
     */
    private List<LatexNode> readArguments(String spec, String owner, List<String> spacing) {
        List<LatexNode> arguments = new ArrayList<>();
        for (int i = 0; i < spec.length(); i++) {
            char slot = spec.charAt(i);
            int before = pos;
            skipArgumentSpacing();
            String skipped = source.substring(before, pos);
            if (slot == '*') {
                if (pos < source.length() && source.charAt(pos) == '*') {
                    arguments.add(new LatexCharsNode(source, pos, pos + 1));
                    spacing.add(skipped);
                    pos++;
                } else {
                    pos = before;
                    arguments.add(null);
                    spacing.add("");
                }
            } else if (slot == '[') {
                if (pos < source.length() && source.charAt(pos) == '[') {
                    arguments.add(readOptionalGroup());
                    spacing.add(skipped);
                } else {
                    pos = before;
                    arguments.add(null);
                    spacing.add("");
                }
            } else {
                arguments.add(readMandatoryArgument(owner));
                spacing.add(skipped);
            }
        }
        return arguments;
    }

    // Whitespace and comments between a macro and its argument.
    private void skipArgumentSpacing() {
        while (true) {
            skipInlineWhitespace();
            if (pos < source.length() && source.charAt(pos) == '%') {
                readComment();
            } else {
                return;
            }
        }
    }

    // \end, optional blanks, then "{". Macros such as \endinput do not close the body.
    private boolean closesAt(String closing, int index) {
        if (!source.startsWith(closing, index)) {
            return false;
        }
        if (!END_ENVIRONMENT.equals(closing)) {
            return true;
        }
        int i = index + closing.length();
        while (i < source.length() && isBlank(source.charAt(i))) i++;
        return i < source.length() && source.charAt(i) == '{';
    }

    // A mandatory argument without braces is the next single token.
    private LatexNode readMandatoryArgument(String owner) {
        if (pos >= source.length()) {
            throw error("Missing argument for '" + owner + "'", pos);
        }
        char ch = source.charAt(pos);
        if (ch == '{') return readGroup();
        if (ch == '\\') return readBackslash();
        if (ch == '}' || ch == '%' || ch == '$') {
            throw error("Missing argument for '" + owner + "'", pos);
        }
        LatexCharsNode single = new LatexCharsNode(source, pos, pos + 1);
        pos++;
        return single;
    }

    // Spaces and tabs plus at most one newline; a paragraph break is never consumed.
    private void skipInlineWhitespace() {
        boolean newlineSeen = false;
        while (pos < source.length()) {
            char ch = source.charAt(pos);
            if (isBlank(ch)) {
                pos++;
            } else if (ch == '\n' && !newlineSeen && !paragraphBreakAt(pos)) {
                newlineSeen = true;
                pos++;
            } else {
                break;
            }
        }
    }

    private boolean paragraphBreakAt(int newlineIndex) {
        int i = newlineIndex + 1;
        while (i < source.length() && isBlank(source.charAt(i))) i++;
        return i < source.length() && source.charAt(i) == '\n';
    }

    private String specialsAt(int index) {
        for (String specials : SPECIALS) {
            if (source.startsWith(specials, index)) {
                return specials;
            }
        }
        return null;
    }

    private static boolean isLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    private static boolean isBlank(char ch) {
        return ch == ' ' || ch == '\t' || ch == '\r';
    }

    private LatexParseException error(String message, int at) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < at && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new LatexParseException(message, line, column);
    }
}
