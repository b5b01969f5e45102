package org.dxworks.texmd.tex;

import org.dxworks.texmd.latex.LatexNode;
import org.dxworks.texmd.latex.LatexWalker;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TexAstBuilderTest {

    private static List<TexNode> build(String tex) {
        return TexAstBuilder.convertAll(new LatexWalker(tex).getLatexNodes());
    }

    private static String serialize(List<TexNode> nodes) {
        StringBuilder sb = new StringBuilder();
        nodes.forEach(n -> sb.append(n.toLatex()));
        return sb.toString();
    }

    @Test
    void serializationReproducesSource() {
        String[] fragments = {
                "\\section{Intro}Hello \\textbf{world}.",
                "\\begin{equation}\\label{e1}x = \\frac{1}{2}\\end{equation}",
                "\\begin{array}{cc}a & b \\\\ c & d\\end{array}",
                "Inline $a^2 + b^2$ and display \\[ \\sum_i x_i \\]",
                "\\section*[Short]{Long} \\LaTeX\\ rocks ``quoted'' 1--2~ok",
                "{\\em nested {groups}} and \\begin{abstract}\n  Text.\n\\end{abstract}\n",
                "\\textbf {bold} text",
                "$\\frac{a} {b}$ and \\sqrt [3]{x}",
                "\\section% note\n  {Intro}",
                "\\begin {equation}x=1\\end {equation}",
        };
        for (String fragment : fragments) {
            assertEquals(fragment, serialize(build(fragment)), fragment);
        }
    }

    @Test
    void spacingBeforeArgumentLeadsTheGroup() {
        TexMacroNode textbf = (TexMacroNode) build("\\textbf {bold}").get(0);
        TexGroupNode argument = (TexGroupNode) textbf.getChildren().get(0);
        assertEquals(" {", argument.getPrefix());
        assertEquals("bold", argument.groupLatex());
    }

    @Test
    void groupKeepsDelimitersAndChildren() {
        TexGroupNode group = (TexGroupNode) build("{a $b$}").get(0);
        assertEquals("{", group.getPrefix());
        assertEquals("}", group.getSuffix());
        assertEquals(TexNodeKind.TEXT, group.getChildren().get(0).kind());
        assertEquals(TexNodeKind.MATH, group.getChildren().get(1).kind());
        assertEquals("a $b$", group.groupLatex());
    }

    @Test
    void macroArgumentsBecomeGroups() {
        TexMacroNode section = (TexMacroNode) build("\\section{Intro}").get(0);
        assertEquals("section", section.getName());
        assertEquals(TexNodeKind.MACRO, section.kind());
        assertEquals(1, section.getChildren().size());
        TexGroupNode argument = (TexGroupNode) section.getChildren().get(0);
        assertEquals("Intro", ((TexTextNode) argument.getChildren().get(0)).getText());
    }

    @Test
    void bareArgumentsAreWrappedInBraces() {
        TexMacroNode frac = (TexMacroNode) build("\\frac12").get(0);
        assertEquals(2, frac.getChildren().size());
        assertTrue(frac.getChildren().stream().allMatch(c -> c instanceof TexGroupNode));
        assertEquals("\\frac{1}{2}", frac.toLatex());
    }

    @Test
    void postSpaceBecomesSiblingText() {
        List<TexNode> nodes = build("\\alpha x");
        assertEquals(3, nodes.size());
        TexMacroNode alpha = (TexMacroNode) nodes.get(0);
        assertTrue(alpha.getChildren().isEmpty());
        assertEquals(" ", ((TexTextNode) nodes.get(1)).getText());
        assertEquals("x", ((TexTextNode) nodes.get(2)).getText());
    }

    @Test
    void environmentChildrenAreArgumentsThenBody() {
        TexEnvNode array = (TexEnvNode) build("\\begin{array}{cc}a\\end{array}").get(0);
        assertEquals("array", array.getName());
        assertEquals(2, array.getChildren().size());
        assertEquals("{cc}", array.getChildren().get(0).toLatex());
        assertEquals("a", array.getChildren().get(1).toLatex());
    }

    @Test
    void specialsAndMathAreTyped() {
        List<TexNode> nodes = build("``$x$");
        assertEquals(TexNodeKind.SPECIALS, nodes.get(0).kind());
        TexMathNode math = (TexMathNode) nodes.get(1);
        assertEquals("$", math.getPrefix());
        assertEquals("x", math.groupLatex());
    }

    @Test
    void commentsAreDropped() {
        List<TexNode> nodes = build("a% comment\nb");
        assertEquals(2, nodes.size());
        assertEquals("ab", serialize(nodes));
    }

    @Test
    void unknownParseNodeKindFails() {
        LatexNode unknown = new LatexNode("?", 0, 1) {
        };
        assertThrows(UnsupportedConstructException.class, () -> TexAstBuilder.convert(unknown));
    }

    @Test
    void nodeHandlesAreUnique() {
        List<TexNode> nodes = build("a\\b c");
        assertNotEquals(nodes.get(0).getId(), nodes.get(1).getId());
        assertNotEquals(nodes.get(1).getId(), nodes.get(2).getId());
    }

    @Test
    void starringIsIdempotent() {
        TexEnvNode align = (TexEnvNode) build("\\begin{align}x\\end{align}").get(0);
        long id = align.getId();
        assertTrue(align.star());
        assertFalse(align.star());
        assertEquals("align*", align.getName());
        assertEquals("\\begin{align*}x\\end{align*}", align.toLatex());
        assertEquals(id, align.getId());
    }
}
