package org.dxworks.texmd;

import org.commonmark.node.Document;
import org.commonmark.node.Emphasis;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.dxworks.texmd.latex.LatexParseException;
import org.dxworks.texmd.markdown.DisplayEquation;
import org.dxworks.texmd.tex.TexDocNode;
import org.dxworks.texmd.tex.TexEnvNode;
import org.dxworks.texmd.tex.TexNodeKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TexDocumentParserTest {

    private final TexDocumentParser parser = new TexDocumentParser();

    @TempDir
    Path tempDir;

    private static List<Node> children(Node parent) {
        List<Node> children = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
            children.add(child);
        }
        return children;
    }

    private static String literal(Node node) {
        return ((Text) node).getLiteral();
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void sectionWithUnknownMacro() {
        Document document = parser.toMarkdown(parser.parseDocument("\\section{Intro}Hello \\textbf{world}."));
        List<Node> nodes = children(document);

        assertEquals(3, nodes.size());
        Heading heading = assertInstanceOf(Heading.class, nodes.get(0));
        assertEquals(2, heading.getLevel());
        assertEquals("Intro", literal(heading.getFirstChild()));
        assertEquals("Hello ", literal(nodes.get(1)));
        assertEquals(".", literal(nodes.get(2)));
    }

    @Test
    void labeledEquationAndReference() {
        TexDocNode doc = parser.parseDocument(
                "\\begin{equation}\\label{e1}x=1\\end{equation} ... See \\eqref{e1}.");
        List<Node> nodes = children(parser.toMarkdown(doc));

        StrongEmphasis label = assertInstanceOf(StrongEmphasis.class, nodes.get(0));
        assertEquals("Equation (0)", literal(label.getFirstChild()));
        DisplayEquation equation = assertInstanceOf(DisplayEquation.class, nodes.get(1));
        assertEquals("\\begin{equation*}x=1\\end{equation*}", equation.getLiteral());
        assertEquals(" ... See ", literal(nodes.get(2)));
        assertEquals("(0)", literal(nodes.get(3)));
        assertEquals(".", literal(nodes.get(4)));
    }

    @Test
    void forwardReferenceResolves() {
        TexDocNode doc = parser.parseDocument(
                "As \\ref{later} shows:\n\\begin{equation}\\label{first}a\\end{equation}"
                        + "\\begin{equation}\\label{later}b\\end{equation}");
        List<Node> nodes = children(parser.toMarkdown(doc));
        assertEquals("As ", literal(nodes.get(0)));
        assertEquals("(1)", literal(nodes.get(1)));
    }

    @Test
    void unknownReferenceIsMarked() {
        List<Node> nodes = children(parser.toMarkdown(parser.parseDocument("See \\ref{missing}.")));
        assertEquals(3, nodes.size());
        Emphasis marker = assertInstanceOf(Emphasis.class, nodes.get(1));
        assertEquals("(Unknown reference)", literal(marker.getFirstChild()));
    }

    @Test
    void labelsAreRemovedFromTheTree() {
        TexDocNode doc = parser.parseDocument("\\begin{equation}\\label{e}x\\end{equation}\\label{stray}");
        parser.toMarkdown(doc);
        assertTrue(doc.find(TexNodeKind.MACRO, "label", true).isEmpty());
        assertEquals(0, doc.getReferenceIndex().idOf("e"));
    }

    @Test
    void convertingTwiceGivesSameResult() {
        TexDocNode doc = parser.parseDocument("\\begin{equation}\\label{e}x\\end{equation}\\eqref{e}");
        List<Node> first = children(parser.toMarkdown(doc));
        List<Node> second = children(parser.toMarkdown(doc));

        assertEquals(first.size(), second.size());
        assertEquals(((DisplayEquation) first.get(1)).getLiteral(), ((DisplayEquation) second.get(1)).getLiteral());
        assertEquals("\\begin{equation*}x\\end{equation*}", ((DisplayEquation) second.get(1)).getLiteral());
        assertEquals("Equation (0)", literal(second.get(0).getFirstChild()));
        assertEquals("equation*", ((TexEnvNode) doc.getChildren().get(0)).getName());
    }

    @Test
    void parseDocumentUnwrapsDocumentEnvironment() {
        TexDocNode doc = parser.parseDocument(
                "\\documentclass{article}\\begin{document}\\section{Body}\\end{document}");
        assertEquals(1, doc.getChildren().size());

        Heading heading = assertInstanceOf(Heading.class, parser.toMarkdown(doc).getFirstChild());
        assertEquals("Body", literal(heading.getFirstChild()));
        assertThrows(MultipleDocumentsException.class,
                () -> parser.parseDocument("\\begin{document}\\end{document}\\begin{document}\\end{document}"));
    }

    @Test
    void spacedEndStillClosesEquation() {
        TexDocNode doc = parser.parseDocument("\\begin{equation}\\label{e}x=1\\end {equation} see \\eqref{e}");
        List<Node> nodes = children(parser.toMarkdown(doc));
        assertEquals("\\begin{equation*}x=1\\end {equation*}", ((DisplayEquation) nodes.get(1)).getLiteral());
        assertEquals("(0)", literal(nodes.get(3)));
    }

    @Test
    void emptyInputGivesEmptyDocument() {
        Document document = parser.toMarkdown(parser.parseDocument(""));
        assertNull(document.getFirstChild());
    }

    @Test
    void loadDocumentReadsDocumentBody() throws IOException {
        Path file = write("paper.tex", "\\documentclass{article}\n"
                + "\\usepackage{amsmath}\n"
                + "\\begin{document}\n"
                + "\\title{On Things}\n"
                + "\\end{document}\n");
        TexDocNode doc = parser.loadDocument(file);

        assertEquals(TexDocNode.DOCUMENT, doc.getName());
        assertTrue(doc.find(TexNodeKind.MACRO, "documentclass", true).isEmpty());
        assertEquals(1, doc.find(TexNodeKind.MACRO, "title").size());

        Heading heading = (Heading) children(parser.toMarkdown(doc)).get(1);
        assertEquals(1, heading.getLevel());
        assertEquals("On Things", literal(heading.getFirstChild()));
    }

    @Test
    void loadDocumentWithoutDocumentEnvironmentUsesWholeFile() throws IOException {
        Path file = write("fragment.tex", "\\section{Only}text");
        TexDocNode doc = parser.loadDocument(file);
        assertEquals(2, doc.getChildren().size());
    }

    @Test
    void loadDocumentStripsByteOrderMark() throws IOException {
        Path file = write("bom.tex", "\uFEFF\\begin{document}x\\end{document}");
        TexDocNode doc = parser.loadDocument(file);
        assertEquals("x", doc.groupLatex());
    }

    @Test
    void loadDocumentRejectsMultipleDocuments() throws IOException {
        Path file = write("two.tex", "\\begin{document}a\\end{document}\n\\begin{document}b\\end{document}");
        MultipleDocumentsException e = assertThrows(MultipleDocumentsException.class, () -> parser.loadDocument(file));
        assertEquals(2, e.getDocumentCount());
    }

    @Test
    void loadDocumentFailsForMissingFile() {
        assertThrows(NoSuchFileException.class, () -> parser.loadDocument(tempDir.resolve("absent.tex")));
    }

    @Test
    void loadDocumentFailsForMalformedInput() throws IOException {
        Path file = write("broken.tex", "\\begin{document}\\begin{equation}x\\end{document}");
        assertThrows(LatexParseException.class, () -> parser.loadDocument(file));
    }

    @Test
    void referenceIndexIsBuiltAtLoadTime() throws IOException {
        Path file = write("refs.tex", "\\begin{document}"
                + "\\begin{equation}\\label{a}1\\end{equation}"
                + "\\begin{equation*}\\label{b}2\\end{equation*}"
                + "\\begin{equation}\\label{c}3\\end{equation}"
                + "\\end{document}");
        TexDocNode doc = parser.loadDocument(file);

        assertEquals(2, doc.getReferenceIndex().size());
        assertEquals(0, doc.getReferenceIndex().idOf("a"));
        assertEquals(-1, doc.getReferenceIndex().idOf("b"));
        assertEquals(1, doc.getReferenceIndex().idOf("c"));
    }
}
