package org.dxworks.texmd;

import org.commonmark.node.Document;
import org.commonmark.node.Node;
import org.dxworks.texmd.convert.ConversionContext;
import org.dxworks.texmd.convert.ConverterRegistry;
import org.dxworks.texmd.latex.LatexContext;
import org.dxworks.texmd.latex.LatexEnvironmentNode;
import org.dxworks.texmd.latex.LatexNode;
import org.dxworks.texmd.latex.LatexWalker;
import org.dxworks.texmd.markdown.MarkdownNodes;
import org.dxworks.texmd.tex.ReferenceIndex;
import org.dxworks.texmd.tex.TexAstBuilder;
import org.dxworks.texmd.tex.TexDocNode;
import org.dxworks.texmd.tex.TexNode;
import org.dxworks.texmd.tex.TexNodeKind;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads LaTeX documents and converts them to Markdown.
 *
 * <p>Conversion runs in two phases: the reference index is built for the whole document
 * when it is loaded, and only then are nodes converted, so references to later equations
 * resolve.
 */
public class TexDocumentParser {

    private final LatexContext latexContext;
    private final ConverterRegistry registry;

    public TexDocumentParser() {
        this(LatexContext.defaultContext(), ConverterRegistry.defaultRegistry());
    }

    public TexDocumentParser(LatexContext latexContext, ConverterRegistry registry) {
        this.latexContext = latexContext;
        this.registry = registry;
    }

    /**
     * Loads a LaTeX file and returns the body of its {@code document} environment. A file
     * without one is read as a bare fragment.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     * @throws MultipleDocumentsException if the file has more than one {@code document} environment
     * @throws org.dxworks.texmd.latex.LatexParseException if the file is not well-formed
     */
    public TexDocNode loadDocument(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        // Editors on Windows like to leave a BOM behind
        if (content.startsWith("\uFEFF")) {
            content = content.substring(1);
        }
        return parseDocument(content);
    }

    /**
     * Parses LaTeX text. Like {@link #loadDocument}, a text holding a {@code document}
     * environment yields that environment's body; any other text is taken as the body itself.
     *
     * @throws MultipleDocumentsException if the text has more than one {@code document} environment
     * @throws org.dxworks.texmd.latex.LatexParseException if the text is not well-formed
     */
    public TexDocNode parseDocument(String tex) {
        List<LatexNode> nodes = new LatexWalker(tex, latexContext).getLatexNodes();
        return buildDocument(documentBody(nodes));
    }

    /**
     * Converts a loaded document. Label macros are removed from the tree first; their
     * information already lives in the document's reference index.
     */
    public Document toMarkdown(TexDocNode doc) {
        doc.remove(TexNodeKind.MACRO, ReferenceIndex.LABEL, true);
        ConversionContext context = new ConversionContext(registry, doc.getReferenceIndex());
        List<Node> children = context.convertAll(doc.getChildren());
        return MarkdownNodes.document(children);
    }

    private static List<LatexNode> documentBody(List<LatexNode> nodes) {
        List<LatexEnvironmentNode> documents = new ArrayList<>();
        for (LatexNode node : nodes) {
            if (node instanceof LatexEnvironmentNode
                    && TexDocNode.DOCUMENT.equals(((LatexEnvironmentNode) node).getEnvironmentName())) {
                documents.add((LatexEnvironmentNode) node);
            }
        }
        if (documents.size() > 1) {
            throw new MultipleDocumentsException(documents.size());
        }
        return documents.isEmpty() ? nodes : documents.get(0).getNodeList();
    }

    private TexDocNode buildDocument(List<LatexNode> body) {
        List<TexNode> children = TexAstBuilder.convertAll(body);
        TexDocNode doc = new TexDocNode(children);
        doc.setReferenceIndex(ReferenceIndex.build(doc));
        return doc;
    }
}
