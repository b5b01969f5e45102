package org.dxworks.texmd.tex;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Label table of a document: every labeled {@code equation} environment gets a sequential
 * id, starting at 0, in the order the environments appear.
 *
 * <p>The index is built once, before any conversion, so a reference may point to a label
 * that appears later in the document.
 */
public final class ReferenceIndex {

    public static final String EQUATION = "equation";
    public static final String LABEL = "label";
    public static final int UNKNOWN_ID = -1;

    private static final ReferenceIndex EMPTY = new ReferenceIndex(Map.of(), Map.of());

    private final Map<String, Reference> referencesByLabel;
    private final Map<Long, String> labelsByNodeId;

    private ReferenceIndex(Map<String, Reference> referencesByLabel, Map<Long, String> labelsByNodeId) {
        this.referencesByLabel = Collections.unmodifiableMap(referencesByLabel);
        this.labelsByNodeId = Collections.unmodifiableMap(labelsByNodeId);
    }

    public static ReferenceIndex empty() {
        return EMPTY;
    }

    /**
     * Scans {@code root} for {@code equation} environments holding a {@code \label}. Must run
     * before equations are starred, since starred environments are no longer named
     * {@code equation}. A label used twice keeps its first environment.
     *
     * @throws MalformedReferenceException if a label macro has no plain-text argument
     */
    public static ReferenceIndex build(TexParentNode root) {
        Map<String, Reference> references = new LinkedHashMap<>();
        Map<Long, String> labels = new HashMap<>();
        for (TexNode equation : root.find(TexNodeKind.ENVIRONMENT, EQUATION, true)) {
            List<TexNode> labelMacros = ((TexParentNode) equation).find(TexNodeKind.MACRO, LABEL, true);
            if (labelMacros.isEmpty()) continue;

            String label = argumentText((TexMacroNode) labelMacros.get(0));
            if (references.containsKey(label)) continue;
            references.put(label, new Reference(references.size(), EQUATION, equation));
            labels.put(equation.getId(), label);
        }
        return new ReferenceIndex(references, labels);
    }

    /**
     * Text of a label-like macro's argument: the first child of its first argument group.
     *
     * @throws MalformedReferenceException if the argument is not a plain-text leaf
     */
    public static String argumentText(TexMacroNode macro) {
        List<TexNode> arguments = macro.getChildren();
        if (arguments.isEmpty() || !(arguments.get(0) instanceof TexGroupNode)) {
            throw new MalformedReferenceException(macro.getName(), macro.toLatex());
        }
        List<TexNode> content = ((TexGroupNode) arguments.get(0)).getChildren();
        if (content.isEmpty() || !(content.get(0) instanceof TexTextNode)) {
            throw new MalformedReferenceException(macro.getName(), macro.toLatex());
        }
        return ((TexTextNode) content.get(0)).getText();
    }

    public Optional<Reference> lookup(String label) {
        return Optional.ofNullable(referencesByLabel.get(label));
    }

    public int idOf(String label) {
        Reference reference = referencesByLabel.get(label);
        return reference == null ? UNKNOWN_ID : reference.getId();
    }

    public String kindOf(String label) {
        Reference reference = referencesByLabel.get(label);
        return reference == null ? "" : reference.getKind();
    }

    /**
     * The label an indexed node was registered under, or an empty string.
     */
    public String labelOf(TexNode node) {
        return labelsByNodeId.getOrDefault(node.getId(), "");
    }

    public int size() {
        return referencesByLabel.size();
    }

    public static final class Reference {
        private final int id;
        private final String kind;
        private final TexNode node;

        Reference(int id, String kind, TexNode node) {
            this.id = id;
            this.kind = kind;
            this.node = node;
        }

        public int getId() {
            return id;
        }

        public String getKind() {
            return kind;
        }

        public TexNode getNode() {
            return node;
        }
    }
}
