package org.dxworks.texmd.tex;

import java.util.List;

/**
 * Root of a parsed document: a {@code document} environment that also owns the
 * reference index built for it.
 */
public class TexDocNode extends TexEnvNode {

    public static final String DOCUMENT = "document";

    private ReferenceIndex referenceIndex = ReferenceIndex.empty();

    public TexDocNode(List<TexNode> children) {
        super(DOCUMENT, children);
    }

    public ReferenceIndex getReferenceIndex() {
        return referenceIndex;
    }

    public void setReferenceIndex(ReferenceIndex referenceIndex) {
        this.referenceIndex = referenceIndex;
    }
}
