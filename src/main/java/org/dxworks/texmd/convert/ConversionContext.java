package org.dxworks.texmd.convert;

import org.commonmark.node.Node;
import org.dxworks.texmd.tex.ReferenceIndex;
import org.dxworks.texmd.tex.TexNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What a converter sees while a document is converted: the registry, for converting
 * children, and the document's reference index.
 */
public class ConversionContext {

    private final ConverterRegistry registry;
    private final ReferenceIndex referenceIndex;

    public ConversionContext(ConverterRegistry registry, ReferenceIndex referenceIndex) {
        this.registry = registry;
        this.referenceIndex = referenceIndex;
    }

    public ReferenceIndex getReferenceIndex() {
        return referenceIndex;
    }

    /**
     * Converts a node with its registered converter. Nodes without one produce nothing.
     */
    public List<Node> convert(TexNode node) {
        Optional<Converter> converter = registry.converterFor(node);
        if (converter.isEmpty()) {
            return List.of();
        }
        return converter.get().convert(node, this);
    }

    public List<Node> convertAll(List<TexNode> nodes) {
        List<Node> result = new ArrayList<>();
        for (TexNode node : nodes) {
            result.addAll(convert(node));
        }
        return result;
    }
}
