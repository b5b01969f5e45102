package org.dxworks.texmd.convert;

import org.dxworks.texmd.tex.TexNamedNode;
import org.dxworks.texmd.tex.TexNode;
import org.dxworks.texmd.tex.TexNodeKind;

import java.util.Objects;

/**
 * Dispatch key of a converter: a node kind and a node name, empty for unnamed kinds.
 */
public final class ConverterKey {

    private final TexNodeKind kind;
    private final String name;

    private ConverterKey(TexNodeKind kind, String name) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name == null ? "" : name;
    }

    public static ConverterKey of(TexNodeKind kind, String name) {
        return new ConverterKey(kind, name);
    }

    public static ConverterKey of(TexNodeKind kind) {
        return new ConverterKey(kind, "");
    }

    public static ConverterKey of(TexNode node) {
        String name = node instanceof TexNamedNode ? ((TexNamedNode) node).getName() : "";
        return new ConverterKey(node.kind(), name);
    }

    public TexNodeKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConverterKey)) return false;
        ConverterKey other = (ConverterKey) o;
        return kind == other.kind && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return name.isEmpty() ? kind.name() : kind.name() + ":" + name;
    }
}
