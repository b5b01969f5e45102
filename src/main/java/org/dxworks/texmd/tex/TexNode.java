package org.dxworks.texmd.tex;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class of the typed LaTeX AST.
 *
 * <p>Each node gets a handle at construction that never changes, even when the node is
 * renamed. The reference index keys its back-map on that handle.
 */
public abstract class TexNode {

    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id = NEXT_ID.getAndIncrement();

    public long getId() {
        return id;
    }

    public abstract TexNodeKind kind();

    /**
     * Serializes the node back to LaTeX source.
     */
    public abstract String toLatex();

    @Override
    public String toString() {
        return toLatex();
    }
}
