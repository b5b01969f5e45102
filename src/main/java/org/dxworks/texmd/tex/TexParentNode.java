package org.dxworks.texmd.tex;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Capability of nodes that own an ordered list of children: groups, macros,
 * environments and math regions.
 */
public interface TexParentNode {

    /**
     * The live, ordered children list. Each child belongs to exactly one parent.
     */
    List<TexNode> getChildren();

    /**
     * LaTeX of the children, without this node's own delimiters.
     */
    default String groupLatex() {
        StringBuilder sb = new StringBuilder();
        for (TexNode child : getChildren()) {
            sb.append(child.toLatex());
        }
        return sb.toString();
    }

    default List<TexNode> find(TexNodeKind kind, String name) {
        return find(kind, name, false);
    }

    /**
     * Finds children by kind and/or name.
     *
     * <p>With both given a child must match both; with only a kind any child of that kind
     * matches; with only a name only named nodes of that name match. With {@code deep} the
     * search continues into every child that has children, in pre-order.
     *
     * @param kind kind to match, or {@code null}
     * @param name name to match, or {@code null}/empty
     * @throws IllegalArgumentException if neither kind nor name is given
     */
    default List<TexNode> find(TexNodeKind kind, String name, boolean deep) {
        requireCriteria(kind, name);
        List<TexNode> found = new ArrayList<>();
        for (TexNode child : getChildren()) {
            if (matches(child, kind, name)) {
                found.add(child);
            }
            if (deep && child instanceof TexParentNode) {
                found.addAll(((TexParentNode) child).find(kind, name, true));
            }
        }
        return found;
    }

    default void remove(TexNodeKind kind, String name) {
        remove(kind, name, false);
    }

    /**
     * Removes matching children in place, using the same rules as {@link #find}. With
     * {@code deep} the removal continues into children that were kept; a removed subtree
     * is not visited.
     *
     * @throws IllegalArgumentException if neither kind nor name is given
     */
    default void remove(TexNodeKind kind, String name, boolean deep) {
        requireCriteria(kind, name);
        Iterator<TexNode> it = getChildren().iterator();
        while (it.hasNext()) {
            TexNode child = it.next();
            if (matches(child, kind, name)) {
                it.remove();
            } else if (deep && child instanceof TexParentNode) {
                ((TexParentNode) child).remove(kind, name, true);
            }
        }
    }

    private static void requireCriteria(TexNodeKind kind, String name) {
        if (kind == null && (name == null || name.isEmpty())) {
            throw new IllegalArgumentException("At least one of kind or name must be given");
        }
    }

    private static boolean matches(TexNode node, TexNodeKind kind, String name) {
        boolean byName = name != null && !name.isEmpty();
        if (byName && !(node instanceof TexNamedNode && name.equals(((TexNamedNode) node).getName()))) {
            return false;
        }
        return kind == null || node.kind() == kind;
    }
}
