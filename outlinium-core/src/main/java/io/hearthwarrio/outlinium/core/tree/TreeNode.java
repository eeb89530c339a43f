package io.hearthwarrio.outlinium.core.tree;

import java.util.List;

/**
 * Capability shared by every node kind that {@link TreeFilterEngine} can rewrite.
 * <p>
 * Implementations are expected to be immutable apart from the parent link, which is assigned exactly once
 * when the node is attached to a freshly built parent.
 *
 * @param <N> concrete node type
 */
public interface TreeNode<N extends TreeNode<N>> {

    /**
     * @return children in document order (never null)
     */
    List<N> getChildren();

    /**
     * @return parent node, or null for the root of a tree
     */
    N getParent();

    /**
     * Creates a copy of this node carrying the same data and identity (snapshot index)
     * but the given children. The copy has no parent; the given children are re-parented to the copy.
     * <p>
     * Callers must only pass nodes that are not part of another live tree.
     *
     * @param children new children (must not be null)
     * @return new node instance
     */
    N withChildren(List<N> children);
}
