package io.hearthwarrio.outlinium.core.dom;

import io.hearthwarrio.outlinium.core.tree.TreeNode;

/**
 * Node of a decoded DOM tree: either an {@link ElementNode} or a {@link TextNode}.
 * <p>
 * {@link #getIndex()} is the node's position in the raw snapshot arrays. Copies made by filters keep it,
 * which is how a filtered node finds its original counterpart in {@link DomDocument}.
 */
public abstract class DomNode implements TreeNode<DomNode> {

    private final int index;
    private ElementNode parent;

    protected DomNode(int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public ElementNode getParent() {
        return parent;
    }

    void attachTo(ElementNode newParent) {
        if (parent != null) {
            throw new IllegalStateException("Node " + index + " is already attached to a parent");
        }
        this.parent = newParent;
    }
}
