package io.hearthwarrio.outlinium.core.tree;

/**
 * What {@link TreeFilterEngine} does with a node that matches the removal predicate.
 */
public enum RemovalPolicy {

    /**
     * Drop the node and splice its already-filtered children into its former position.
     */
    PROMOTE,

    /**
     * Drop the node together with its whole subtree, without descending into it.
     */
    DELETE,

    /**
     * Keep the node only if at least one of its children survives filtering; otherwise drop it.
     */
    KEEP_WRAPPER
}
