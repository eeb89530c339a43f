package io.hearthwarrio.outlinium.core.filter;

import io.hearthwarrio.outlinium.core.tree.TreeNode;

/**
 * One step of a {@link FilterPipeline}.
 * <p>
 * Contract:
 * <ul>
 *   <li>The input tree is never modified.</li>
 *   <li>The returned root is never null and keeps the input root's identity (index).</li>
 *   <li>Steps are applied in {@link #order()} sequence (ascending).</li>
 * </ul>
 *
 * @param <N> node type
 */
public interface TreeFilter<N extends TreeNode<N>> {

    /**
     * Stable identifier used in diagnostics.
     */
    default String id() {
        return getClass().getSimpleName();
    }

    /**
     * Lower values run earlier.
     */
    default int order() {
        return 0;
    }

    N apply(N root);
}
