package io.hearthwarrio.outlinium.core.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Predicate-driven tree rewrite shared by all concrete filters.
 * <p>
 * Contract:
 * <ul>
 *   <li>The root is never removed; only its descendants go through the removal logic.</li>
 *   <li>Children are filtered before their parent, except under {@link RemovalPolicy#DELETE},
 *       which drops a matching subtree without visiting it.</li>
 *   <li>The input tree is never mutated. Every surviving node is a copy made with
 *       {@link TreeNode#withChildren(List)}, so the same tree can be filtered many times.</li>
 * </ul>
 */
public final class TreeFilterEngine {

    private TreeFilterEngine() {
    }

    /**
     * Filters the tree below {@code root}.
     *
     * @param root         tree root (always kept)
     * @param shouldRemove predicate selecting nodes to remove
     * @param policy       what to do with matching nodes
     * @param <N>          node type
     * @return new root (never null)
     */
    public static <N extends TreeNode<N>> N filter(N root, Predicate<? super N> shouldRemove, RemovalPolicy policy) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(shouldRemove, "shouldRemove must not be null");
        Objects.requireNonNull(policy, "policy must not be null");

        return root.withChildren(filterChildren(root, shouldRemove, policy));
    }

    private static <N extends TreeNode<N>> List<N> filterChildren(
            N node,
            Predicate<? super N> shouldRemove,
            RemovalPolicy policy
    ) {
        List<N> out = new ArrayList<>();
        for (N child : node.getChildren()) {
            out.addAll(filterNode(child, shouldRemove, policy));
        }
        return out;
    }

    private static <N extends TreeNode<N>> List<N> filterNode(
            N node,
            Predicate<? super N> shouldRemove,
            RemovalPolicy policy
    ) {
        if (policy == RemovalPolicy.DELETE && shouldRemove.test(node)) {
            return List.of();
        }

        List<N> children = filterChildren(node, shouldRemove, policy);

        if (policy == RemovalPolicy.DELETE || !shouldRemove.test(node)) {
            return List.of(node.withChildren(children));
        }

        switch (policy) {
            case PROMOTE:
                return children;
            case KEEP_WRAPPER:
                if (children.isEmpty()) {
                    return List.of();
                }
                return List.of(node.withChildren(children));
            default:
                throw new IllegalStateException("Unsupported removal policy: " + policy);
        }
    }
}
