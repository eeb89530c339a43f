package io.hearthwarrio.outlinium.core.filter;

import io.hearthwarrio.outlinium.core.tree.RemovalPolicy;
import io.hearthwarrio.outlinium.core.tree.TreeFilterEngine;
import io.hearthwarrio.outlinium.core.tree.TreeNode;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Filter step that removes predicate-matching nodes with a fixed {@link RemovalPolicy}.
 */
public final class PredicateFilter<N extends TreeNode<N>> implements TreeFilter<N> {

    private final String id;
    private final int order;
    private final Predicate<? super N> shouldRemove;
    private final RemovalPolicy policy;

    public PredicateFilter(String id, int order, Predicate<? super N> shouldRemove, RemovalPolicy policy) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.order = order;
        this.shouldRemove = Objects.requireNonNull(shouldRemove, "shouldRemove must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public int order() {
        return order;
    }

    public RemovalPolicy getPolicy() {
        return policy;
    }

    @Override
    public N apply(N root) {
        return TreeFilterEngine.filter(root, shouldRemove, policy);
    }

    @Override
    public String toString() {
        return "PredicateFilter{" + id + ", " + policy + '}';
    }
}
