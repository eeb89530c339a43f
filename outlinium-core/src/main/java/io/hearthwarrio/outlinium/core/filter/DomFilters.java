package io.hearthwarrio.outlinium.core.filter;

import io.hearthwarrio.outlinium.core.dom.DomNode;
import io.hearthwarrio.outlinium.core.tree.RemovalPolicy;

/**
 * Filter steps for DOM-mode outlines, in their pipeline order:
 * visibility, attribute pruning, non-semantic element removal, wrapper collapse.
 */
public final class DomFilters {

    public static final int VISIBILITY_ORDER = 100;
    public static final int ATTRIBUTE_PRUNING_ORDER = 200;
    public static final int NON_SEMANTIC_ORDER = 300;
    public static final int WRAPPER_COLLAPSE_ORDER = 400;

    private DomFilters() {
    }

    /**
     * Deletes unrendered elements together with their subtrees.
     */
    public static TreeFilter<DomNode> visibility(DomSemantics semantics) {
        return new PredicateFilter<>("visibility", VISIBILITY_ORDER,
                semantics::isDiscardedAsUnrendered, RemovalPolicy.DELETE);
    }

    public static TreeFilter<DomNode> attributePruning(DomSemantics semantics) {
        return new AttributePruningFilter(semantics, ATTRIBUTE_PRUNING_ORDER);
    }

    /**
     * Promotes children of elements that carry no meaning of their own.
     */
    public static TreeFilter<DomNode> nonSemantic(DomSemantics semantics) {
        return new PredicateFilter<>("non-semantic", NON_SEMANTIC_ORDER,
                node -> !semantics.hasSemanticValue(node), RemovalPolicy.PROMOTE);
    }

    /**
     * Replaces attribute-free single-child wrappers with their child.
     */
    public static TreeFilter<DomNode> wrapperCollapse(DomSemantics semantics) {
        return new PredicateFilter<>("wrapper-collapse", WRAPPER_COLLAPSE_ORDER,
                semantics::isCollapsibleWrapper, RemovalPolicy.PROMOTE);
    }
}
