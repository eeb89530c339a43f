package io.hearthwarrio.outlinium.core.filter;

import io.hearthwarrio.outlinium.core.ax.AccessibilityNode;
import io.hearthwarrio.outlinium.core.tree.RemovalPolicy;

import java.util.Set;

/**
 * Filter steps for accessibility-mode outlines, in their pipeline order:
 * ignored nodes, duplicated narration, generic roles.
 */
public final class AccessibilityFilters {

    public static final int IGNORED_ORDER = 100;
    public static final int DUPLICATE_TEXT_ORDER = 200;
    public static final int GENERIC_ROLE_ORDER = 300;

    private static final Set<String> NON_SEMANTIC_ROLES = Set.of("generic", "none");

    private AccessibilityFilters() {
    }

    public static TreeFilter<AccessibilityNode> ignored() {
        return new PredicateFilter<>("ignored", IGNORED_ORDER,
                AccessibilityNode::isIgnored, RemovalPolicy.PROMOTE);
    }

    public static TreeFilter<AccessibilityNode> duplicateText() {
        return new PredicateFilter<>("duplicate-text", DUPLICATE_TEXT_ORDER,
                AccessibilityFilters::isDuplicateText, RemovalPolicy.KEEP_WRAPPER);
    }

    public static TreeFilter<AccessibilityNode> genericRoles() {
        return new PredicateFilter<>("generic-roles", GENERIC_ROLE_ORDER,
                node -> NON_SEMANTIC_ROLES.contains(node.getRoleName()), RemovalPolicy.PROMOTE);
    }

    /**
     * A text node repeats its container when its name is contained in the name of the nearest
     * ancestor that has a name at all. Containment is plain substring matching.
     */
    static boolean isDuplicateText(AccessibilityNode node) {
        if (!node.isTextRole()) {
            return false;
        }
        String name = node.getName().asText();
        if (name.isEmpty()) {
            return false;
        }
        for (AccessibilityNode p = node.getParent(); p != null; p = p.getParent()) {
            String ancestorName = p.getName().asText();
            if (!ancestorName.isEmpty()) {
                return ancestorName.contains(name);
            }
        }
        return false;
    }
}
