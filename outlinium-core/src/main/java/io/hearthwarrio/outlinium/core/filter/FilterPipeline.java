package io.hearthwarrio.outlinium.core.filter;

import io.hearthwarrio.outlinium.core.OutlineSettings;
import io.hearthwarrio.outlinium.core.ax.AccessibilityNode;
import io.hearthwarrio.outlinium.core.dom.DomNode;
import io.hearthwarrio.outlinium.core.tree.TreeNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered composition of {@link TreeFilter} steps.
 * <p>
 * Steps are normalized on construction:
 * <ul>
 *   <li>null entries are removed</li>
 *   <li>steps are ordered by {@link TreeFilter#order()} then {@link TreeFilter#id()}</li>
 *   <li>duplicates by {@link TreeFilter#id()} are dropped (first one wins)</li>
 * </ul>
 */
public final class FilterPipeline<N extends TreeNode<N>> {

    private final List<TreeFilter<N>> steps;

    public FilterPipeline(List<? extends TreeFilter<N>> steps) {
        this.steps = normalize(steps);
    }

    /**
     * Visibility, attribute pruning, non-semantic removal, wrapper collapse.
     */
    public static FilterPipeline<DomNode> forDom(OutlineSettings settings) {
        DomSemantics semantics = new DomSemantics(settings);
        return new FilterPipeline<>(List.of(
                DomFilters.visibility(semantics),
                DomFilters.attributePruning(semantics),
                DomFilters.nonSemantic(semantics),
                DomFilters.wrapperCollapse(semantics)
        ));
    }

    /**
     * Ignored nodes, duplicated narration, generic roles.
     */
    public static FilterPipeline<AccessibilityNode> forAccessibility() {
        return new FilterPipeline<>(List.of(
                AccessibilityFilters.ignored(),
                AccessibilityFilters.duplicateText(),
                AccessibilityFilters.genericRoles()
        ));
    }

    public List<TreeFilter<N>> getSteps() {
        return steps;
    }

    public N apply(N root) {
        Objects.requireNonNull(root, "root must not be null");
        N current = root;
        for (TreeFilter<N> step : steps) {
            current = step.apply(current);
        }
        return current;
    }

    private static <N extends TreeNode<N>> List<TreeFilter<N>> normalize(List<? extends TreeFilter<N>> steps) {
        if (steps == null || steps.isEmpty()) {
            return List.of();
        }

        List<TreeFilter<N>> cleaned = new ArrayList<>();
        for (TreeFilter<N> s : steps) {
            if (s != null) {
                cleaned.add(s);
            }
        }
        cleaned.sort(Comparator.<TreeFilter<N>>comparingInt(TreeFilter::order).thenComparing(TreeFilter::id));

        Map<String, TreeFilter<N>> byId = new LinkedHashMap<>();
        for (TreeFilter<N> s : cleaned) {
            byId.putIfAbsent(s.id(), s);
        }
        return List.copyOf(byId.values());
    }
}
