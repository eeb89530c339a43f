package io.hearthwarrio.outlinium.core;

import io.hearthwarrio.outlinium.core.ax.AccessibilityNode;
import io.hearthwarrio.outlinium.core.dom.DomDocument;
import io.hearthwarrio.outlinium.core.dom.DomNode;
import io.hearthwarrio.outlinium.core.dom.ElementNode;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Stamps {@code "{key}-{n}"} identifiers on a filtered tree.
 * <p>
 * The walk is pre-order, depth-first, in child order. {@code n} is a zero-based counter per key, so the same
 * filtered tree always yields the same identifiers.
 */
public final class IdAssigner {

    /**
     * DOM mode: key is the lower-cased tag; identifiers point at the original element with the same snapshot index.
     */
    public IdAssignment assign(DomNode filteredRoot, DomDocument document) {
        Objects.requireNonNull(filteredRoot, "filteredRoot must not be null");
        Objects.requireNonNull(document, "document must not be null");

        Counters counters = new Counters();
        Map<Integer, String> byIndex = new HashMap<>();
        Map<String, ElementNode> elements = new LinkedHashMap<>();
        walkDom(filteredRoot, document, counters, byIndex, elements);
        return new IdAssignment(byIndex, new IdentifierMap(elements));
    }

    /**
     * Accessibility mode: key is the role; text roles get no identifier. Identifiers point at the original DOM
     * element sharing the node's backend identity; nodes without a DOM counterpart keep their identifier in the
     * outline but are left out of the map.
     */
    public IdAssignment assign(AccessibilityNode filteredRoot, DomDocument document) {
        Objects.requireNonNull(filteredRoot, "filteredRoot must not be null");
        Objects.requireNonNull(document, "document must not be null");

        Counters counters = new Counters();
        Map<Integer, String> byIndex = new HashMap<>();
        Map<String, ElementNode> elements = new LinkedHashMap<>();
        walkAccessibility(filteredRoot, document, counters, byIndex, elements);
        return new IdAssignment(byIndex, new IdentifierMap(elements));
    }

    private static void walkDom(
            DomNode node,
            DomDocument document,
            Counters counters,
            Map<Integer, String> byIndex,
            Map<String, ElementNode> elements
    ) {
        if (!(node instanceof ElementNode)) {
            return;
        }
        ElementNode element = (ElementNode) node;
        String id = counters.next(element.getTag().toLowerCase(Locale.ROOT));
        byIndex.put(element.getIndex(), id);

        ElementNode original = document.elementAt(element.getIndex());
        if (original != null) {
            elements.put(id, original);
        }

        for (DomNode child : element.getChildren()) {
            walkDom(child, document, counters, byIndex, elements);
        }
    }

    private static void walkAccessibility(
            AccessibilityNode node,
            DomDocument document,
            Counters counters,
            Map<Integer, String> byIndex,
            Map<String, ElementNode> elements
    ) {
        if (!node.isTextRole()) {
            String id = counters.next(node.getRoleName());
            byIndex.put(node.getIndex(), id);

            ElementNode original = document.elementByBackendNodeId(node.getBackendNodeId());
            if (original != null) {
                elements.put(id, original);
            }
        }
        for (AccessibilityNode child : node.getChildren()) {
            walkAccessibility(child, document, counters, byIndex, elements);
        }
    }

    private static final class Counters {
        private final Map<String, Integer> next = new HashMap<>();

        String next(String key) {
            int n = next.getOrDefault(key, 0);
            next.put(key, n + 1);
            return key + "-" + n;
        }
    }
}
