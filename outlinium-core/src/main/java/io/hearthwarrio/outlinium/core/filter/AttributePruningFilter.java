package io.hearthwarrio.outlinium.core.filter;

import io.hearthwarrio.outlinium.core.dom.DomNode;
import io.hearthwarrio.outlinium.core.dom.ElementNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drops every attribute that is neither semantic nor an interactivity marker, keeping source order of the rest.
 */
public final class AttributePruningFilter implements TreeFilter<DomNode> {

    private final DomSemantics semantics;
    private final int order;

    public AttributePruningFilter(DomSemantics semantics, int order) {
        this.semantics = Objects.requireNonNull(semantics, "semantics must not be null");
        this.order = order;
    }

    @Override
    public String id() {
        return "prune-attributes";
    }

    @Override
    public int order() {
        return order;
    }

    @Override
    public DomNode apply(DomNode root) {
        return prune(root);
    }

    private DomNode prune(DomNode node) {
        List<DomNode> children = new ArrayList<>(node.getChildren().size());
        for (DomNode child : node.getChildren()) {
            children.add(prune(child));
        }
        if (!(node instanceof ElementNode)) {
            return node.withChildren(children);
        }

        Map<String, String> kept = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : ((ElementNode) node).getAttributes().entrySet()) {
            if (semantics.isSemanticAttribute(e.getKey()) || semantics.isInteractivityAttribute(e.getKey())) {
                kept.put(e.getKey(), e.getValue());
            }
        }
        return ((ElementNode) node).withAttributes(kept, children);
    }
}
