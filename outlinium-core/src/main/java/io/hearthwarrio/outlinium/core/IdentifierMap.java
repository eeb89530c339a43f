package io.hearthwarrio.outlinium.core;

import io.hearthwarrio.outlinium.core.dom.ElementNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Identifier to original (unfiltered) DOM element, in outline order.
 */
public final class IdentifierMap {

    private static final IdentifierMap EMPTY = new IdentifierMap(Map.of());

    private final Map<String, ElementNode> elements;

    public IdentifierMap(Map<String, ElementNode> elements) {
        this.elements = elements == null || elements.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(elements));
    }

    public static IdentifierMap empty() {
        return EMPTY;
    }

    /**
     * @return original element, or null when the identifier is unknown
     */
    public ElementNode get(String identifier) {
        return elements.get(identifier);
    }

    public boolean contains(String identifier) {
        return elements.containsKey(identifier);
    }

    public Set<String> identifiers() {
        return elements.keySet();
    }

    public Map<String, ElementNode> asMap() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public String toString() {
        return "IdentifierMap" + elements.keySet();
    }
}
