package io.hearthwarrio.outlinium.core;

import io.hearthwarrio.outlinium.core.dom.ElementNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Turns identifiers into absolute XPath locators.
 * <p>
 * The path is computed from the original (unfiltered) parent chain: each step is {@code /{tag}[{position}]},
 * where the 1-based position counts same-tag element siblings and is omitted when the element is the only one.
 * The topmost element renders as {@code /{tag}}.
 */
public final class LocatorResolver {

    private final IdentifierMap identifierMap;

    public LocatorResolver(IdentifierMap identifierMap) {
        this.identifierMap = Objects.requireNonNull(identifierMap, "identifierMap must not be null");
    }

    /**
     * @param identifier identifier from the same outline as the map
     * @return absolute XPath
     * @throws IdentifierNotFoundException when the identifier is not in the map
     */
    public String resolve(String identifier) {
        ElementNode element = identifierMap.get(identifier);
        if (element == null) {
            throw new IdentifierNotFoundException(
                    "Identifier '" + identifier + "' is not part of the current outline. " +
                            "Identifiers are valid only for the observation that issued them; observe the page again."
            );
        }
        return pathOf(element);
    }

    public static String pathOf(ElementNode element) {
        Objects.requireNonNull(element, "element must not be null");

        Deque<String> steps = new ArrayDeque<>();
        for (ElementNode current = element; current != null; current = current.getParent()) {
            ElementNode parent = current.getParent();
            String step = "/" + current.getTag();
            if (parent != null) {
                int position = 0;
                int sameTag = 0;
                for (ElementNode sibling : parent.getElementChildren()) {
                    if (sibling.getTag().equals(current.getTag())) {
                        sameTag++;
                        if (sibling == current) {
                            position = sameTag;
                        }
                    }
                }
                if (sameTag > 1) {
                    step += "[" + position + "]";
                }
            }
            steps.addFirst(step);
        }
        return String.join("", steps);
    }
}
