package io.hearthwarrio.outlinium.core.dom;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoded, unfiltered DOM tree together with lookups by snapshot index and by backend identity.
 * <p>
 * This is the "original" tree of a build: filtered trees are copies, and the element a filtered node came from
 * is found here through its snapshot index.
 */
public final class DomDocument {

    /**
     * Snapshot index used for the synthesized root when the snapshot holds no element at all.
     */
    public static final int PLACEHOLDER_INDEX = -1;

    private final ElementNode root;
    private final Map<Integer, ElementNode> elementsByIndex;
    private final Map<Integer, ElementNode> elementsByBackendNodeId;

    DomDocument(ElementNode root) {
        this.root = root;
        Map<Integer, ElementNode> byIndex = new HashMap<>();
        Map<Integer, ElementNode> byBackendId = new HashMap<>();
        collect(root, byIndex, byBackendId);
        this.elementsByIndex = Collections.unmodifiableMap(byIndex);
        this.elementsByBackendNodeId = Collections.unmodifiableMap(byBackendId);
    }

    /**
     * Document holding only a synthesized {@code html} root.
     */
    public static DomDocument placeholder() {
        return new DomDocument(placeholderRoot());
    }

    static ElementNode placeholderRoot() {
        return new ElementNode(PLACEHOLDER_INDEX, "html", null, null, null, false, null, List.of());
    }

    private static void collect(
            ElementNode node,
            Map<Integer, ElementNode> byIndex,
            Map<Integer, ElementNode> byBackendId
    ) {
        byIndex.put(node.getIndex(), node);
        if (node.getBackendNodeId() != null) {
            byBackendId.putIfAbsent(node.getBackendNodeId(), node);
        }
        for (ElementNode child : node.getElementChildren()) {
            collect(child, byIndex, byBackendId);
        }
    }

    public ElementNode getRoot() {
        return root;
    }

    /**
     * @return original element with the given snapshot index, or null when it is not part of this tree
     */
    public ElementNode elementAt(int index) {
        return elementsByIndex.get(index);
    }

    /**
     * @return original element with the given backend identity, or null when none
     */
    public ElementNode elementByBackendNodeId(Integer backendNodeId) {
        if (backendNodeId == null) {
            return null;
        }
        return elementsByBackendNodeId.get(backendNodeId);
    }

    public int size() {
        return elementsByIndex.size();
    }
}
