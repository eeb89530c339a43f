package io.hearthwarrio.outlinium.core.ax;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoded, unfiltered accessibility tree.
 */
public final class AccessibilityTree {

    public static final int PLACEHOLDER_INDEX = -1;

    private final AccessibilityNode root;
    private final Map<Integer, AccessibilityNode> nodesByIndex;

    AccessibilityTree(AccessibilityNode root) {
        this.root = root;
        Map<Integer, AccessibilityNode> byIndex = new HashMap<>();
        collect(root, byIndex);
        this.nodesByIndex = Collections.unmodifiableMap(byIndex);
    }

    /**
     * Tree holding only a synthesized {@code RootWebArea}.
     */
    public static AccessibilityTree placeholder() {
        AccessibilityNode root = new AccessibilityNode(PLACEHOLDER_INDEX, "", null, false, List.of(),
                AxValue.of("role", "RootWebArea"), null, null, null, null, List.of(), "", List.of());
        return new AccessibilityTree(root);
    }

    private static void collect(AccessibilityNode node, Map<Integer, AccessibilityNode> byIndex) {
        byIndex.put(node.getIndex(), node);
        for (AccessibilityNode child : node.getChildren()) {
            collect(child, byIndex);
        }
    }

    public AccessibilityNode getRoot() {
        return root;
    }

    /**
     * @return original node with the given index, or null when it is not part of this tree
     */
    public AccessibilityNode nodeAt(int index) {
        return nodesByIndex.get(index);
    }

    public int size() {
        return nodesByIndex.size();
    }
}
