package io.hearthwarrio.outlinium.core.ax;

import io.hearthwarrio.outlinium.core.tree.TreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of a decoded accessibility tree.
 * <p>
 * Like DOM nodes, accessibility nodes are immutable apart from the parent link; filters work on copies
 * made by {@link #withChildren(List)}, which keep {@link #getIndex()}.
 */
public final class AccessibilityNode implements TreeNode<AccessibilityNode> {

    /**
     * Roles whose nodes only repeat text of their container.
     */
    public static final List<String> TEXT_ROLES = List.of("StaticText", "InlineTextBox");

    private final int index;
    private final String nodeId;
    private final Integer backendNodeId;
    private final boolean ignored;
    private final List<Object> ignoredReasons;
    private final AxValue role;
    private final AxValue chromeRole;
    private final AxValue name;
    private final AxValue description;
    private final AxValue value;
    private final List<AxProperty> properties;
    private final String frameId;
    private final List<AccessibilityNode> children;
    private AccessibilityNode parent;

    public AccessibilityNode(
            int index,
            String nodeId,
            Integer backendNodeId,
            boolean ignored,
            List<Object> ignoredReasons,
            AxValue role,
            AxValue chromeRole,
            AxValue name,
            AxValue description,
            AxValue value,
            List<AxProperty> properties,
            String frameId,
            List<AccessibilityNode> children
    ) {
        this.index = index;
        this.nodeId = nodeId == null ? "" : nodeId;
        this.backendNodeId = backendNodeId;
        this.ignored = ignored;
        this.ignoredReasons = ignoredReasons == null ? List.of() : Collections.unmodifiableList(ignoredReasons);
        this.role = role == null ? AxValue.empty() : role;
        this.chromeRole = chromeRole;
        this.name = name == null ? AxValue.empty() : name;
        this.description = description == null ? AxValue.empty() : description;
        this.value = value;
        this.properties = properties == null ? List.of() : Collections.unmodifiableList(properties);
        this.frameId = frameId == null ? "" : frameId;
        this.children = children == null || children.isEmpty()
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(children));
        for (AccessibilityNode child : this.children) {
            child.attachTo(this);
        }
    }

    private void attachTo(AccessibilityNode newParent) {
        if (parent != null) {
            throw new IllegalStateException("Accessibility node " + nodeId + " is already attached to a parent");
        }
        this.parent = newParent;
    }

    /**
     * Position of this node in the raw {@code nodes} list.
     */
    public int getIndex() {
        return index;
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * @return backend identity of the DOM node this node describes, or null when none
     */
    public Integer getBackendNodeId() {
        return backendNodeId;
    }

    public boolean isIgnored() {
        return ignored;
    }

    public List<Object> getIgnoredReasons() {
        return ignoredReasons;
    }

    public AxValue getRole() {
        return role;
    }

    public String getRoleName() {
        return role.asText();
    }

    /**
     * @return chrome-specific role, or null when absent
     */
    public AxValue getChromeRole() {
        return chromeRole;
    }

    public AxValue getName() {
        return name;
    }

    public AxValue getDescription() {
        return description;
    }

    /**
     * @return node value, or null when absent
     */
    public AxValue getValue() {
        return value;
    }

    public List<AxProperty> getProperties() {
        return properties;
    }

    public String getFrameId() {
        return frameId;
    }

    public boolean isTextRole() {
        return TEXT_ROLES.contains(getRoleName());
    }

    @Override
    public List<AccessibilityNode> getChildren() {
        return children;
    }

    @Override
    public AccessibilityNode getParent() {
        return parent;
    }

    @Override
    public AccessibilityNode withChildren(List<AccessibilityNode> newChildren) {
        return new AccessibilityNode(index, nodeId, backendNodeId, ignored, ignoredReasons, role, chromeRole,
                name, description, value, properties, frameId, newChildren);
    }

    @Override
    public String toString() {
        return "AccessibilityNode{" +
                "nodeId='" + nodeId + '\'' +
                ", role='" + getRoleName() + '\'' +
                ", name='" + name.asText() + '\'' +
                ", ignored=" + ignored +
                ", children=" + children.size() +
                '}';
    }
}
