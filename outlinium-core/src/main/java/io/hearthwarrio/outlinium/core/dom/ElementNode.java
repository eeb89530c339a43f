package io.hearthwarrio.outlinium.core.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decoded DOM element.
 * <p>
 * Instances are immutable except for the parent link, which is set when the element is handed to its parent's
 * constructor. Filters never modify an element; they build copies via {@link #withChildren(List)} or
 * {@link #withAttributes(Map, List)}.
 */
public final class ElementNode extends DomNode {

    private final String tag;
    private final Map<String, String> attributes;
    private final Map<String, String> styles;
    private final BoundingBox bounds;
    private final boolean rendered;
    private final Integer backendNodeId;
    private final List<DomNode> children;

    /**
     * @param index         position in the raw snapshot arrays
     * @param tag           lower-cased tag name
     * @param attributes    attributes in source order (may be null)
     * @param styles        requested computed styles (may be null)
     * @param bounds        layout box (may be null)
     * @param rendered      whether the snapshot carried layout data for this element
     * @param backendNodeId backend identity (may be null)
     * @param children      children; each must be unattached
     */
    public ElementNode(
            int index,
            String tag,
            Map<String, String> attributes,
            Map<String, String> styles,
            BoundingBox bounds,
            boolean rendered,
            Integer backendNodeId,
            List<DomNode> children
    ) {
        super(index);
        this.tag = tag == null ? "" : tag;
        this.attributes = attributes == null || attributes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.styles = styles == null || styles.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(styles));
        this.bounds = bounds;
        this.rendered = rendered;
        this.backendNodeId = backendNodeId;
        this.children = children == null || children.isEmpty()
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(children));
        for (DomNode child : this.children) {
            child.attachTo(this);
        }
    }

    public String getTag() {
        return tag;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    /**
     * @return attribute value, or empty string when absent
     */
    public String getAttribute(String name) {
        String v = attributes.get(name);
        return v == null ? "" : v;
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    public Map<String, String> getStyles() {
        return styles;
    }

    /**
     * @return layout box, or null when the snapshot had none
     */
    public BoundingBox getBounds() {
        return bounds;
    }

    /**
     * Whether the snapshot's layout data listed this element. Absence is the only "not rendered" signal:
     * the protocol leaves unrendered nodes out of the layout tree.
     */
    public boolean isRendered() {
        return rendered;
    }

    /**
     * @return backend identity, or null when unknown
     */
    public Integer getBackendNodeId() {
        return backendNodeId;
    }

    @Override
    public List<DomNode> getChildren() {
        return children;
    }

    /**
     * @return element children only, in document order
     */
    public List<ElementNode> getElementChildren() {
        List<ElementNode> out = new ArrayList<>();
        for (DomNode child : children) {
            if (child instanceof ElementNode) {
                out.add((ElementNode) child);
            }
        }
        return out;
    }

    /**
     * @return text of all descendant text nodes joined with a single space
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        appendText(this, sb);
        return sb.toString();
    }

    private static void appendText(DomNode node, StringBuilder sb) {
        if (node instanceof TextNode) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(((TextNode) node).getContent());
            return;
        }
        for (DomNode child : node.getChildren()) {
            appendText(child, sb);
        }
    }

    @Override
    public ElementNode withChildren(List<DomNode> newChildren) {
        return new ElementNode(getIndex(), tag, attributes, styles, bounds, rendered, backendNodeId, newChildren);
    }

    /**
     * Copy with a different attribute map and the given (unattached) children.
     */
    public ElementNode withAttributes(Map<String, String> newAttributes, List<DomNode> newChildren) {
        Objects.requireNonNull(newAttributes, "newAttributes must not be null");
        return new ElementNode(getIndex(), tag, newAttributes, styles, bounds, rendered, backendNodeId, newChildren);
    }

    @Override
    public String toString() {
        return "ElementNode{" +
                "index=" + getIndex() +
                ", tag='" + tag + '\'' +
                ", attributes=" + attributes +
                ", rendered=" + rendered +
                ", backendNodeId=" + backendNodeId +
                ", children=" + children.size() +
                '}';
    }
}
