package io.hearthwarrio.outlinium.core;

import io.hearthwarrio.outlinium.core.ax.AccessibilityNode;
import io.hearthwarrio.outlinium.core.ax.AxProperty;
import io.hearthwarrio.outlinium.core.dom.DomNode;
import io.hearthwarrio.outlinium.core.dom.ElementNode;
import io.hearthwarrio.outlinium.core.dom.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders filtered trees as an indented bullet outline (two spaces per level).
 * <p>
 * DOM lines look like {@code - button-0 (type="submit")} with text children as {@code - "Login"} one level deeper.
 * Accessibility lines look like {@code - textbox-0 "Username" focusable=true}; text roles render as
 * {@code - "text"} without identifier.
 */
public final class OutlineSerializer {

    private static final String INDENT = "  ";
    private static final String DATA_URL_PREFIX = "data:";
    private static final String ELLIPSIS = "...";

    private final OutlineSettings settings;

    public OutlineSerializer() {
        this(OutlineSettings.defaults());
    }

    public OutlineSerializer(OutlineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public String serialize(DomNode root, IdAssignment assignment) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(assignment, "assignment must not be null");
        List<String> lines = new ArrayList<>();
        writeDom(root, 0, assignment, lines);
        return String.join("\n", lines);
    }

    public String serialize(AccessibilityNode root, IdAssignment assignment) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(assignment, "assignment must not be null");
        List<String> lines = new ArrayList<>();
        writeAccessibility(root, 0, assignment, lines);
        return String.join("\n", lines);
    }

    private void writeDom(DomNode node, int depth, IdAssignment assignment, List<String> lines) {
        String indent = INDENT.repeat(depth);
        if (node instanceof TextNode) {
            lines.add(indent + "- \"" + ((TextNode) node).getContent() + "\"");
            return;
        }

        ElementNode element = (ElementNode) node;
        StringBuilder line = new StringBuilder(indent).append("- ")
                .append(label(assignment.identifierOf(element.getIndex()), element.getTag()));

        if (!element.getAttributes().isEmpty()) {
            List<String> attrs = new ArrayList<>();
            for (Map.Entry<String, String> e : element.getAttributes().entrySet()) {
                attrs.add(e.getKey() + "=\"" + elide(e.getValue()) + "\"");
            }
            line.append(" (").append(String.join(" ", attrs)).append(')');
        }
        lines.add(line.toString());

        for (DomNode child : element.getChildren()) {
            writeDom(child, depth + 1, assignment, lines);
        }
    }

    private void writeAccessibility(AccessibilityNode node, int depth, IdAssignment assignment, List<String> lines) {
        String indent = INDENT.repeat(depth);
        String name = node.getName().asText();

        if (node.isTextRole()) {
            if (!name.isEmpty()) {
                lines.add(indent + "- \"" + elide(name) + "\"");
            }
        } else {
            List<String> parts = new ArrayList<>();
            parts.add(label(assignment.identifierOf(node.getIndex()), node.getRoleName()));
            if (!name.isEmpty()) {
                parts.add("\"" + elide(name) + "\"");
            }
            String description = node.getDescription().asText();
            if (!description.isEmpty()) {
                parts.add("description=\"" + elide(description) + "\"");
            }
            for (AxProperty property : node.getProperties()) {
                String rendered = renderProperty(property);
                if (rendered != null) {
                    parts.add(rendered);
                }
            }
            lines.add(indent + "- " + String.join(" ", parts));
        }

        for (AccessibilityNode child : node.getChildren()) {
            writeAccessibility(child, depth + 1, assignment, lines);
        }
    }

    /**
     * Booleans only when true, numbers as-is, strings only when non-empty; anything else is skipped.
     */
    private String renderProperty(AxProperty property) {
        Object v = property.getValue().getValue();
        if (v instanceof Boolean) {
            return (Boolean) v ? property.getName() + "=true" : null;
        }
        if (v instanceof Number) {
            return property.getName() + "=" + v;
        }
        if (v instanceof String && !((String) v).isEmpty()) {
            return property.getName() + "=" + elide((String) v);
        }
        return null;
    }

    private String label(String identifier, String fallback) {
        if (settings.isRenderIdentifiers() && identifier != null) {
            return identifier;
        }
        return fallback;
    }

    /**
     * Inline data URLs are reduced to their header ({@code data:image/png;base64,...});
     * other values longer than the configured maximum are cut and suffixed with {@code ...}.
     */
    String elide(String value) {
        int max = settings.getMaxValueLength();
        if (value.startsWith(DATA_URL_PREFIX)) {
            int comma = value.indexOf(',');
            int end = comma < 0 ? value.length() : comma + 1;
            if (end < value.length() || end > max) {
                return value.substring(0, Math.min(end, max)) + ELLIPSIS;
            }
            return value;
        }
        if (value.length() > max) {
            return value.substring(0, max) + ELLIPSIS;
        }
        return value;
    }
}
