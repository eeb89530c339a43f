package io.hearthwarrio.outlinium.core.filter;

import io.hearthwarrio.outlinium.core.OutlineSettings;
import io.hearthwarrio.outlinium.core.dom.DomNode;
import io.hearthwarrio.outlinium.core.dom.ElementNode;
import io.hearthwarrio.outlinium.core.dom.TextNode;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Knowledge about which DOM elements matter to a reader of the outline.
 */
public final class DomSemantics {

    private static final Set<String> CODE_TAGS = Set.of("script", "style");
    private static final Set<String> PRESENTATIONAL_ROLES = Set.of("presentation", "none");
    private static final Set<String> KEEP_UNRENDERED_INPUT_TYPES = Set.of("file", "hidden");

    private final OutlineSettings settings;

    public DomSemantics(OutlineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public boolean isSemanticAttribute(String name) {
        return settings.getKeptAttributes().contains(name);
    }

    /**
     * Attributes {@link #isInteractive} reads. Pruning keeps them even when they are not in the kept set.
     */
    public boolean isInteractivityAttribute(String name) {
        return "role".equals(name) || settings.getInteractiveAttributes().contains(name);
    }

    /**
     * Interactive = interactive tag, OR interactive {@code role}, OR one of the interactivity attributes.
     */
    public boolean isInteractive(ElementNode element) {
        if (settings.getInteractiveTags().contains(element.getTag())) {
            return true;
        }
        String role = element.getAttribute("role");
        if (!role.isEmpty() && settings.getInteractiveRoles().contains(role)) {
            return true;
        }
        for (String attribute : settings.getInteractiveAttributes()) {
            if (element.hasAttribute(attribute)) {
                return true;
            }
        }
        return false;
    }

    public boolean isPresentational(ElementNode element) {
        return PRESENTATIONAL_ROLES.contains(element.getAttribute("role").trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Text is always semantic. Elements are semantic when they carry a kept attribute or are interactive,
     * unless they are {@code script}/{@code style} or explicitly presentational.
     */
    public boolean hasSemanticValue(DomNode node) {
        if (node instanceof TextNode) {
            return !((TextNode) node).getContent().isEmpty();
        }
        ElementNode element = (ElementNode) node;
        if (CODE_TAGS.contains(element.getTag())) {
            return false;
        }
        if (isPresentational(element)) {
            return false;
        }
        for (String name : element.getAttributes().keySet()) {
            if (isSemanticAttribute(name)) {
                return true;
            }
        }
        return isInteractive(element);
    }

    /**
     * Elements the browser did not lay out, except file and hidden inputs which are unrendered on purpose.
     * Text is never considered unrendered.
     */
    public boolean isDiscardedAsUnrendered(DomNode node) {
        if (!(node instanceof ElementNode)) {
            return false;
        }
        ElementNode element = (ElementNode) node;
        if (element.isRendered()) {
            return false;
        }
        if ("input".equals(element.getTag())) {
            String type = element.getAttribute("type").toLowerCase(Locale.ROOT);
            return !KEEP_UNRENDERED_INPUT_TYPES.contains(type);
        }
        return true;
    }

    /**
     * Wrapper: no attributes, exactly one child which is an element, and not interactive.
     */
    public boolean isCollapsibleWrapper(DomNode node) {
        if (!(node instanceof ElementNode)) {
            return false;
        }
        ElementNode element = (ElementNode) node;
        if (!element.getAttributes().isEmpty() || isInteractive(element)) {
            return false;
        }
        int elements = 0;
        for (DomNode child : element.getChildren()) {
            if (child instanceof TextNode) {
                if (!((TextNode) child).getContent().isEmpty()) {
                    return false;
                }
            } else {
                elements++;
            }
        }
        return elements == 1;
    }
}
