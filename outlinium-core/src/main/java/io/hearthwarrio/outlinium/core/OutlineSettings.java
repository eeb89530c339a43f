package io.hearthwarrio.outlinium.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable policy for filtering and rendering outlines.
 * <p>
 * Start from {@link #defaults()} and derive variants with the {@code withX(...)} methods.
 */
public final class OutlineSettings {

    /**
     * Attributes kept by the DOM semantic filter; every other attribute is dropped.
     */
    public static final Set<String> DEFAULT_KEPT_ATTRIBUTES = Set.of(
            "role",
            "aria-label",
            "aria-labelledby",
            "aria-describedby",
            "aria-checked",
            "aria-selected",
            "aria-expanded",
            "aria-hidden",
            "aria-disabled",
            "aria-haspopup",
            "type",
            "name",
            "placeholder",
            "value",
            "accept",
            "alt",
            "title",
            "disabled",
            "checked",
            "selected",
            "tabindex",
            "onclick",
            "href"
    );

    public static final Set<String> DEFAULT_INTERACTIVE_TAGS = Set.of(
            "a", "button", "input", "select", "textarea", "label"
    );

    public static final Set<String> DEFAULT_INTERACTIVE_ROLES = Set.of(
            "button",
            "link",
            "checkbox",
            "radio",
            "switch",
            "tab",
            "menuitem",
            "menuitemcheckbox",
            "menuitemradio",
            "option",
            "textbox",
            "searchbox",
            "combobox",
            "slider",
            "spinbutton"
    );

    /**
     * Attributes whose mere presence makes an element interactive.
     */
    public static final Set<String> DEFAULT_INTERACTIVE_ATTRIBUTES = Set.of(
            "tabindex", "aria-haspopup", "onclick"
    );

    public static final int DEFAULT_MAX_VALUE_LENGTH = 200;

    private static final OutlineSettings DEFAULTS = new OutlineSettings(
            DEFAULT_KEPT_ATTRIBUTES,
            DEFAULT_INTERACTIVE_TAGS,
            DEFAULT_INTERACTIVE_ROLES,
            DEFAULT_INTERACTIVE_ATTRIBUTES,
            DEFAULT_MAX_VALUE_LENGTH,
            true
    );

    private final Set<String> keptAttributes;
    private final Set<String> interactiveTags;
    private final Set<String> interactiveRoles;
    private final Set<String> interactiveAttributes;
    private final int maxValueLength;
    private final boolean renderIdentifiers;

    private OutlineSettings(
            Set<String> keptAttributes,
            Set<String> interactiveTags,
            Set<String> interactiveRoles,
            Set<String> interactiveAttributes,
            int maxValueLength,
            boolean renderIdentifiers
    ) {
        this.keptAttributes = keptAttributes;
        this.interactiveTags = interactiveTags;
        this.interactiveRoles = interactiveRoles;
        this.interactiveAttributes = interactiveAttributes;
        this.maxValueLength = maxValueLength;
        this.renderIdentifiers = renderIdentifiers;
    }

    public static OutlineSettings defaults() {
        return DEFAULTS;
    }

    public Set<String> getKeptAttributes() {
        return keptAttributes;
    }

    public Set<String> getInteractiveTags() {
        return interactiveTags;
    }

    public Set<String> getInteractiveRoles() {
        return interactiveRoles;
    }

    public Set<String> getInteractiveAttributes() {
        return interactiveAttributes;
    }

    /**
     * Values longer than this are cut when rendered.
     */
    public int getMaxValueLength() {
        return maxValueLength;
    }

    /**
     * Whether outline lines start with identifiers ({@code button-0}) or with the plain tag/role.
     */
    public boolean isRenderIdentifiers() {
        return renderIdentifiers;
    }

    /**
     * Replaces the attributes kept in the outline. {@code role} and the interactive attributes survive pruning
     * regardless, since interactivity is decided on them.
     */
    public OutlineSettings withKeptAttributes(Collection<String> attributes) {
        return new OutlineSettings(copy(attributes, "attributes"), interactiveTags, interactiveRoles,
                interactiveAttributes, maxValueLength, renderIdentifiers);
    }

    public OutlineSettings withInteractiveTags(Collection<String> tags) {
        return new OutlineSettings(keptAttributes, copy(tags, "tags"), interactiveRoles,
                interactiveAttributes, maxValueLength, renderIdentifiers);
    }

    public OutlineSettings withInteractiveRoles(Collection<String> roles) {
        return new OutlineSettings(keptAttributes, interactiveTags, copy(roles, "roles"),
                interactiveAttributes, maxValueLength, renderIdentifiers);
    }

    public OutlineSettings withInteractiveAttributes(Collection<String> attributes) {
        return new OutlineSettings(keptAttributes, interactiveTags, interactiveRoles,
                copy(attributes, "attributes"), maxValueLength, renderIdentifiers);
    }

    public OutlineSettings withMaxValueLength(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("maxValueLength must be positive: " + length);
        }
        return new OutlineSettings(keptAttributes, interactiveTags, interactiveRoles,
                interactiveAttributes, length, renderIdentifiers);
    }

    public OutlineSettings withIdentifiers(boolean render) {
        return new OutlineSettings(keptAttributes, interactiveTags, interactiveRoles,
                interactiveAttributes, maxValueLength, render);
    }

    private static Set<String> copy(Collection<String> values, String name) {
        Objects.requireNonNull(values, name + " must not be null");
        Set<String> out = new LinkedHashSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                out.add(v);
            }
        }
        return Collections.unmodifiableSet(out);
    }

    @Override
    public String toString() {
        return "OutlineSettings{" +
                "keptAttributes=" + keptAttributes.size() +
                ", interactiveTags=" + interactiveTags +
                ", interactiveRoles=" + interactiveRoles.size() +
                ", interactiveAttributes=" + interactiveAttributes +
                ", maxValueLength=" + maxValueLength +
                ", renderIdentifiers=" + renderIdentifiers +
                '}';
    }
}
