package io.hearthwarrio.outlinium.core;

import io.hearthwarrio.outlinium.core.dom.ElementNode;

import java.util.List;
import java.util.Objects;

/**
 * Result of one build: the outline text, the identifiers it mentions and how to resolve them.
 * <p>
 * A context is valid only for the page state it was built from. A new build replaces it as a whole.
 */
public final class PageContext {

    /**
     * Outline text used when nothing survives filtering.
     */
    public static final String EMPTY_PAGE_DIAGNOSTIC = String.join("\n",
            "ERROR: No visible interactive elements found on this page.",
            "",
            "Possible causes:",
            "- The page is still loading",
            "- The page has no interactive elements",
            "- All elements were filtered out"
    );

    private final String text;
    private final SnapshotMode mode;
    private final IdentifierMap identifierMap;
    private final List<String> interactiveIdentifiers;
    private final boolean empty;
    private final LocatorResolver resolver;

    PageContext(
            String text,
            SnapshotMode mode,
            IdentifierMap identifierMap,
            List<String> interactiveIdentifiers,
            boolean empty
    ) {
        this.text = text == null ? "" : text;
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.identifierMap = identifierMap == null ? IdentifierMap.empty() : identifierMap;
        this.interactiveIdentifiers = interactiveIdentifiers == null ? List.of() : List.copyOf(interactiveIdentifiers);
        this.empty = empty;
        this.resolver = new LocatorResolver(this.identifierMap);
    }

    static PageContext empty(SnapshotMode mode) {
        return new PageContext(EMPTY_PAGE_DIAGNOSTIC, mode, IdentifierMap.empty(), List.of(), true);
    }

    public String getText() {
        return text;
    }

    public SnapshotMode getMode() {
        return mode;
    }

    public IdentifierMap getIdentifierMap() {
        return identifierMap;
    }

    /**
     * Whether nothing survived filtering; {@link #getText()} is then {@link #EMPTY_PAGE_DIAGNOSTIC}.
     */
    public boolean isEmpty() {
        return empty;
    }

    /**
     * @return identifiers whose element is interactive, in outline order
     */
    public List<String> interactiveIdentifiers() {
        return interactiveIdentifiers;
    }

    /**
     * @return absolute XPath of the element behind {@code identifier}
     * @throws IdentifierNotFoundException when the identifier is not part of this context
     */
    public String resolve(String identifier) {
        return resolver.resolve(identifier);
    }

    /**
     * @return original element behind {@code identifier}
     * @throws IdentifierNotFoundException when the identifier is not part of this context
     */
    public ElementNode element(String identifier) {
        resolver.resolve(identifier);
        return identifierMap.get(identifier);
    }

    @Override
    public String toString() {
        return "PageContext{" +
                "mode=" + mode +
                ", identifiers=" + identifierMap.size() +
                ", empty=" + empty +
                '}';
    }
}
