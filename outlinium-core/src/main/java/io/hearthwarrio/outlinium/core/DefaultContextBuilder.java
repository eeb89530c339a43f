package io.hearthwarrio.outlinium.core;

import io.hearthwarrio.outlinium.core.ax.AccessibilityDecoder;
import io.hearthwarrio.outlinium.core.ax.AccessibilityNode;
import io.hearthwarrio.outlinium.core.dom.DomDocument;
import io.hearthwarrio.outlinium.core.dom.DomNode;
import io.hearthwarrio.outlinium.core.dom.ElementNode;
import io.hearthwarrio.outlinium.core.dom.SnapshotDecoder;
import io.hearthwarrio.outlinium.core.filter.DomSemantics;
import io.hearthwarrio.outlinium.core.filter.FilterPipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default {@link ContextBuilder}.
 * <p>
 * Stateless: every build decodes fresh trees and returns a new {@link PageContext}, so one instance can be shared.
 */
public final class DefaultContextBuilder implements ContextBuilder {

    private final OutlineSettings settings;
    private final SnapshotDecoder snapshotDecoder = new SnapshotDecoder();
    private final AccessibilityDecoder accessibilityDecoder = new AccessibilityDecoder();
    private final IdAssigner idAssigner = new IdAssigner();
    private final OutlineSerializer serializer;
    private final DomSemantics semantics;
    private final FilterPipeline<DomNode> domPipeline;
    private final FilterPipeline<AccessibilityNode> accessibilityPipeline;

    public DefaultContextBuilder() {
        this(OutlineSettings.defaults());
    }

    public DefaultContextBuilder(OutlineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.serializer = new OutlineSerializer(settings);
        this.semantics = new DomSemantics(settings);
        this.domPipeline = FilterPipeline.forDom(settings);
        this.accessibilityPipeline = FilterPipeline.forAccessibility();
    }

    public OutlineSettings getSettings() {
        return settings;
    }

    @Override
    public PageContext build(SnapshotSource source, SnapshotMode mode) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        DomDocument document = snapshotDecoder.decode(source.getDomSnapshot());
        return switch (mode) {
            case DOM -> buildDom(document);
            case ACCESSIBILITY -> buildAccessibility(document, source.getAccessibilityTree());
        };
    }

    private PageContext buildDom(DomDocument document) {
        DomNode filtered = domPipeline.apply(document.getRoot());
        if (filtered.getChildren().isEmpty()) {
            return PageContext.empty(SnapshotMode.DOM);
        }
        IdAssignment assignment = idAssigner.assign(filtered, document);
        return new PageContext(
                serializer.serialize(filtered, assignment),
                SnapshotMode.DOM,
                assignment.getIdentifierMap(),
                interactiveIdentifiers(assignment.getIdentifierMap()),
                false
        );
    }

    private PageContext buildAccessibility(DomDocument document, Map<String, Object> rawTree) {
        AccessibilityNode root = accessibilityDecoder.decode(rawTree).getRoot();
        AccessibilityNode filtered = accessibilityPipeline.apply(root);
        if (filtered.getChildren().isEmpty()) {
            return PageContext.empty(SnapshotMode.ACCESSIBILITY);
        }
        IdAssignment assignment = idAssigner.assign(filtered, document);
        return new PageContext(
                serializer.serialize(filtered, assignment),
                SnapshotMode.ACCESSIBILITY,
                assignment.getIdentifierMap(),
                interactiveIdentifiers(assignment.getIdentifierMap()),
                false
        );
    }

    private List<String> interactiveIdentifiers(IdentifierMap identifierMap) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, ElementNode> e : identifierMap.asMap().entrySet()) {
            if (semantics.isInteractive(e.getValue())) {
                out.add(e.getKey());
            }
        }
        return out;
    }
}
