package io.hearthwarrio.outlinium.core.dom;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import static io.hearthwarrio.outlinium.core.ProtocolValues.at;
import static io.hearthwarrio.outlinium.core.ProtocolValues.decimal;
import static io.hearthwarrio.outlinium.core.ProtocolValues.integer;
import static io.hearthwarrio.outlinium.core.ProtocolValues.integerAt;
import static io.hearthwarrio.outlinium.core.ProtocolValues.list;
import static io.hearthwarrio.outlinium.core.ProtocolValues.map;

/**
 * Decodes a {@code DOMSnapshot.captureSnapshot} result into a {@link DomDocument}.
 * <p>
 * The snapshot stores the first document's nodes as parallel arrays ({@code nodeType}, {@code nodeName},
 * {@code nodeValue}, {@code parentIndex}, {@code attributes}, {@code backendNodeId}) whose string values are indices
 * into the top-level {@code strings} table. Layout data ({@code nodeIndex}, {@code bounds}, {@code styles}) is
 * listed only for rendered nodes.
 * <p>
 * Decoding never throws: malformed or missing parts degrade to empty values, and a snapshot without any element
 * yields a placeholder {@code html} root.
 */
public final class SnapshotDecoder {

    /**
     * Computed styles requested from the browser, in the order the snapshot reports them.
     */
    public static final List<String> REQUESTED_STYLES = List.of("display", "visibility", "opacity");

    static final int ELEMENT_NODE = 1;
    static final int TEXT_NODE = 3;

    public DomDocument decode(Map<?, ?> snapshot) {
        List<?> documents = list(map(snapshot), "documents");
        if (documents.isEmpty()) {
            return DomDocument.placeholder();
        }

        List<?> strings = list(map(snapshot), "strings");
        Map<?, ?> document = map(documents.get(0));
        Map<?, ?> nodes = map(document, "nodes");

        Map<Integer, Layout> layout = decodeLayout(map(document, "layout"), strings);

        List<?> nodeTypes = list(nodes, "nodeType");
        List<?> nodeNames = list(nodes, "nodeName");
        List<?> nodeValues = list(nodes, "nodeValue");
        List<?> parents = list(nodes, "parentIndex");
        List<?> attributes = list(nodes, "attributes");
        List<?> backendIds = list(nodes, "backendNodeId");

        Map<Integer, PendingElement> elements = new TreeMap<>();
        for (int i = 0; i < nodeTypes.size(); i++) {
            Integer type = integerAt(nodeTypes, i);
            if (type == null || type != ELEMENT_NODE) {
                continue;
            }
            Integer nameIndex = integerAt(nodeNames, i);
            String tag = nameIndex == null ? "unknown" : resolve(strings, nameIndex).toLowerCase(Locale.ROOT);
            elements.put(i, new PendingElement(
                    i,
                    tag,
                    decodeAttributes(list(at(attributes, i)), strings),
                    layout.get(i),
                    integerAt(backendIds, i)
            ));
        }

        for (int i = 0; i < nodeTypes.size(); i++) {
            Integer type = integerAt(nodeTypes, i);
            if (type == null || type != TEXT_NODE) {
                continue;
            }
            PendingElement parent = parentOf(elements, parents, i);
            if (parent == null) {
                continue;
            }
            String content = resolve(strings, at(nodeValues, i)).trim();
            if (!content.isEmpty()) {
                parent.texts.put(i, content);
            }
        }

        PendingElement root = null;
        for (PendingElement element : elements.values()) {
            PendingElement parent = parentOf(elements, parents, element.index);
            if (parent != null && parent != element) {
                parent.childElements.add(element.index);
            } else if (root == null) {
                root = element;
            }
        }
        if (root == null && !elements.isEmpty()) {
            root = elements.values().iterator().next();
        }
        if (root == null) {
            return DomDocument.placeholder();
        }

        return new DomDocument(build(root, elements, new BitSet()));
    }

    private static PendingElement parentOf(Map<Integer, PendingElement> elements, List<?> parents, int index) {
        Integer parentIndex = integerAt(parents, index);
        if (parentIndex == null || parentIndex < 0) {
            return null;
        }
        return elements.get(parentIndex);
    }

    private static ElementNode build(PendingElement pending, Map<Integer, PendingElement> elements, BitSet visited) {
        visited.set(pending.index);

        Map<Integer, Object> ordered = new TreeMap<>(pending.texts);
        for (Integer childIndex : pending.childElements) {
            if (!visited.get(childIndex)) {
                ordered.put(childIndex, elements.get(childIndex));
            }
        }

        List<DomNode> children = new ArrayList<>(ordered.size());
        for (Map.Entry<Integer, Object> e : ordered.entrySet()) {
            Object v = e.getValue();
            if (v instanceof String) {
                children.add(new TextNode(e.getKey(), (String) v));
            } else if (!visited.get(e.getKey())) {
                children.add(build((PendingElement) v, elements, visited));
            }
        }

        Layout layout = pending.layout;
        return new ElementNode(
                pending.index,
                pending.tag,
                pending.attributes,
                layout == null ? null : layout.styles,
                layout == null ? null : layout.bounds,
                layout != null,
                pending.backendNodeId,
                children
        );
    }

    private static Map<Integer, Layout> decodeLayout(Map<?, ?> layout, List<?> strings) {
        List<?> nodeIndices = list(layout, "nodeIndex");
        List<?> bounds = list(layout, "bounds");
        List<?> styles = list(layout, "styles");

        Map<Integer, Layout> out = new LinkedHashMap<>();
        for (int i = 0; i < nodeIndices.size(); i++) {
            Integer nodeIndex = integerAt(nodeIndices, i);
            if (nodeIndex == null || out.containsKey(nodeIndex)) {
                continue;
            }
            out.put(nodeIndex, new Layout(
                    decodeBounds(list(at(bounds, i))),
                    decodeStyles(list(at(styles, i)), strings)
            ));
        }
        return out;
    }

    private static BoundingBox decodeBounds(List<?> raw) {
        if (raw.size() < 4) {
            return null;
        }
        Double x = decimal(raw.get(0));
        Double y = decimal(raw.get(1));
        Double w = decimal(raw.get(2));
        Double h = decimal(raw.get(3));
        if (x == null || y == null || w == null || h == null) {
            return null;
        }
        return new BoundingBox(x, y, w, h);
    }

    private static Map<String, String> decodeStyles(List<?> raw, List<?> strings) {
        Map<String, String> out = new LinkedHashMap<>();
        int n = Math.min(raw.size(), REQUESTED_STYLES.size());
        for (int i = 0; i < n; i++) {
            out.put(REQUESTED_STYLES.get(i), resolve(strings, raw.get(i)));
        }
        return out;
    }

    private static Map<String, String> decodeAttributes(List<?> raw, List<?> strings) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < raw.size(); i += 2) {
            String name = resolve(strings, raw.get(i));
            if (name.isEmpty()) {
                continue;
            }
            out.put(name, resolve(strings, raw.get(i + 1)));
        }
        return out;
    }

    /**
     * Resolves a string-table reference; anything but a valid integral index yields an empty string.
     */
    static String resolve(List<?> strings, Object reference) {
        Integer index = integer(reference);
        if (index == null) {
            return "";
        }
        Object v = at(strings, index);
        return v instanceof String ? (String) v : "";
    }

    private static final class PendingElement {
        private final int index;
        private final String tag;
        private final Map<String, String> attributes;
        private final Layout layout;
        private final Integer backendNodeId;
        private final Map<Integer, String> texts = new TreeMap<>();
        private final List<Integer> childElements = new ArrayList<>();

        private PendingElement(int index, String tag, Map<String, String> attributes, Layout layout,
                               Integer backendNodeId) {
            this.index = index;
            this.tag = tag;
            this.attributes = Collections.unmodifiableMap(attributes);
            this.layout = layout;
            this.backendNodeId = backendNodeId;
        }
    }

    private static final class Layout {
        private final BoundingBox bounds;
        private final Map<String, String> styles;

        private Layout(BoundingBox bounds, Map<String, String> styles) {
            this.bounds = bounds;
            this.styles = styles;
        }
    }
}
