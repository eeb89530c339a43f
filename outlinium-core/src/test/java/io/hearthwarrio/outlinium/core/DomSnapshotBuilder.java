package io.hearthwarrio.outlinium.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@code DOMSnapshot.captureSnapshot}-shaped maps for tests.
 * <p>
 * Elements are rendered (listed in layout) unless added with {@link #unrenderedElement(int, String, String...)}.
 * Backend node ids are {@code index + BACKEND_OFFSET}.
 */
public final class DomSnapshotBuilder {

    public static final int BACKEND_OFFSET = 100;

    private final List<String> strings = new ArrayList<>();
    private final List<Object> nodeType = new ArrayList<>();
    private final List<Object> nodeName = new ArrayList<>();
    private final List<Object> nodeValue = new ArrayList<>();
    private final List<Object> parentIndex = new ArrayList<>();
    private final List<Object> attributes = new ArrayList<>();
    private final List<Object> backendNodeId = new ArrayList<>();

    private final List<Object> layoutNodeIndex = new ArrayList<>();
    private final List<Object> layoutBounds = new ArrayList<>();
    private final List<Object> layoutStyles = new ArrayList<>();

    /**
     * Adds a rendered element.
     *
     * @param parent parent index, or -1 for the root
     * @param tag    tag as the browser reports it (usually upper case)
     * @param attrs  name/value pairs
     * @return node index
     */
    public int element(int parent, String tag, String... attrs) {
        int index = unrenderedElement(parent, tag, attrs);
        layoutNodeIndex.add(index);
        layoutBounds.add(List.of(0.0, 0.0, 100.0, 20.0));
        layoutStyles.add(List.of(string("block"), string("visible"), string("1")));
        return index;
    }

    public int unrenderedElement(int parent, String tag, String... attrs) {
        if (attrs.length % 2 != 0) {
            throw new IllegalArgumentException("attrs must be name/value pairs: " + Arrays.toString(attrs));
        }
        int index = nodeType.size();
        nodeType.add(1);
        nodeName.add(string(tag));
        nodeValue.add(-1);
        parentIndex.add(parent);
        List<Object> encoded = new ArrayList<>();
        for (String a : attrs) {
            encoded.add(string(a));
        }
        attributes.add(encoded);
        backendNodeId.add(index + BACKEND_OFFSET);
        return index;
    }

    public int text(int parent, String content) {
        int index = nodeType.size();
        nodeType.add(3);
        nodeName.add(string("#text"));
        nodeValue.add(string(content));
        parentIndex.add(parent);
        attributes.add(List.of());
        backendNodeId.add(index + BACKEND_OFFSET);
        return index;
    }

    public int string(String s) {
        int i = strings.indexOf(s);
        if (i >= 0) {
            return i;
        }
        strings.add(s);
        return strings.size() - 1;
    }

    public Map<String, Object> build() {
        Map<String, Object> nodes = new LinkedHashMap<>();
        nodes.put("nodeType", new ArrayList<>(nodeType));
        nodes.put("nodeName", new ArrayList<>(nodeName));
        nodes.put("nodeValue", new ArrayList<>(nodeValue));
        nodes.put("parentIndex", new ArrayList<>(parentIndex));
        nodes.put("attributes", new ArrayList<>(attributes));
        nodes.put("backendNodeId", new ArrayList<>(backendNodeId));

        Map<String, Object> layout = new LinkedHashMap<>();
        layout.put("nodeIndex", new ArrayList<>(layoutNodeIndex));
        layout.put("bounds", new ArrayList<>(layoutBounds));
        layout.put("styles", new ArrayList<>(layoutStyles));

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("nodes", nodes);
        document.put("layout", layout);

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("documents", List.of(document));
        snapshot.put("strings", new ArrayList<>(strings));
        return snapshot;
    }

    public static int backendIdOf(int index) {
        return index + BACKEND_OFFSET;
    }
}
