package io.hearthwarrio.outlinium.core.ax;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.hearthwarrio.outlinium.core.ProtocolValues.flag;
import static io.hearthwarrio.outlinium.core.ProtocolValues.integer;
import static io.hearthwarrio.outlinium.core.ProtocolValues.list;
import static io.hearthwarrio.outlinium.core.ProtocolValues.map;
import static io.hearthwarrio.outlinium.core.ProtocolValues.text;

/**
 * Decodes an {@code Accessibility.getFullAXTree} result into an {@link AccessibilityTree}.
 * <p>
 * Nodes are linked through their {@code childIds}. The root is the first node whose {@code parentId} is absent or
 * unknown. Entries that are not records are skipped. Decoding never throws.
 */
public final class AccessibilityDecoder {

    public AccessibilityTree decode(Map<?, ?> tree) {
        List<?> rawNodes = list(map(tree), "nodes");

        Map<String, Pending> byId = new LinkedHashMap<>();
        List<Pending> all = new ArrayList<>();
        for (int i = 0; i < rawNodes.size(); i++) {
            if (!(rawNodes.get(i) instanceof Map)) {
                continue;
            }
            Pending p = new Pending(i, map(rawNodes.get(i)));
            all.add(p);
            byId.putIfAbsent(p.nodeId, p);
        }
        if (all.isEmpty()) {
            return AccessibilityTree.placeholder();
        }

        Pending root = null;
        for (Pending p : all) {
            Object parentId = p.raw.get("parentId");
            if (parentId == null || !byId.containsKey(text(parentId))) {
                root = p;
                break;
            }
        }
        if (root == null) {
            root = all.get(0);
        }

        return new AccessibilityTree(build(root, byId, new HashSet<>()));
    }

    private static AccessibilityNode build(Pending p, Map<String, Pending> byId, Set<Integer> visited) {
        visited.add(p.index);

        List<AccessibilityNode> children = new ArrayList<>();
        for (Object childId : list(p.raw, "childIds")) {
            Pending child = byId.get(text(childId));
            if (child != null && !visited.contains(child.index)) {
                children.add(build(child, byId, visited));
            }
        }

        AxValue role = value(p.raw.get("role"));
        if (role == null || role.isEmpty()) {
            role = AxValue.of("role", "unknown");
        }

        return new AccessibilityNode(
                p.index,
                p.nodeId,
                integer(p.raw.get("backendDOMNodeId")),
                flag(p.raw.get("ignored")),
                new ArrayList<>(list(p.raw, "ignoredReasons")),
                role,
                value(p.raw.get("chromeRole")),
                value(p.raw.get("name")),
                value(p.raw.get("description")),
                value(p.raw.get("value")),
                properties(list(p.raw, "properties")),
                text(p.raw.get("frameId")),
                children
        );
    }

    private static AxValue value(Object raw) {
        if (!(raw instanceof Map)) {
            return null;
        }
        Map<?, ?> m = (Map<?, ?>) raw;
        return new AxValue(text(m.get("type")), m.get("value"), new ArrayList<>(list(m, "sources")));
    }

    private static List<AxProperty> properties(List<?> raw) {
        List<AxProperty> out = new ArrayList<>();
        for (Object o : raw) {
            Map<?, ?> m = map(o);
            String name = text(m.get("name"));
            if (name.isEmpty()) {
                continue;
            }
            out.add(new AxProperty(name, value(m.get("value"))));
        }
        return out;
    }

    private static final class Pending {
        private final int index;
        private final String nodeId;
        private final Map<?, ?> raw;

        private Pending(int index, Map<?, ?> raw) {
            this.index = index;
            this.nodeId = text(raw.get("nodeId"));
            this.raw = raw;
        }
    }
}
