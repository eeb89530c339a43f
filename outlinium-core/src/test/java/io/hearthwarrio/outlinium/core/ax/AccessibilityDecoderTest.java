package io.hearthwarrio.outlinium.core.ax;

import io.hearthwarrio.outlinium.core.AxTreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AccessibilityDecoderTest {

    private final AccessibilityDecoder decoder = new AccessibilityDecoder();

    @Test
    void linksChildrenThroughChildIds() {
        AxTreeBuilder ax = new AxTreeBuilder();
        ax.node("1", null, "RootWebArea", "Shop").backend(100);
        ax.node("2", "1", "button", "Buy").backend(105)
                .description("Adds to cart")
                .property("focusable", "booleanOrUndefined", true)
                .property("level", "integer", 2);
        ax.node("3", "1", "link", "Home").backend(106);

        AccessibilityTree tree = decoder.decode(ax.build());

        AccessibilityNode root = tree.getRoot();
        assertEquals("RootWebArea", root.getRoleName());
        assertEquals("Shop", root.getName().asText());
        assertEquals(2, root.getChildren().size());

        AccessibilityNode button = root.getChildren().get(0);
        assertEquals("2", button.getNodeId());
        assertEquals("button", button.getRoleName());
        assertEquals("role", button.getRole().getType());
        assertEquals("Adds to cart", button.getDescription().asText());
        assertEquals(105, button.getBackendNodeId());
        assertEquals("F1", button.getFrameId());
        assertSame(root, button.getParent());
        assertEquals(List.of(
                new AxProperty("focusable", AxValue.of("booleanOrUndefined", true)),
                new AxProperty("level", AxValue.of("integer", 2))
        ), button.getProperties());

        assertEquals("link", root.getChildren().get(1).getRoleName());
        assertSame(button, tree.nodeAt(1));
    }

    @Test
    void missingRoleBecomesUnknownAndIgnoredIsKept() {
        AxTreeBuilder ax = new AxTreeBuilder();
        ax.node("1", null, "RootWebArea", "");
        ax.node("2", "1", null, null).ignored();

        AccessibilityNode child = decoder.decode(ax.build()).getRoot().getChildren().get(0);

        assertEquals("unknown", child.getRoleName());
        assertTrue(child.isIgnored());
        assertEquals(1, child.getIgnoredReasons().size());
        assertTrue(child.getName().isEmpty());
        assertNull(child.getValue());
        assertNull(child.getChromeRole());
    }

    @Test
    void rootIsFirstNodeWithUnknownParent() {
        AxTreeBuilder ax = new AxTreeBuilder();
        ax.node("5", "1", "button", "Child");
        ax.node("1", "missing", "RootWebArea", "Page");

        AccessibilityNode root = decoder.decode(ax.build()).getRoot();

        assertEquals("1", root.getNodeId());
        assertEquals("5", root.getChildren().get(0).getNodeId());
    }

    @Test
    void emptyTreeYieldsPlaceholderRoot() {
        for (Map<String, Object> raw : List.<Map<String, Object>>of(Map.of(), Map.of("nodes", List.of()))) {
            AccessibilityNode root = decoder.decode(raw).getRoot();
            assertEquals("RootWebArea", root.getRoleName());
            assertEquals(AccessibilityTree.PLACEHOLDER_INDEX, root.getIndex());
            assertTrue(root.getChildren().isEmpty());
        }
    }

    @Test
    void repeatedChildIdsAreLinkedOnce() {
        Map<String, Object> raw = Map.of("nodes", List.of(
                Map.of("nodeId", "1", "role", Map.of("type", "role", "value", "RootWebArea"),
                        "childIds", List.of("2", "2", "1")),
                Map.of("nodeId", "2", "parentId", "1", "role", Map.of("type", "role", "value", "button"))
        ));

        AccessibilityNode root = decoder.decode(raw).getRoot();

        assertEquals(1, root.getChildren().size());
    }

    @Test
    void malformedRecordsNeverThrow() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("name", "focusable");
        properties.put("value", null);
        Map<String, Object> raw = Map.of("nodes", Arrays.asList(
                "notamap",
                null,
                Map.of("nodeId", 1, "role", "RootWebArea", "childIds", List.of(2, 3), "backendDOMNodeId", Long.MAX_VALUE),
                Map.of("nodeId", 2, "parentId", 1, "role", Map.of("type", "role", "value", "button"),
                        "name", "Buy", "childIds", "nope",
                        "properties", Arrays.asList(properties, "x", Map.of("value", Map.of()))),
                Map.of("nodeId", 3, "parentId", 1, "ignored", "yes", "ignoredReasons", 7, "properties", "bad")
        ));

        AccessibilityTree tree = decoder.decode(raw);

        AccessibilityNode root = tree.getRoot();
        assertEquals("1", root.getNodeId());
        assertEquals(2, root.getIndex());
        assertEquals("unknown", root.getRoleName());
        assertNull(root.getBackendNodeId());
        assertEquals(2, root.getChildren().size());

        AccessibilityNode button = root.getChildren().get(0);
        assertEquals("button", button.getRoleName());
        assertTrue(button.getName().isEmpty());
        assertTrue(button.getChildren().isEmpty());
        assertEquals(List.of(new AxProperty("focusable", null)), button.getProperties());

        AccessibilityNode third = root.getChildren().get(1);
        assertFalse(third.isIgnored());
        assertTrue(third.getIgnoredReasons().isEmpty());
        assertTrue(third.getProperties().isEmpty());
        assertEquals(3, tree.size());
    }

    @Test
    void nonMapInputYieldsPlaceholderRoot() {
        assertEquals(AccessibilityTree.PLACEHOLDER_INDEX, decoder.decode(null).getRoot().getIndex());
        assertEquals(AccessibilityTree.PLACEHOLDER_INDEX,
                decoder.decode(Map.of("nodes", "nope")).getRoot().getIndex());
        assertEquals(AccessibilityTree.PLACEHOLDER_INDEX,
                decoder.decode(Map.of("nodes", List.of("a", 1))).getRoot().getIndex());
    }
}
