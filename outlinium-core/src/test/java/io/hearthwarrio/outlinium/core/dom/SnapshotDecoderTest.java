package io.hearthwarrio.outlinium.core.dom;

import io.hearthwarrio.outlinium.core.DomSnapshotBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SnapshotDecoderTest {

    private final SnapshotDecoder decoder = new SnapshotDecoder();

    @Test
    void decodesElementsAttributesAndText() {
        DomSnapshotBuilder b = new DomSnapshotBuilder();
        int html = b.element(-1, "HTML");
        int body = b.element(html, "BODY");
        int button = b.element(body, "BUTTON", "type", "submit", "class", "btn");
        b.text(button, "  Login \n");
        b.text(body, "   ");

        DomDocument doc = decoder.decode(b.build());

        ElementNode root = doc.getRoot();
        assertEquals("html", root.getTag());
        assertNull(root.getParent());
        ElementNode bodyNode = root.getElementChildren().get(0);
        assertEquals("body", bodyNode.getTag());
        assertEquals(1, bodyNode.getChildren().size());

        ElementNode buttonNode = bodyNode.getElementChildren().get(0);
        assertEquals(button, buttonNode.getIndex());
        assertEquals(List.of("type", "class"), new ArrayList<>(buttonNode.getAttributes().keySet()));
        assertEquals("submit", buttonNode.getAttribute("type"));
        assertEquals("", buttonNode.getAttribute("missing"));
        assertEquals("Login", buttonNode.getText());
        assertSame(bodyNode, buttonNode.getParent());
        assertEquals(DomSnapshotBuilder.backendIdOf(button), buttonNode.getBackendNodeId());
    }

    @Test
    void layoutPresenceMarksRenderedElements() {
        DomSnapshotBuilder b = new DomSnapshotBuilder();
        int html = b.element(-1, "HTML");
        int shown = b.element(html, "DIV");
        int hidden = b.unrenderedElement(html, "DIV");

        DomDocument doc = decoder.decode(b.build());

        ElementNode shownNode = doc.elementAt(shown);
        assertTrue(shownNode.isRendered());
        assertEquals(new BoundingBox(0, 0, 100, 20), shownNode.getBounds());
        assertEquals("block", shownNode.getStyles().get("display"));
        assertEquals("visible", shownNode.getStyles().get("visibility"));
        assertEquals("1", shownNode.getStyles().get("opacity"));

        ElementNode hiddenNode = doc.elementAt(hidden);
        assertFalse(hiddenNode.isRendered());
        assertNull(hiddenNode.getBounds());
        assertTrue(hiddenNode.getStyles().isEmpty());
    }

    @Test
    void childrenFollowSnapshotOrderEvenWhenListedBeforeParent() {
        Map<String, Object> nodes = new HashMap<>();
        nodes.put("nodeType", List.of(1, 1, 1, 1));
        nodes.put("nodeName", List.of(0, 1, 2, 3));
        nodes.put("parentIndex", List.of(3, 3, -1, 2));
        nodes.put("attributes", List.of(List.of(), List.of(), List.of(), List.of()));
        Map<String, Object> snapshot = Map.of(
                "documents", List.of(Map.of("nodes", nodes)),
                "strings", List.of("A", "B", "HTML", "BODY")
        );

        DomDocument doc = decoder.decode(snapshot);

        assertEquals("html", doc.getRoot().getTag());
        ElementNode body = doc.getRoot().getElementChildren().get(0);
        assertEquals("body", body.getTag());
        assertEquals("a", body.getElementChildren().get(0).getTag());
        assertEquals("b", body.getElementChildren().get(1).getTag());
    }

    @Test
    void malformedStringReferencesResolveToEmpty() {
        Map<String, Object> nodes = new HashMap<>();
        nodes.put("nodeType", List.of(1, 1, 1));
        nodes.put("nodeName", List.of(0, 99, "x"));
        nodes.put("parentIndex", List.of(-1, 0, 0));
        nodes.put("attributes", List.of(List.of(1, 2.0, 1, 42), List.of(), List.of()));
        Map<String, Object> snapshot = Map.of(
                "documents", List.of(Map.of("nodes", nodes)),
                "strings", List.of("DIV", "title")
        );

        DomDocument doc = decoder.decode(snapshot);

        ElementNode root = doc.getRoot();
        assertEquals("", root.getAttribute("title"));
        assertTrue(root.hasAttribute("title"));
        assertEquals("", root.getElementChildren().get(0).getTag());
        assertEquals("unknown", root.getElementChildren().get(1).getTag());
    }

    @Test
    void missingNameIndexGivesUnknownTag() {
        Map<String, Object> nodes = new HashMap<>();
        nodes.put("nodeType", List.of(1));
        nodes.put("parentIndex", List.of(-1));
        Map<String, Object> snapshot = Map.of("documents", List.of(Map.of("nodes", nodes)), "strings", List.of());

        assertEquals("unknown", decoder.decode(snapshot).getRoot().getTag());
    }

    @Test
    void emptySnapshotsYieldPlaceholderRoot() {
        DomDocument noDocuments = decoder.decode(Map.of("documents", List.of(), "strings", List.of()));
        assertEquals("html", noDocuments.getRoot().getTag());
        assertEquals(DomDocument.PLACEHOLDER_INDEX, noDocuments.getRoot().getIndex());
        assertTrue(noDocuments.getRoot().getChildren().isEmpty());

        assertEquals("html", decoder.decode(Map.of()).getRoot().getTag());
        assertEquals("html", decoder.decode(null).getRoot().getTag());

        Map<String, Object> textOnly = Map.of(
                "documents", List.of(Map.of("nodes", Map.of(
                        "nodeType", List.of(3),
                        "nodeValue", List.of(0),
                        "parentIndex", List.of(-1)))),
                "strings", List.of("orphan text"));
        assertEquals(DomDocument.PLACEHOLDER_INDEX, decoder.decode(textOnly).getRoot().getIndex());
    }

    @Test
    void cyclicParentsFallBackToFirstElement() {
        Map<String, Object> nodes = new HashMap<>();
        nodes.put("nodeType", List.of(1, 1));
        nodes.put("nodeName", List.of(0, 1));
        nodes.put("parentIndex", List.of(1, 0));
        Map<String, Object> snapshot = Map.of(
                "documents", List.of(Map.of("nodes", nodes)),
                "strings", List.of("DIV", "SPAN"));

        DomDocument doc = decoder.decode(snapshot);

        assertEquals("div", doc.getRoot().getTag());
        assertEquals("span", doc.getRoot().getElementChildren().get(0).getTag());
        assertTrue(doc.getRoot().getElementChildren().get(0).getChildren().isEmpty());
    }

    @Test
    void documentLooksUpOriginalsByIndexAndBackendId() {
        DomSnapshotBuilder b = new DomSnapshotBuilder();
        int html = b.element(-1, "HTML");
        int input = b.element(html, "INPUT", "name", "q");

        DomDocument doc = decoder.decode(b.build());

        assertSame(doc.elementAt(input), doc.elementByBackendNodeId(DomSnapshotBuilder.backendIdOf(input)));
        assertNull(doc.elementAt(999));
        assertNull(doc.elementByBackendNodeId(null));
        assertEquals(2, doc.size());
    }

    @Test
    void malformedRecordsNeverThrow() {
        Map<String, Object> nodes = new HashMap<>();
        nodes.put("nodeType", Arrays.asList("1", 1, 1, 3, null));
        nodes.put("nodeName", Arrays.asList(0, 0, 1, null, 0));
        nodes.put("nodeValue", Arrays.asList(null, null, null, 2, null));
        nodes.put("parentIndex", Arrays.asList(-1, -1, 1, 2, "x"));
        nodes.put("attributes", Arrays.asList(null, "bad", List.of("x", 3), null));
        nodes.put("backendNodeId", Arrays.asList(null, 7, Long.MAX_VALUE));
        Map<String, Object> snapshot = Map.of(
                "documents", List.of(Map.of("nodes", nodes, "layout", "nope")),
                "strings", List.of("HTML", "BUTTON", "x"));

        DomDocument doc = decoder.decode(snapshot);

        ElementNode root = doc.getRoot();
        assertEquals(1, root.getIndex());
        assertEquals("html", root.getTag());
        assertTrue(root.getAttributes().isEmpty());
        assertEquals(7, root.getBackendNodeId());
        assertFalse(root.isRendered());

        ElementNode button = root.getElementChildren().get(0);
        assertEquals("button", button.getTag());
        assertTrue(button.getAttributes().isEmpty());
        assertNull(button.getBackendNodeId());
        assertEquals("x", button.getText());

        assertNull(doc.elementAt(0));
        assertEquals(2, doc.size());
    }

    @Test
    void wrongContainerTypesYieldPlaceholderRoot() {
        assertEquals(DomDocument.PLACEHOLDER_INDEX,
                decoder.decode(Map.of("documents", "bad")).getRoot().getIndex());
        assertEquals(DomDocument.PLACEHOLDER_INDEX,
                decoder.decode(Map.of("documents", List.of("not a document"))).getRoot().getIndex());
        assertEquals(DomDocument.PLACEHOLDER_INDEX,
                decoder.decode(Map.of("documents", List.of(Map.of("nodes", "bad")))).getRoot().getIndex());
    }
}
