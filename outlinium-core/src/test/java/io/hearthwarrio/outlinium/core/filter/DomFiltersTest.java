package io.hearthwarrio.outlinium.core.filter;

import io.hearthwarrio.outlinium.core.DomSnapshotBuilder;
import io.hearthwarrio.outlinium.core.OutlineSettings;
import io.hearthwarrio.outlinium.core.dom.DomDocument;
import io.hearthwarrio.outlinium.core.dom.DomNode;
import io.hearthwarrio.outlinium.core.dom.ElementNode;
import io.hearthwarrio.outlinium.core.dom.SnapshotDecoder;
import io.hearthwarrio.outlinium.core.dom.TextNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DomFiltersTest {

    private final DomSemantics semantics = new DomSemantics(OutlineSettings.defaults());
    private final SnapshotDecoder decoder = new SnapshotDecoder();

    private static List<String> tags(DomNode node) {
        List<String> out = new ArrayList<>();
        collect(node, out);
        return out;
    }

    private static void collect(DomNode node, List<String> out) {
        for (DomNode child : node.getChildren()) {
            if (child instanceof ElementNode) {
                out.add(((ElementNode) child).getTag());
            } else {
                out.add("'" + ((TextNode) child).getContent() + "'");
            }
            collect(child, out);
        }
    }

    @Test
    void visibilityDeletesUnrenderedSubtreesButKeepsFileAndHiddenInputs() {
        DomSnapshotBuilder b = new DomSnapshotBuilder();
        int html = b.element(-1, "HTML");
        int gone = b.unrenderedElement(html, "DIV");
        b.element(gone, "BUTTON");
        b.unrenderedElement(html, "INPUT", "type", "hidden", "name", "csrf");
        b.unrenderedElement(html, "INPUT", "type", "FILE");
        b.unrenderedElement(html, "INPUT", "type", "text");
        b.unrenderedElement(html, "SCRIPT");
        b.element(html, "P");

        DomDocument doc = decoder.decode(b.build());
        DomNode out = DomFilters.visibility(semantics).apply(doc.getRoot());

        assertEquals(List.of("input", "input", "p"), tags(out));
    }

    @Test
    void attributePruningKeepsOnlySemanticAttributesInOrder() {
        DomSnapshotBuilder b = new DomSnapshotBuilder();
        int html = b.element(-1, "HTML", "lang", "en");
        int a = b.element(html, "A", "class", "nav", "href", "/home", "data-x", "1", "aria-label", "Home");
        b.text(a, "Home");

        DomDocument doc = decoder.decode(b.build());
        DomNode out = DomFilters.attributePruning(semantics).apply(doc.getRoot());

        assertTrue(((ElementNode) out).getAttributes().isEmpty());
        ElementNode link = (ElementNode) out.getChildren().get(0);
        assertEquals(List.of("href", "aria-label"), new ArrayList<>(link.getAttributes().keySet()));
        assertEquals("Home", link.getText());
        assertEquals("nav", doc.elementAt(a).getAttribute("class"));
    }

    @Test
    void nonSemanticElementsArePromoted() {
        DomSnapshotBuilder b = new DomSnapshotBuilder();
        int html = b.element(-1, "HTML");
        int div = b.element(html, "DIV");
        b.text(div, "Welcome");
        b.element(div, "SPAN", "onclick", "go()");
        b.element(html, "STYLE", "type", "text/css");
        int list = b.element(html, "UL", "role", "presentation");
        b.element(list, "LI", "role", "option");
        b.element(html, "DIV", "role", "button");

        DomNode out = DomFilters.nonSemantic(semantics).apply(decoder.decode(b.build()).getRoot());

        assertEquals(List.of("'Welcome'", "span", "li", "div"), tags(out));
    }

    @Test
    void wrapperCollapseNeverTouchesInteractiveOrTextBearingNodes() {
        ElementNode button = new ElementNode(3, "button", Map.of(), Map.of(), null, true, null, List.of());
        ElementNode wrapper = new ElementNode(2, "div", Map.of(), Map.of(), null, true, null, List.of(button));
        ElementNode label = new ElementNode(5, "label", Map.of(), Map.of(), null, true, null,
                List.of(new ElementNode(6, "input", Map.of(), Map.of(), null, true, null, List.of())));
        ElementNode texty = new ElementNode(7, "section", Map.of(), Map.of(), null, true, null,
                List.of(new TextNode(8, "Intro"), new ElementNode(9, "a", Map.of(), Map.of(), null, true, null, List.of())));
        ElementNode root = new ElementNode(0, "html", Map.of(), Map.of(), null, true, null,
                List.of(wrapper, label, texty));

        DomNode out = DomFilters.wrapperCollapse(semantics).apply(root);

        assertEquals(List.of("button", "label", "input", "section", "'Intro'", "a"), tags(out));
    }

    @Test
    void interactivityComesFromTagRoleOrAttributes() {
        assertTrue(semantics.isInteractive(element("a")));
        assertTrue(semantics.isInteractive(element("div", "role", "tab")));
        assertTrue(semantics.isInteractive(element("div", "tabindex", "0")));
        assertTrue(semantics.isInteractive(element("div", "aria-haspopup", "menu")));
        assertTrue(semantics.isInteractive(element("div", "onclick", "")));
        assertFalse(semantics.isInteractive(element("div", "role", "heading")));
        assertFalse(semantics.isInteractive(element("img", "alt", "logo")));
    }

    @Test
    void settingsChangeWhatCountsAsInteractive() {
        DomSemantics custom = new DomSemantics(OutlineSettings.defaults().withInteractiveTags(List.of("summary")));

        assertTrue(custom.isInteractive(element("summary")));
        assertFalse(custom.isInteractive(element("button")));
    }

    private static ElementNode element(String tag, String... attrs) {
        Map<String, String> map = new java.util.LinkedHashMap<>();
        for (int i = 0; i < attrs.length; i += 2) {
            map.put(attrs[i], attrs[i + 1]);
        }
        return new ElementNode(0, tag, map, Map.of(), null, true, null, List.of());
    }

    @Test
    void narrowKeptAttributesStillKeepInteractiveWrappers() {
        OutlineSettings settings = OutlineSettings.defaults().withKeptAttributes(List.of("name"));
        DomSnapshotBuilder b = new DomSnapshotBuilder();
        int html = b.element(-1, "HTML");
        int div = b.element(html, "DIV", "class", "card", "onclick", "go()");
        int span = b.element(div, "SPAN", "role", "button", "title", "Go");
        b.text(span, "Go");

        DomDocument doc = decoder.decode(b.build());
        DomNode out = FilterPipeline.forDom(settings).apply(doc.getRoot());

        assertEquals(List.of("div", "span", "'Go'"), tags(out));
        ElementNode wrapper = (ElementNode) out.getChildren().get(0);
        assertEquals(Map.of("onclick", "go()"), wrapper.getAttributes());
        assertEquals(Map.of("role", "button"), ((ElementNode) wrapper.getChildren().get(0)).getAttributes());
    }
}
