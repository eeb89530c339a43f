package io.hearthwarrio.outlinium.core.dom;

import java.util.List;

/**
 * DOM text leaf. Content is stored trimmed and is never blank.
 */
public final class TextNode extends DomNode {

    private final String content;

    public TextNode(int index, String content) {
        super(index);
        this.content = content == null ? "" : content.trim();
    }

    public String getContent() {
        return content;
    }

    @Override
    public List<DomNode> getChildren() {
        return List.of();
    }

    /**
     * Text nodes have no children; the argument is ignored.
     */
    @Override
    public TextNode withChildren(List<DomNode> children) {
        return new TextNode(getIndex(), content);
    }

    @Override
    public String toString() {
        return "TextNode{'" + content + "'}";
    }
}
