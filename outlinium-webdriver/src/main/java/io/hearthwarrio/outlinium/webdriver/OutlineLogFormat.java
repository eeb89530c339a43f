package io.hearthwarrio.outlinium.webdriver;

import io.hearthwarrio.outlinium.core.PageContext;
import io.hearthwarrio.outlinium.core.dom.ElementNode;

/**
 * Text shared by the bundled loggers.
 */
public final class OutlineLogFormat {

    private static final int MAX_TEXT = 60;

    private OutlineLogFormat() {
    }

    public static String summary(PageContext context) {
        if (context.isEmpty()) {
            return "mode=" + context.getMode().getValue() + ", empty page";
        }
        return "mode=" + context.getMode().getValue() +
                ", identifiers=" + context.getIdentifierMap().size() +
                ", interactive=" + context.interactiveIdentifiers().size();
    }

    public static String resolved(String identifier, String xPath, ElementNode element) {
        StringBuilder sb = new StringBuilder(128);
        sb.append("id='").append(identifier).append('\'')
                .append(", xpath=").append(xPath);
        if (element != null) {
            sb.append(", tag=").append(element.getTag());
            String text = element.getText();
            if (!text.isEmpty()) {
                sb.append(", text='").append(shorten(text)).append('\'');
            }
        }
        return sb.toString();
    }

    static String shorten(String text) {
        return text.length() <= MAX_TEXT ? text : text.substring(0, MAX_TEXT) + "...";
    }
}
