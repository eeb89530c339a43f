package io.hearthwarrio.outlinium.webdriver;

import io.hearthwarrio.outlinium.core.PageContext;
import io.hearthwarrio.outlinium.core.dom.ElementNode;

import java.util.Objects;

/**
 * Default stdout logger.
 */
public final class StdOutOutlineLogger implements OutlineLogger {

    private final ObservationLogDetail detail;

    public StdOutOutlineLogger(ObservationLogDetail detail) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
    }

    @Override
    public ObservationLogDetail detail() {
        return detail;
    }

    @Override
    public void logObservation(PageContext context) {
        if (detail == ObservationLogDetail.NONE) {
            return;
        }
        System.out.println("[Outlinium] observed " + OutlineLogFormat.summary(context));
        if (detail == ObservationLogDetail.FULL_OUTLINE) {
            System.out.println(context.getText());
        }
    }

    @Override
    public void logResolvedIdentifier(String identifier, String xPath, ElementNode element) {
        System.out.println("[Outlinium] " + OutlineLogFormat.resolved(identifier, xPath, element));
    }
}
