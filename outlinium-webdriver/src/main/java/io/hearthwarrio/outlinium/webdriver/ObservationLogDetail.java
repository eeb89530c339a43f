package io.hearthwarrio.outlinium.webdriver;

/**
 * Controls how much of an observation is logged.
 */
public enum ObservationLogDetail {

    /**
     * Do not log observations. Resolved identifiers are still logged.
     */
    NONE,

    /**
     * Log mode and identifier counts.
     */
    SUMMARY,

    /**
     * Log the summary followed by the complete outline text.
     */
    FULL_OUTLINE
}
