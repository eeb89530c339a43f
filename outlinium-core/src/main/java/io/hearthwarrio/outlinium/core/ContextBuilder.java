package io.hearthwarrio.outlinium.core;

/**
 * Builds an outline of the current page.
 */
public interface ContextBuilder {

    /**
     * Captures, decodes, filters, identifies and serializes the page.
     *
     * @param source snapshot supplier
     * @param mode   which tree the outline is built from
     * @return fresh context; empty pages yield a diagnostic context rather than an error
     */
    PageContext build(SnapshotSource source, SnapshotMode mode);
}
