package io.hearthwarrio.outlinium.core;

import java.util.Map;

/**
 * Supplies raw page snapshots in the browser protocol's own shape.
 * <p>
 * Implementations talk to a browser; the core only decodes what they return.
 */
public interface SnapshotSource {

    /**
     * @return {@code DOMSnapshot.captureSnapshot} result, requested with computed styles
     * {@code display}, {@code visibility}, {@code opacity} (in that order) and DOM rects
     */
    Map<String, Object> getDomSnapshot();

    /**
     * @return {@code Accessibility.getFullAXTree} result
     */
    Map<String, Object> getAccessibilityTree();
}
