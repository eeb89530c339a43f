package io.hearthwarrio.outlinium.webdriver;

import io.hearthwarrio.outlinium.core.SnapshotSource;
import io.hearthwarrio.outlinium.core.dom.SnapshotDecoder;
import org.openqa.selenium.chromium.HasCdp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Captures snapshots over the Chrome DevTools Protocol.
 * <p>
 * Transport failures (closed window, navigation in progress, unsupported command) yield an empty map,
 * which the builder turns into the empty-page diagnostic.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public class CdpSnapshotSource implements SnapshotSource {

    public static final String CAPTURE_SNAPSHOT = "DOMSnapshot.captureSnapshot";
    public static final String GET_FULL_AX_TREE = "Accessibility.getFullAXTree";

    private final HasCdp cdp;

    public CdpSnapshotSource(HasCdp cdp) {
        this.cdp = Objects.requireNonNull(cdp, "cdp must not be null");
    }

    @Override
    public Map<String, Object> getDomSnapshot() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("computedStyles", SnapshotDecoder.REQUESTED_STYLES);
        params.put("includePaintOrder", true);
        params.put("includeDOMRects", true);
        return execute(CAPTURE_SNAPSHOT, params);
    }

    @Override
    public Map<String, Object> getAccessibilityTree() {
        return execute(GET_FULL_AX_TREE, Collections.emptyMap());
    }

    private Map<String, Object> execute(String command, Map<String, Object> params) {
        try {
            Map<String, Object> result = cdp.executeCdpCommand(command, params);
            return result == null ? Collections.emptyMap() : result;
        } catch (RuntimeException e) {
            return Collections.emptyMap();
        }
    }
}
