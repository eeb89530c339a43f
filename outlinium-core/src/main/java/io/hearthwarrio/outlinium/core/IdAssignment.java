package io.hearthwarrio.outlinium.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Result of {@link IdAssigner}: which node (by index) carries which identifier,
 * and where each identifier points in the original DOM.
 */
public final class IdAssignment {

    private final Map<Integer, String> identifiersByIndex;
    private final IdentifierMap identifierMap;

    IdAssignment(Map<Integer, String> identifiersByIndex, IdentifierMap identifierMap) {
        this.identifiersByIndex = Collections.unmodifiableMap(new HashMap<>(identifiersByIndex));
        this.identifierMap = identifierMap;
    }

    /**
     * @return identifier of the node with the given index, or null when it has none
     */
    public String identifierOf(int nodeIndex) {
        return identifiersByIndex.get(nodeIndex);
    }

    public Map<Integer, String> getIdentifiersByIndex() {
        return identifiersByIndex;
    }

    public IdentifierMap getIdentifierMap() {
        return identifierMap;
    }
}
