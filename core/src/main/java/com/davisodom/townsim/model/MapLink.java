package com.davisodom.townsim.model;

import java.util.Objects;

/**
 * Cross-map edge carried by an entrance node: stepping onto the entrance moves the agent
 * to {@code nodeId} on {@code mapId}.
 */
public record MapLink(String mapId, String nodeId) {

    public MapLink {
        Objects.requireNonNull(mapId, "mapId cannot be null");
        Objects.requireNonNull(nodeId, "nodeId cannot be null");
    }
}
