package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One map's worth of a cross-map route.
 *
 * @param path           node ids on {@code mapId}; a single node means the agent is already there
 * @param exitEntranceId entrance that leads to the next segment, null on the last segment
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteSegment(String mapId, List<String> path, String exitEntranceId) {

    public RouteSegment {
        path = List.copyOf(path);
    }

    public String firstNodeId() {
        return path.get(0);
    }

    public String lastNodeId() {
        return path.get(path.size() - 1);
    }

    @JsonIgnore
    public boolean isStub() {
        return path.size() == 1;
    }
}
