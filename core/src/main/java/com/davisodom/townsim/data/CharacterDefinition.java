package com.davisodom.townsim.data;

import com.davisodom.townsim.model.Employment;
import com.davisodom.townsim.model.NeedType;
import com.davisodom.townsim.model.NeedValues;
import com.davisodom.townsim.model.ScheduleEntry;
import com.davisodom.townsim.model.WorldMap;
import com.davisodom.townsim.world.SimCharacter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A character as declared in world data.
 *
 * @param nodeId   starting node; the map's spawn node when null
 * @param needs    starting needs; missing needs start full
 * @param schedule default daily schedule
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CharacterDefinition(String id,
                                  String name,
                                  String mapId,
                                  String nodeId,
                                  Map<NeedType, Double> needs,
                                  int money,
                                  Employment employment,
                                  List<ScheduleEntry> schedule) {

    public CharacterDefinition {
        needs = needs != null ? Map.copyOf(needs) : Map.of();
        schedule = schedule != null ? List.copyOf(schedule) : List.of();
    }

    public String startNodeId(WorldMap map) {
        return nodeId != null ? nodeId : map.getSpawnNodeId();
    }

    /**
     * Instantiate on the given map, which must be the one named by {@link #mapId()}.
     */
    public SimCharacter toCharacter(WorldMap map) {
        String start = startNodeId(map);
        Map<NeedType, Double> values = new EnumMap<>(NeedType.class);
        for (NeedType need : NeedType.values()) {
            values.put(need, needs.getOrDefault(need, NeedType.MAX));
        }
        return new SimCharacter(id, name, mapId, start, map.getNode(start).position(),
                NeedValues.of(values), money, employment);
    }
}
