package com.davisodom.townsim.data;

import com.davisodom.townsim.model.ScheduleEntry;
import com.davisodom.townsim.model.WorldMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated static world: maps, characters and NPCs.
 */
public record WorldData(List<WorldMap> maps, List<CharacterDefinition> characters, List<NpcDefinition> npcs) {

    public WorldData {
        maps = List.copyOf(maps);
        characters = List.copyOf(characters);
        npcs = List.copyOf(npcs);
    }

    /**
     * Default schedules keyed by character id.
     */
    public Map<String, List<ScheduleEntry>> schedules() {
        Map<String, List<ScheduleEntry>> schedules = new LinkedHashMap<>();
        for (CharacterDefinition character : characters) {
            schedules.put(character.id(), character.schedule());
        }
        return schedules;
    }
}
