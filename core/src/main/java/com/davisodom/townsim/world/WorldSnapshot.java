package com.davisodom.townsim.world;

import com.davisodom.townsim.model.WorldTime;

import java.util.Map;

/**
 * Point-in-time copy of the world pushed to subscribers and written to the state store.
 */
public record WorldSnapshot(long tick,
                            WorldTime time,
                            String currentMapId,
                            long serverStartTime,
                            boolean paused,
                            Map<String, CharacterSnapshot> characters,
                            Map<String, NpcSnapshot> npcs) {

    public WorldSnapshot {
        characters = characters != null ? Map.copyOf(characters) : Map.of();
        npcs = npcs != null ? Map.copyOf(npcs) : Map.of();
    }
}
