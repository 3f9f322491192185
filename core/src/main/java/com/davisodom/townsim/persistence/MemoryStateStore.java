package com.davisodom.townsim.persistence;

import com.davisodom.townsim.model.ActionHistoryEntry;
import com.davisodom.townsim.model.DailySchedule;
import com.davisodom.townsim.world.WorldSnapshot;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.*;

/**
 * In-memory store for tests and runs without persistence.
 * Values are deep-copied through JSON so callers never share state with the store.
 */
public class MemoryStateStore implements StateStore {

    private final ObjectMapper mapper = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private String state;
    private final Map<Integer, Map<String, DailySchedule>> schedules = new HashMap<>();
    private final Map<Integer, List<ActionHistoryEntry>> history = new HashMap<>();
    private boolean closed;

    @Override
    public synchronized void saveState(WorldSnapshot snapshot) throws IOException {
        ensureOpen();
        state = mapper.writeValueAsString(snapshot);
    }

    @Override
    public synchronized WorldSnapshot loadState() throws IOException {
        ensureOpen();
        return state != null ? mapper.readValue(state, WorldSnapshot.class) : null;
    }

    @Override
    public synchronized void saveSchedule(DailySchedule schedule) throws IOException {
        ensureOpen();
        schedules.computeIfAbsent(schedule.day(), k -> new LinkedHashMap<>())
                .put(schedule.characterId(), schedule);
    }

    @Override
    public synchronized List<DailySchedule> loadSchedules(int day) throws IOException {
        ensureOpen();
        return new ArrayList<>(schedules.getOrDefault(day, Collections.emptyMap()).values());
    }

    @Override
    public synchronized void appendActionHistory(ActionHistoryEntry entry) throws IOException {
        ensureOpen();
        history.computeIfAbsent(entry.day(), k -> new ArrayList<>()).add(entry);
    }

    @Override
    public synchronized List<ActionHistoryEntry> loadActionHistory(int day) throws IOException {
        ensureOpen();
        return new ArrayList<>(history.getOrDefault(day, Collections.emptyList()));
    }

    @Override
    public synchronized boolean hasData() throws IOException {
        ensureOpen();
        return state != null;
    }

    @Override
    public synchronized void clear() throws IOException {
        ensureOpen();
        state = null;
        schedules.clear();
        history.clear();
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Store is closed");
        }
    }
}
