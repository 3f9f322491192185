package com.davisodom.townsim.persistence;

import com.davisodom.townsim.model.ActionHistoryEntry;
import com.davisodom.townsim.model.DailySchedule;
import com.davisodom.townsim.world.WorldSnapshot;
import com.fasterxml.jackson.databind.JavaType;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * {@link StateStore} on versioned JSON files.
 *
 * Layout: {@code state.json} for the snapshot (backed up on overwrite), and one file per world
 * day under {@code schedules/} and {@code history/}. Calls are serialized; the engine runs them
 * off the tick thread.
 */
public class FileStateStore implements StateStore {

    private static final String STATE_FILE = "state.json";

    private final JsonStore store;
    private final JavaType scheduleListType;
    private final JavaType historyListType;
    private boolean closed;

    public FileStateStore(File dataFolder, Logger logger) throws IOException {
        this.store = new JsonStore(dataFolder, logger);
        this.scheduleListType = store.getMapper().getTypeFactory()
                .constructCollectionType(List.class, DailySchedule.class);
        this.historyListType = store.getMapper().getTypeFactory()
                .constructCollectionType(List.class, ActionHistoryEntry.class);
    }

    @Override
    public synchronized void saveState(WorldSnapshot snapshot) throws IOException {
        ensureOpen();
        store.saveJson(STATE_FILE, snapshot, JsonStore.SCHEMA_VERSION, true);
    }

    @Override
    public synchronized WorldSnapshot loadState() throws IOException {
        ensureOpen();
        return store.loadJson(STATE_FILE, WorldSnapshot.class);
    }

    @Override
    public synchronized void saveSchedule(DailySchedule schedule) throws IOException {
        ensureOpen();
        List<DailySchedule> schedules = new ArrayList<>(loadSchedules(schedule.day()));
        schedules.removeIf(s -> s.characterId().equals(schedule.characterId()));
        schedules.add(schedule);
        store.saveJson(scheduleFile(schedule.day()), schedules, JsonStore.SCHEMA_VERSION, false);
    }

    @Override
    public synchronized List<DailySchedule> loadSchedules(int day) throws IOException {
        ensureOpen();
        List<DailySchedule> schedules = store.loadJson(scheduleFile(day), scheduleListType);
        return schedules != null ? schedules : new ArrayList<>();
    }

    @Override
    public synchronized void appendActionHistory(ActionHistoryEntry entry) throws IOException {
        ensureOpen();
        List<ActionHistoryEntry> entries = new ArrayList<>(loadActionHistory(entry.day()));
        entries.add(entry);
        store.saveJson(historyFile(entry.day()), entries, JsonStore.SCHEMA_VERSION, false);
    }

    @Override
    public synchronized List<ActionHistoryEntry> loadActionHistory(int day) throws IOException {
        ensureOpen();
        List<ActionHistoryEntry> entries = store.loadJson(historyFile(day), historyListType);
        return entries != null ? entries : new ArrayList<>();
    }

    @Override
    public synchronized boolean hasData() throws IOException {
        ensureOpen();
        return store.exists(STATE_FILE);
    }

    @Override
    public synchronized void clear() throws IOException {
        ensureOpen();
        store.deleteAll();
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    private static String scheduleFile(int day) {
        return "schedules" + File.separator + "day-" + day + ".json";
    }

    private static String historyFile(int day) {
        return "history" + File.separator + "day-" + day + ".json";
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Store is closed");
        }
    }
}
