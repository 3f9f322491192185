package com.davisodom.townsim.persistence;

import com.davisodom.townsim.model.ActionHistoryEntry;
import com.davisodom.townsim.model.DailySchedule;
import com.davisodom.townsim.world.WorldSnapshot;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Storage for world snapshots, schedule overrides and action history.
 *
 * Callers treat every operation as best-effort: failures are logged and the in-memory world
 * stays the source of truth.
 */
public interface StateStore extends Closeable {

    void saveState(WorldSnapshot snapshot) throws IOException;

    /**
     * @return the last saved snapshot, or null when nothing was saved
     */
    WorldSnapshot loadState() throws IOException;

    /**
     * Insert or replace the schedule of one character for one day.
     */
    void saveSchedule(DailySchedule schedule) throws IOException;

    List<DailySchedule> loadSchedules(int day) throws IOException;

    void appendActionHistory(ActionHistoryEntry entry) throws IOException;

    /**
     * History of one day in insertion order.
     */
    List<ActionHistoryEntry> loadActionHistory(int day) throws IOException;

    boolean hasData() throws IOException;

    void clear() throws IOException;
}
