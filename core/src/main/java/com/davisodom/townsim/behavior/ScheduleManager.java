package com.davisodom.townsim.behavior;

import com.davisodom.townsim.model.DailySchedule;
import com.davisodom.townsim.model.ScheduleEntry;
import com.davisodom.townsim.model.ScheduleUpdate;
import com.davisodom.townsim.model.WorldTime;
import com.davisodom.townsim.persistence.AsyncStore;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Daily schedules: per-character defaults from world data, overridden per day by decisions.
 *
 * Overrides live in a day-keyed cache that takes priority over defaults and are written to
 * the store best-effort. Store loads complete on the persistence thread, hence the locking.
 */
public class ScheduleManager {

    private static final Logger LOGGER = Logger.getLogger(ScheduleManager.class.getName());

    private final Map<String, List<ScheduleEntry>> defaults;
    private final Map<Integer, Map<String, DailySchedule>> overrides = new HashMap<>();
    private final AsyncStore store;

    public ScheduleManager(Map<String, List<ScheduleEntry>> defaults, AsyncStore store) {
        this.defaults = new HashMap<>();
        this.store = store;
        setDefaults(defaults);
    }

    /**
     * Replace the per-character default schedules, e.g. after world data is (re)loaded.
     */
    public synchronized void setDefaults(Map<String, List<ScheduleEntry>> defaults) {
        this.defaults.clear();
        for (Map.Entry<String, List<ScheduleEntry>> entry : defaults.entrySet()) {
            this.defaults.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
    }

    /**
     * Today's override if any, else the character's default, else null.
     */
    public synchronized DailySchedule getSchedule(String characterId, int day) {
        Map<String, DailySchedule> forDay = overrides.get(day);
        if (forDay != null && forDay.containsKey(characterId)) {
            return forDay.get(characterId);
        }
        List<ScheduleEntry> entries = defaults.get(characterId);
        return entries != null ? new DailySchedule(characterId, day, entries) : null;
    }

    /**
     * Apply a decision's schedule change to the given day and persist the result.
     */
    public DailySchedule applyUpdate(String characterId, int day, ScheduleUpdate update) {
        ScheduleEntry entry = update.entry();
        DailySchedule updated;
        synchronized (this) {
            DailySchedule current = getSchedule(characterId, day);
            List<ScheduleEntry> entries = new ArrayList<>(current != null ? current.entries() : List.of());
            if (entry == null || WorldTime.parseMinutes(entry.time()) < 0) {
                LOGGER.warning(String.format("[DECIDE] Ignoring schedule %s for %s: bad entry %s",
                        update.type(), characterId, entry));
                return current;
            }
            switch (update.type()) {
                case ADD:
                    entries.add(entry);
                    break;
                case REMOVE:
                    entries.removeIf(e -> e.time().equals(entry.time()));
                    break;
                case MODIFY:
                    boolean replaced = false;
                    for (int i = 0; i < entries.size(); i++) {
                        if (entries.get(i).time().equals(entry.time())) {
                            entries.set(i, entry);
                            replaced = true;
                            break;
                        }
                    }
                    if (!replaced) {
                        entries.add(entry);
                    }
                    break;
                default:
                    break;
            }
            updated = new DailySchedule(characterId, day, entries);
            overrides.computeIfAbsent(day, k -> new HashMap<>()).put(characterId, updated);
        }
        LOGGER.info(String.format("[DECIDE] %s schedule %s %s %s", characterId,
                update.type().name().toLowerCase(Locale.ROOT), entry.time(), entry.activity()));
        store.write("save schedule " + characterId + " day " + day, s -> s.saveSchedule(updated));
        return updated;
    }

    /**
     * Pull stored overrides for a day into the cache. Overrides made meanwhile win.
     */
    public CompletableFuture<Void> loadDay(int day) {
        return store.read("load schedules day " + day, s -> s.loadSchedules(day), List.<DailySchedule>of())
                .thenAccept(loaded -> {
                    synchronized (this) {
                        Map<String, DailySchedule> forDay = overrides.computeIfAbsent(day, k -> new HashMap<>());
                        for (DailySchedule schedule : loaded) {
                            forDay.putIfAbsent(schedule.characterId(), schedule);
                        }
                    }
                });
    }

    public synchronized void clearScheduleCacheForDay(int day) {
        overrides.remove(day);
    }
}
