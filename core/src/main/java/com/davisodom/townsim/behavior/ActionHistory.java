package com.davisodom.townsim.behavior;

import com.davisodom.townsim.model.ActionHistoryEntry;
import com.davisodom.townsim.persistence.AsyncStore;

import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * Recent actions, moves and idles per agent and day, the decider's short-term memory.
 * Consecutive idle entries collapse into one.
 */
public class ActionHistory {

    private final Map<Integer, Map<String, List<ActionHistoryEntry>>> byDay = new HashMap<>();
    private final AsyncStore store;

    public ActionHistory(AsyncStore store) {
        this.store = store;
    }

    /**
     * @return false when the entry was a repeated idle and was dropped
     */
    public boolean record(ActionHistoryEntry entry) {
        synchronized (this) {
            List<ActionHistoryEntry> entries = byDay.computeIfAbsent(entry.day(), k -> new HashMap<>())
                    .computeIfAbsent(entry.characterId(), k -> new ArrayList<>());
            if (entry.kind() == ActionHistoryEntry.Kind.IDLE && !entries.isEmpty()
                    && entries.get(entries.size() - 1).kind() == ActionHistoryEntry.Kind.IDLE) {
                return false;
            }
            entries.add(entry);
        }
        store.write("append history " + entry.characterId(), s -> s.appendActionHistory(entry));
        return true;
    }

    /**
     * Up to {@code limit} latest entries of one day, oldest first.
     */
    public synchronized List<ActionHistoryEntry> recent(String characterId, int day, int limit) {
        Map<String, List<ActionHistoryEntry>> forDay = byDay.get(day);
        List<ActionHistoryEntry> entries = forDay != null ? forDay.get(characterId) : null;
        if (entries == null || entries.isEmpty()) {
            return List.of();
        }
        int from = Math.max(0, entries.size() - limit);
        return List.copyOf(entries.subList(from, entries.size()));
    }

    /**
     * Seed the cache for a day from the store. Stored entries go before any recorded since.
     */
    public CompletableFuture<Void> loadDay(int day) {
        return store.read("load history day " + day, s -> s.loadActionHistory(day), List.<ActionHistoryEntry>of())
                .thenAccept(loaded -> {
                    synchronized (this) {
                        Map<String, List<ActionHistoryEntry>> forDay = byDay.computeIfAbsent(day, k -> new HashMap<>());
                        Map<String, List<ActionHistoryEntry>> merged = new HashMap<>();
                        for (ActionHistoryEntry entry : loaded) {
                            merged.computeIfAbsent(entry.characterId(), k -> new ArrayList<>()).add(entry);
                        }
                        for (Map.Entry<String, List<ActionHistoryEntry>> e : forDay.entrySet()) {
                            merged.computeIfAbsent(e.getKey(), k -> new ArrayList<>()).addAll(e.getValue());
                        }
                        byDay.put(day, merged);
                    }
                });
    }

    public synchronized void clearActionHistoryCacheForDay(int day) {
        byDay.remove(day);
    }
}
