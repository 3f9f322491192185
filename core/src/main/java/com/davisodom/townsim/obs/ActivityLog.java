package com.davisodom.townsim.obs;

import com.davisodom.townsim.core.EventBus;
import com.davisodom.townsim.core.SimulationEvent;
import com.davisodom.townsim.core.SimulationEventType;
import com.davisodom.townsim.model.ActionId;
import com.davisodom.townsim.model.WorldTime;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, human-readable stream of what agents did: actions started and completed, trips
 * started and map changes. Older entries fall off once capacity is reached.
 */
public class ActivityLog {

    private static final Logger LOGGER = Logger.getLogger(ActivityLog.class.getName());

    public enum Type {
        ACTION_STARTED,
        ACTION_COMPLETED,
        MOVE,
        MAP_CHANGED
    }

    public record Entry(long timestamp, int day, String time, String agentId, Type type, String detail) {}

    @FunctionalInterface
    public interface Listener {
        void onEntry(Entry entry);
    }

    private final int capacity;
    private final Supplier<WorldTime> timeSource;
    private final Supplier<Long> wallClock;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    public ActivityLog(int capacity, Supplier<WorldTime> timeSource, Supplier<Long> wallClock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.timeSource = timeSource;
        this.wallClock = wallClock;
    }

    /**
     * Subscribe to the events this log records.
     */
    public EventBus.Registration attach(EventBus events) {
        return events.register(this::onEvent,
                SimulationEventType.ACTION_STARTED,
                SimulationEventType.ACTION_COMPLETED,
                SimulationEventType.NAVIGATION_STARTED,
                SimulationEventType.MAP_CHANGED);
    }

    void onEvent(SimulationEvent event) {
        if (event.getActionId() == ActionId.THINKING) {
            return;
        }
        switch (event.getType()) {
            case ACTION_STARTED:
                record(event.getAgentId(), Type.ACTION_STARTED, event.getActionId().id()
                        + (event.getDetail() != null ? " @ " + event.getDetail() : ""));
                break;
            case ACTION_COMPLETED:
                record(event.getAgentId(), Type.ACTION_COMPLETED, event.getActionId().id());
                break;
            case NAVIGATION_STARTED:
                record(event.getAgentId(), Type.MOVE, event.getMapId() + "/" + event.getNodeId());
                break;
            case MAP_CHANGED:
                record(event.getAgentId(), Type.MAP_CHANGED, event.getMapId());
                break;
            default:
                break;
        }
    }

    public void record(String agentId, Type type, String detail) {
        WorldTime time = timeSource.get();
        Entry entry = new Entry(wallClock.get(), time.day(), time.format(), agentId, type, detail);
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > capacity) {
                entries.removeFirst();
            }
        }
        for (Listener listener : listeners) {
            try {
                listener.onEntry(entry);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Activity listener failed", e);
            }
        }
    }

    /**
     * Entries oldest first.
     */
    public List<Entry> getEntries() {
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    public List<Entry> getEntries(String agentId) {
        List<Entry> result = new ArrayList<>();
        for (Entry entry : getEntries()) {
            if (entry.agentId().equals(agentId)) {
                result.add(entry);
            }
        }
        return result;
    }

    public void addListener(Listener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public boolean removeListener(Listener listener) {
        return listeners.remove(listener);
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }
}
