package com.davisodom.townsim.core;

import com.davisodom.townsim.DebugFlags;
import com.davisodom.townsim.action.ActionExecutor;
import com.davisodom.townsim.action.DefaultActionExecutor;
import com.davisodom.townsim.action.FacilityActionMapping;
import com.davisodom.townsim.action.FacilityLocator;
import com.davisodom.townsim.behavior.*;
import com.davisodom.townsim.config.SimulationConfig;
import com.davisodom.townsim.data.CharacterDefinition;
import com.davisodom.townsim.data.NpcDefinition;
import com.davisodom.townsim.data.WorldData;
import com.davisodom.townsim.model.ScheduleEntry;
import com.davisodom.townsim.model.WorldMap;
import com.davisodom.townsim.model.WorldTime;
import com.davisodom.townsim.navigation.CrossMapRouter;
import com.davisodom.townsim.navigation.NavigationStateMachine;
import com.davisodom.townsim.navigation.Pathfinder;
import com.davisodom.townsim.needs.NeedDecayModel;
import com.davisodom.townsim.needs.NeedInterrupt;
import com.davisodom.townsim.obs.ActivityLog;
import com.davisodom.townsim.obs.Metrics;
import com.davisodom.townsim.persistence.AsyncStore;
import com.davisodom.townsim.persistence.StateStore;
import com.davisodom.townsim.world.WorldSnapshot;
import com.davisodom.townsim.world.WorldState;

import java.io.IOException;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the world and every subsystem, and runs them in a fixed order each tick:
 * <ol>
 *   <li>clock: sync world time, roll schedule and history caches at midnight</li>
 *   <li>decay: apply need decay once per {@code statusDecayIntervalMs}</li>
 *   <li>actions: complete timed actions</li>
 *   <li>navigation: move agents and detect arrivals</li>
 *   <li>pending: start actions for agents that arrived</li>
 *   <li>decisions: apply resolved decisions and due re-decisions</li>
 *   <li>checkpoint: save a snapshot every {@code saveIntervalMs}</li>
 *   <li>notify: push the snapshot to subscribers every {@code notifyEveryTicks}</li>
 * </ol>
 * While paused only the clock and notify phases do work.
 */
public class SimulationEngine {

    private static final Logger LOGGER = Logger.getLogger(SimulationEngine.class.getName());

    private static final int ACTIVITY_LOG_CAPACITY = 500;

    /**
     * Receives world snapshots on the tick thread.
     */
    @FunctionalInterface
    public interface StateListener {
        void onState(WorldSnapshot snapshot);
    }

    /**
     * Handle returned by {@link #subscribe}; closing it removes the listener.
     */
    public final class Subscription implements AutoCloseable {
        private final StateListener listener;

        private Subscription(StateListener listener) {
            this.listener = listener;
        }

        @Override
        public void close() {
            subscribers.remove(this);
        }
    }

    private final SimulationConfig config;
    private final Clock clock;
    private final DebugFlags debug;
    private final WorldState world = new WorldState();
    private final EventBus events = new EventBus();
    private final Metrics metrics = new Metrics(Logger.getLogger("TownSim.Metrics"));
    private final WorldClock worldClock;
    private final AsyncStore store;
    private final ExecutorService ownedStoreExecutor;
    private final ScheduleManager schedules;
    private final ActionHistory history;
    private final ActionExecutor actions;
    private final NavigationStateMachine navigation;
    private final NeedDecayModel decay;
    private final BehaviorOrchestrator orchestrator;
    private final ActivityLog activityLog;
    private final TickEngine tickEngine;
    private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();

    // Tick thread only
    private long lastDecayAt;
    private long lastNavigationAt;
    private long lastSaveAt;
    private boolean initialDecisionsTriggered = false;

    /**
     * Engine whose store work runs on its own single background thread.
     *
     * @param store state store, or null to run without persistence
     */
    public SimulationEngine(SimulationConfig config, BehaviorDecider decider, FacilityActionMapping mapping,
                            StateStore store, Clock clock, Random random) {
        this(config, decider, mapping, store, null, clock, random);
    }

    /**
     * @param storeExecutor where store work runs; null for a dedicated daemon thread owned by the engine
     */
    public SimulationEngine(SimulationConfig config, BehaviorDecider decider, FacilityActionMapping mapping,
                            StateStore store, Executor storeExecutor, Clock clock, Random random) {
        this.config = config;
        this.clock = clock;
        this.debug = DebugFlags.from(config);

        long now = clock.millis();
        this.worldClock = new WorldClock(config.time.timezone, now);
        world.setServerStartTime(now);
        world.setTime(worldClock.timeAt(now));

        if (store != null && storeExecutor == null) {
            this.ownedStoreExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "TownSim-Store");
                t.setDaemon(true);
                return t;
            });
            this.store = new AsyncStore(store, ownedStoreExecutor, metrics);
        } else {
            this.ownedStoreExecutor = null;
            this.store = store != null ? new AsyncStore(store, storeExecutor, metrics) : AsyncStore.disabled(metrics);
        }

        FacilityLocator locator = new FacilityLocator();
        Pathfinder pathfinder = new Pathfinder();
        this.schedules = new ScheduleManager(Collections.emptyMap(), this.store);
        this.history = new ActionHistory(this.store);
        this.actions = new DefaultActionExecutor(world, events, config, mapping, locator, clock);
        this.navigation = new NavigationStateMachine(world, pathfinder, new CrossMapRouter(pathfinder), events,
                config.movement, debug);
        this.decay = new NeedDecayModel(world, actions, events, config.needs, debug);
        BehaviorContextBuilder contextBuilder = new BehaviorContextBuilder(world, actions, schedules, history,
                config.behavior.historySize);
        this.orchestrator = new BehaviorOrchestrator(world, actions, navigation, decider, contextBuilder, schedules,
                history, config, locator, metrics, clock, random, debug);
        orchestrator.attach(events);
        this.activityLog = new ActivityLog(ACTIVITY_LOG_CAPACITY, world::getTime, clock::millis);
        activityLog.attach(events);

        this.tickEngine = new TickEngine(metrics, config.errors, debug, this::onRepeatedFailure);
        registerPhases();
        resetAnchors();
    }

    private void registerPhases() {
        tickEngine.registerSystem("clock", tick -> syncTime());
        tickEngine.registerSystem("decay", tick -> {
            if (!world.isPaused()) {
                applyDecay();
            }
        });
        tickEngine.registerSystem("actions", tick -> {
            if (!world.isPaused()) {
                actions.tick(clock.millis());
            }
        });
        tickEngine.registerSystem("navigation", tick -> {
            long now = clock.millis();
            double deltaSeconds = Math.max(0, now - lastNavigationAt) / 1000.0;
            lastNavigationAt = now;
            if (!world.isPaused()) {
                navigation.tick(deltaSeconds);
            }
        });
        tickEngine.registerSystem("pending", tick -> {
            if (!world.isPaused()) {
                orchestrator.resolvePendingActions();
            }
        });
        tickEngine.registerSystem("decisions", tick -> {
            if (!world.isPaused()) {
                orchestrator.tick(clock.millis());
            }
        });
        tickEngine.registerSystem("checkpoint", tick -> {
            long now = clock.millis();
            if (store.isEnabled() && !world.isPaused() && now - lastSaveAt >= config.simulation.saveIntervalMs) {
                lastSaveAt = now;
                saveState();
            }
        });
        tickEngine.registerSystem("notify", tick -> {
            if (!world.isPaused()) {
                world.incrementTick();
            }
            if (tick % Math.max(1, config.simulation.notifyEveryTicks) == 0) {
                notifySubscribers();
            }
        });
    }

    // ==================== Lifecycle ====================

    /**
     * Load the world. Replaces any agents already present.
     */
    public void initialize(List<WorldMap> maps, List<CharacterDefinition> characters, List<NpcDefinition> npcs,
                           String currentMapId) {
        world.clearAgents();
        Map<String, WorldMap> byId = new LinkedHashMap<>();
        for (WorldMap map : maps) {
            world.addMap(map);
            byId.put(map.getId(), map);
        }
        for (CharacterDefinition definition : characters) {
            world.addCharacter(definition.toCharacter(byId.get(definition.mapId())));
        }
        for (NpcDefinition definition : npcs) {
            world.addNpc(definition.toNpc(byId.get(definition.mapId())));
        }
        Map<String, List<ScheduleEntry>> defaults = new LinkedHashMap<>();
        for (CharacterDefinition definition : characters) {
            defaults.put(definition.id(), definition.schedule());
        }
        schedules.setDefaults(defaults);

        String focus = currentMapId != null ? currentMapId : config.simulation.currentMapId;
        world.setCurrentMapId(byId.containsKey(focus) ? focus : maps.isEmpty() ? null : maps.get(0).getId());
        syncTime();
        loadDayCaches(world.getTime().day());
        LOGGER.info(String.format("[SIM] Initialized %d maps, %d characters, %d NPCs (focus %s)",
                maps.size(), world.getCharacters().size(), world.getNpcs().size(), world.getCurrentMapId()));
    }

    public void initialize(WorldData data, String currentMapId) {
        initialize(data.maps(), data.characters(), data.npcs(), currentMapId);
    }

    /**
     * Replace agents, time and tick with the last saved snapshot. Maps must be initialized first.
     *
     * @return true when a snapshot was found and applied
     */
    public boolean restoreFromStore() {
        if (!store.isEnabled()) {
            return false;
        }
        WorldSnapshot snapshot = store.read("load state", StateStore::loadState, null).join();
        if (snapshot == null) {
            LOGGER.info("[STORE] No saved state, starting fresh");
            return false;
        }
        int restored = world.restore(snapshot);
        worldClock.setServerStartTime(world.getServerStartTime());
        syncTime();
        loadDayCaches(world.getTime().day());
        LOGGER.info(String.format("[STORE] Restored %d characters at tick %d", restored, world.getTick()));
        return true;
    }

    /**
     * Start the background tick loop. The first start also asks every idle agent for a decision.
     */
    public synchronized void start() {
        if (tickEngine.isRunning()) {
            LOGGER.warning("[SIM] Simulation already running");
            return;
        }
        resetAnchors();
        triggerInitialBehaviorDecisions();
        tickEngine.start(config.simulation.tickIntervalMs());
        LOGGER.info("[SIM] Simulation started");
    }

    public void stop() {
        tickEngine.stop();
    }

    public boolean isRunning() {
        return tickEngine.isRunning();
    }

    /**
     * Ask every idle character for its first decision. Only the first call has an effect.
     */
    public synchronized int triggerInitialBehaviorDecisions() {
        if (initialDecisionsTriggered) {
            return 0;
        }
        initialDecisionsTriggered = true;
        return orchestrator.triggerInitialDecisions();
    }

    /**
     * Stop ticking, write a final snapshot and close the store.
     */
    public void shutdown() {
        stop();
        if (store.isEnabled()) {
            saveState().join();
            if (ownedStoreExecutor != null) {
                ownedStoreExecutor.shutdown();
                try {
                    if (!ownedStoreExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                        ownedStoreExecutor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    ownedStoreExecutor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
            try {
                store.getStore().close();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "[STORE] Failed to close state store", e);
            }
        }
        LOGGER.info("[SIM] Simulation shut down");
    }

    // ==================== Pause ====================

    /**
     * Pause on the tick thread. Returns once the pause is in effect.
     */
    public void pause() {
        tickEngine.submit(() -> {
            applyPause();
            return null;
        }).join();
    }

    /**
     * Resume. Time spent paused is neither decayed nor walked.
     */
    public void unpause() {
        tickEngine.submit(() -> {
            applyUnpause();
            return null;
        }).join();
    }

    /**
     * @return true when the simulation is paused afterwards
     */
    public boolean togglePause() {
        return tickEngine.submit(() -> {
            if (world.isPaused()) {
                applyUnpause();
            } else {
                applyPause();
            }
            return world.isPaused();
        }).join();
    }

    public boolean isPaused() {
        return world.isPaused();
    }

    private void applyPause() {
        world.setPaused(true);
        LOGGER.info("[SIM] Paused");
    }

    private void applyUnpause() {
        resetAnchors();
        world.setPaused(false);
        LOGGER.info("[SIM] Resumed");
    }

    // ==================== Ticking ====================

    /**
     * Run one tick on the calling thread.
     */
    public void tick() {
        tickEngine.tick();
    }

    private void syncTime() {
        WorldTime previous = world.getTime();
        WorldTime now = worldClock.timeAt(clock.millis());
        world.setTime(now);
        if (now.day() != previous.day()) {
            LOGGER.info(String.format("[SIM] Day %d begins", now.day()));
            schedules.clearScheduleCacheForDay(previous.day());
            history.clearActionHistoryCacheForDay(previous.day());
            loadDayCaches(now.day());
            events.publish(SimulationEvent.dayChanged(now.day()));
        }
    }

    private void loadDayCaches(int day) {
        schedules.loadDay(day);
        history.loadDay(day);
    }

    private void applyDecay() {
        long now = clock.millis();
        long elapsed = now - lastDecayAt;
        if (elapsed < config.simulation.statusDecayIntervalMs) {
            return;
        }
        lastDecayAt = now;
        List<NeedInterrupt> interrupts = decay.applyDecay(elapsed / 60_000.0);
        if (!interrupts.isEmpty()) {
            debug.debugDecay(interrupts.size() + " interrupt(s) raised");
        }
    }

    private void resetAnchors() {
        long now = clock.millis();
        lastDecayAt = now;
        lastNavigationAt = now;
        lastSaveAt = now;
    }

    private void onRepeatedFailure(String systemName, Throwable error) {
        LOGGER.severe(String.format("[SIM] Pausing simulation: %s keeps failing (%s)", systemName, error));
        applyPause();
    }

    // ==================== State and subscribers ====================

    /**
     * Register a listener for world snapshots, pushed every {@code notifyEveryTicks} ticks.
     */
    public Subscription subscribe(StateListener listener) {
        Subscription subscription = new Subscription(Objects.requireNonNull(listener, "listener cannot be null"));
        subscribers.add(subscription);
        return subscription;
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    private void notifySubscribers() {
        if (subscribers.isEmpty()) {
            return;
        }
        WorldSnapshot snapshot = world.toSnapshot();
        for (Subscription subscription : subscribers) {
            try {
                subscription.listener.onState(snapshot);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "[SIM] Subscriber failed", e);
            }
        }
    }

    /**
     * Snapshot of the world, taken on the tick thread between ticks.
     */
    public WorldSnapshot getState() {
        return tickEngine.submit(world::toSnapshot).join();
    }

    /**
     * Write a snapshot in the background. The snapshot is taken on the tick thread between ticks.
     */
    public CompletableFuture<Void> saveState() {
        return tickEngine.submit(world::toSnapshot)
                .thenCompose(snapshot -> store.write("save state", s -> s.saveState(snapshot)));
    }

    public long getServerStartTime() {
        return worldClock.getServerStartTime();
    }

    /**
     * Re-anchor day 1 on the tick thread and resync the world time.
     */
    public void setServerStartTime(long serverStartTime) {
        tickEngine.submit(() -> {
            worldClock.setServerStartTime(serverStartTime);
            world.setServerStartTime(serverStartTime);
            syncTime();
            return null;
        }).join();
    }

    // ==================== Accessors ====================

    public WorldState getWorld() {
        return world;
    }

    public EventBus getEvents() {
        return events;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public ActivityLog getActivityLog() {
        return activityLog;
    }

    public BehaviorOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public NavigationStateMachine getNavigation() {
        return navigation;
    }

    public ActionExecutor getActions() {
        return actions;
    }

    public ScheduleManager getSchedules() {
        return schedules;
    }

    public ActionHistory getHistory() {
        return history;
    }

    public TickEngine getTickEngine() {
        return tickEngine;
    }
}
