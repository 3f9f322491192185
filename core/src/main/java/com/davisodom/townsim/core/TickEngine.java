package com.davisodom.townsim.core;

import com.davisodom.townsim.DebugFlags;
import com.davisodom.townsim.config.SimulationConfig;
import com.davisodom.townsim.obs.Metrics;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-rate tick loop for the simulation.
 *
 * Systems run in registration order on a single scheduler thread, each timed and isolated in its
 * own try/catch so a failing phase cannot stop the loop. A phase that fails
 * {@code maxConsecutiveFailures} ticks in a row is reported to the failure handler, which the
 * simulation uses to pause itself.
 *
 * <p>Work from other threads goes through {@link #submit}, which queues it for the start of the next
 * tick while the loop is running.
 */
public class TickEngine {

    private static final Logger LOGGER = Logger.getLogger(TickEngine.class.getName());

    // Performance budgets (microseconds) for a 50ms tick
    private static final long BUDGET_WARNING_MICROS = 8000;
    private static final long BUDGET_CRITICAL_MICROS = 12000;

    /**
     * Receives the name of a phase that kept failing.
     */
    @FunctionalInterface
    public interface FailureHandler {
        void onRepeatedFailure(String systemName, Throwable lastError);
    }

    /**
     * A phase of the tick. Called on the tick thread only.
     */
    @FunctionalInterface
    public interface TickableSystem {
        void tick(long tick);
    }

    private final Map<String, TickableSystem> systems = new LinkedHashMap<>();
    private final Map<String, Long> tickTimeMicros = new ConcurrentHashMap<>();
    private final Map<String, Integer> consecutiveFailures = new HashMap<>();
    private final Queue<Runnable> commands = new ConcurrentLinkedQueue<>();
    private final Metrics metrics;
    private final SimulationConfig.Errors errors;
    private final DebugFlags debug;
    private final FailureHandler failureHandler;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;
    private volatile long currentTick = 0;
    private volatile Thread tickThread;

    public TickEngine(Metrics metrics, SimulationConfig.Errors errors, DebugFlags debug, FailureHandler failureHandler) {
        this.metrics = metrics;
        this.errors = errors;
        this.debug = debug;
        this.failureHandler = failureHandler;
    }

    /**
     * Register a system. Systems tick in registration order.
     *
     * @throws IllegalArgumentException when the name is taken
     */
    public synchronized void registerSystem(String name, TickableSystem system) {
        if (systems.containsKey(name)) {
            throw new IllegalArgumentException("System already registered: " + name);
        }
        systems.put(name, system);
        tickTimeMicros.put(name, 0L);
        LOGGER.fine("[TICK] Registered tickable system: " + name);
    }

    /**
     * Start ticking every {@code intervalMs} on a daemon thread.
     */
    public synchronized void start(long intervalMs) {
        if (isRunning()) {
            LOGGER.warning("[TICK] Tick engine already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "TownSim-Tick");
            t.setDaemon(true);
            tickThread = t;
            return t;
        });
        tickTask = scheduler.scheduleAtFixedRate(this::tick, 0L, intervalMs, TimeUnit.MILLISECONDS);
        LOGGER.info(String.format("[TICK] Tick engine started (%d ms interval)", intervalMs));
    }

    /**
     * Stop the loop and wait briefly for the running tick to finish.
     */
    public void stop() {
        ScheduledExecutorService toStop;
        synchronized (this) {
            if (scheduler == null) {
                return;
            }
            tickTask.cancel(false);
            toStop = scheduler;
            scheduler = null;
            tickTask = null;
        }
        toStop.shutdown();
        try {
            if (!toStop.awaitTermination(5, TimeUnit.SECONDS)) {
                toStop.shutdownNow();
            }
        } catch (InterruptedException e) {
            toStop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        tickThread = null;
        // Commands queued before the stop still complete, on the stopping thread
        drainCommands();
        LOGGER.info("[TICK] Tick engine stopped");
    }

    public synchronized boolean isRunning() {
        return tickTask != null && !tickTask.isCancelled();
    }

    /**
     * Run a command on the tick thread. While the loop runs and the caller is another thread, the
     * command is queued and executed before the systems of the next tick; otherwise it runs at once
     * on the calling thread.
     *
     * @return completes with the command's result, or exceptionally with what it threw
     */
    public <T> CompletableFuture<T> submit(Supplier<T> command) {
        CompletableFuture<T> result = new CompletableFuture<>();
        synchronized (this) {
            if (isRunning() && Thread.currentThread() != tickThread) {
                commands.add(() -> runCommand(command, result));
                return result;
            }
        }
        runCommand(command, result);
        return result;
    }

    public boolean isTickThread() {
        return Thread.currentThread() == tickThread;
    }

    private static <T> void runCommand(Supplier<T> command, CompletableFuture<T> result) {
        try {
            result.complete(command.get());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "[TICK] Queued command failed", e);
            result.completeExceptionally(e);
        }
    }

    private void drainCommands() {
        Runnable command;
        while ((command = commands.poll()) != null) {
            command.run();
        }
    }

    /**
     * Execute one tick across all registered systems.
     * Called by the scheduler, or directly by tests and headless drivers.
     */
    public void tick() {
        long tick = ++currentTick;
        long tickStart = System.nanoTime();
        drainCommands();

        List<Map.Entry<String, TickableSystem>> ordered;
        synchronized (this) {
            ordered = new ArrayList<>(systems.entrySet());
        }
        for (Map.Entry<String, TickableSystem> entry : ordered) {
            String systemName = entry.getKey();
            long systemStart = System.nanoTime();
            try {
                entry.getValue().tick(tick);
                consecutiveFailures.remove(systemName);
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "[TICK] Error ticking system " + systemName, e);
                onFailure(systemName, e);
            }
            long systemMicros = (System.nanoTime() - systemStart) / 1000;
            tickTimeMicros.put(systemName, systemMicros);
            metrics.recordTickTime(systemName, systemMicros);
        }

        long totalMicros = (System.nanoTime() - tickStart) / 1000;
        metrics.recordTickTime("total", totalMicros);
        debug.debugPerformance("tick " + tick, totalMicros);

        if (totalMicros > BUDGET_CRITICAL_MICROS) {
            LOGGER.warning(String.format("[TICK] CRITICAL: Tick %d took %.2fms (budget: %.2fms p99). Systems: %s",
                    tick, totalMicros / 1000.0, BUDGET_CRITICAL_MICROS / 1000.0, formatSystemTimes()));
        } else if (totalMicros > BUDGET_WARNING_MICROS) {
            LOGGER.fine(String.format("[TICK] WARNING: Tick %d took %.2fms (budget: %.2fms p95). Systems: %s",
                    tick, totalMicros / 1000.0, BUDGET_WARNING_MICROS / 1000.0, formatSystemTimes()));
        }
    }

    private void onFailure(String systemName, RuntimeException error) {
        int failures = consecutiveFailures.merge(systemName, 1, Integer::sum);
        if (failures >= errors.maxConsecutiveFailures) {
            consecutiveFailures.remove(systemName);
            LOGGER.severe(String.format("[TICK] System %s failed %d ticks in a row", systemName, failures));
            if (errors.pauseOnCriticalError && failureHandler != null) {
                failureHandler.onRepeatedFailure(systemName, error);
            }
        }
    }

    private String formatSystemTimes() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Long> entry : tickTimeMicros.entrySet()) {
            sb.append(String.format("%s=%.2fms ", entry.getKey(), entry.getValue() / 1000.0));
        }
        return sb.toString().trim();
    }

    public long getCurrentTick() {
        return currentTick;
    }

    /**
     * Duration of each system's last tick.
     */
    public Map<String, Long> getTickTimeMicros() {
        return new HashMap<>(tickTimeMicros);
    }

    public synchronized List<String> getSystemNames() {
        return new ArrayList<>(systems.keySet());
    }
}
