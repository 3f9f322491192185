package com.davisodom.townsim.obs;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Counters and per-phase tick timings.
 *
 * Counters used by the simulation: {@code decisions.requested}, {@code decisions.applied},
 * {@code decisions.discarded}, {@code decisions.failed}, {@code interrupts.fired},
 * {@code wander.started}, {@code store.failures}.
 */
public class Metrics {

    private static final long PHASE_BUDGET_MICROS = 2000;

    private final Logger logger;
    private final Map<String, Long> counters;
    private final Map<String, TickTimeStats> tickTimeStats;

    public Metrics(Logger logger) {
        this.logger = logger;
        this.counters = new ConcurrentHashMap<>();
        this.tickTimeStats = new ConcurrentHashMap<>();
    }

    public void increment(String counterName) {
        counters.merge(counterName, 1L, Long::sum);
    }

    public void increment(String counterName, long amount) {
        counters.merge(counterName, amount, Long::sum);
    }

    public long getCounter(String counterName) {
        return counters.getOrDefault(counterName, 0L);
    }

    /**
     * Record tick time for a phase (microseconds)
     */
    public void recordTickTime(String phase, long micros) {
        tickTimeStats.computeIfAbsent(phase, k -> new TickTimeStats())
            .record(micros);

        if (micros > PHASE_BUDGET_MICROS) {
            logger.fine(String.format("[TICK] Phase %s exceeded %dμs budget: %dμs",
                phase, PHASE_BUDGET_MICROS, micros));
        }
    }

    public TickTimeStats getTickTimeStats(String phase) {
        return tickTimeStats.get(phase);
    }

    public Map<String, TickTimeStats> getAllTickTimeStats() {
        return new HashMap<>(tickTimeStats);
    }

    public MetricsSnapshot getSnapshot() {
        return new MetricsSnapshot(
            new HashMap<>(counters),
            new HashMap<>(tickTimeStats)
        );
    }

    /**
     * Reset all metrics (for testing)
     */
    public void reset() {
        counters.clear();
        tickTimeStats.clear();
    }

    /**
     * Tick time statistics with p95/p99 over the last 100 samples
     */
    public static class TickTimeStats {
        private long count = 0;
        private long totalMicros = 0;
        private long minMicros = Long.MAX_VALUE;
        private long maxMicros = 0;

        private final long[] recentSamples = new long[100];
        private int sampleIndex = 0;
        private int sampleCount = 0;

        public synchronized void record(long micros) {
            count++;
            totalMicros += micros;
            minMicros = Math.min(minMicros, micros);
            maxMicros = Math.max(maxMicros, micros);

            recentSamples[sampleIndex] = micros;
            sampleIndex = (sampleIndex + 1) % recentSamples.length;
            sampleCount = Math.min(sampleCount + 1, recentSamples.length);
        }

        public synchronized long getCount() { return count; }
        public synchronized long getAverageMicros() { return count > 0 ? totalMicros / count : 0; }
        public synchronized long getMinMicros() { return minMicros == Long.MAX_VALUE ? 0 : minMicros; }
        public synchronized long getMaxMicros() { return maxMicros; }

        public long getP95Micros() {
            return getPercentile(95);
        }

        public long getP99Micros() {
            return getPercentile(99);
        }

        private synchronized long getPercentile(int percentile) {
            if (sampleCount == 0) {
                return 0;
            }
            long[] sorted = Arrays.copyOf(recentSamples, sampleCount);
            Arrays.sort(sorted);
            int index = (int) Math.ceil(sorted.length * percentile / 100.0) - 1;
            return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
        }
    }

    /**
     * Metrics snapshot for serialization
     */
    public static class MetricsSnapshot {
        public final Map<String, Long> counters;
        public final Map<String, TickTimeStats> tickTimeStats;

        public MetricsSnapshot(Map<String, Long> counters, Map<String, TickTimeStats> tickTimeStats) {
            this.counters = counters;
            this.tickTimeStats = tickTimeStats;
        }
    }
}
