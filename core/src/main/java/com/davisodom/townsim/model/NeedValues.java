package com.davisodom.townsim.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable set of need stats, every value clamped to [0,100].
 * Missing needs default to 100.
 */
public final class NeedValues {

    private final EnumMap<NeedType, Double> values;

    private NeedValues(EnumMap<NeedType, Double> values) {
        this.values = values;
    }

    public static NeedValues of(Map<NeedType, Double> source) {
        EnumMap<NeedType, Double> copy = new EnumMap<>(NeedType.class);
        for (NeedType need : NeedType.values()) {
            Double value = source != null ? source.get(need) : null;
            copy.put(need, NeedType.clamp(value != null ? value : NeedType.MAX));
        }
        return new NeedValues(copy);
    }

    public static NeedValues full() {
        return of(null);
    }

    public double get(NeedType need) {
        return values.get(need);
    }

    public NeedValues with(NeedType need, double value) {
        EnumMap<NeedType, Double> copy = new EnumMap<>(values);
        copy.put(need, NeedType.clamp(value));
        return new NeedValues(copy);
    }

    /**
     * Adds each delta to its need, clamping the result.
     */
    public NeedValues plus(Map<NeedType, Double> deltas) {
        EnumMap<NeedType, Double> copy = new EnumMap<>(values);
        for (Map.Entry<NeedType, Double> entry : deltas.entrySet()) {
            copy.put(entry.getKey(), NeedType.clamp(copy.get(entry.getKey()) + entry.getValue()));
        }
        return new NeedValues(copy);
    }

    public boolean anyBelow(double threshold, NeedType... needs) {
        for (NeedType need : needs) {
            if (values.get(need) < threshold) {
                return true;
            }
        }
        return false;
    }

    public Map<NeedType, Double> asMap() {
        return Collections.unmodifiableMap(new EnumMap<>(values));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NeedValues)) return false;
        return values.equals(((NeedValues) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Needs{satiety=%.1f, energy=%.1f, hygiene=%.1f, mood=%.1f, bladder=%.1f}",
                get(NeedType.SATIETY), get(NeedType.ENERGY), get(NeedType.HYGIENE),
                get(NeedType.MOOD), get(NeedType.BLADDER));
    }
}
