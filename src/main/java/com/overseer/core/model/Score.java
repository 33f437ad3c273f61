package com.overseer.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-dimension scores in {@code [MIN, MAX]} plus their weighted aggregate.
 * Dimensions that could not be scored are listed in {@code unscorable} and absent from {@code values}.
 */
public record Score(
    Map<Dimension, Double> values,
    Set<Dimension> unscorable,
    double aggregate
) implements Serializable {

    public static final double MIN = 0.0;
    public static final double MAX = 10.0;

    public Score {
        var copy = new EnumMap<Dimension, Double>(Dimension.class);
        if (values != null) {
            copy.putAll(values);
        }
        values = Collections.unmodifiableMap(copy);
        var missing = EnumSet.noneOf(Dimension.class);
        if (unscorable != null) {
            missing.addAll(unscorable);
        }
        unscorable = Collections.unmodifiableSet(missing);
    }

    public double get(Dimension dimension) {
        return values.getOrDefault(dimension, MIN);
    }

    public boolean fullyScored() {
        return unscorable.isEmpty();
    }

    public static double clamp(double value) {
        return Math.max(MIN, Math.min(MAX, value));
    }
}
