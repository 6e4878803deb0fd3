package com.cobf.complexity.core;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Scalars one metric unit hands to the units that depend on it.
 * A context belongs to a single (old, new) analysis session and is never
 * shared between sessions, so independent sessions can run in parallel.
 */
public class MetricContext {

    public enum Key {
        LINES,
        FUNCTIONS,
        CYCLOMATIC_MEAN,
        HALSTEAD_VOLUME
    }

    /** Exported pair; an empty side means the value is "N/A" for that program. */
    public record Export(OptionalDouble newValue, OptionalDouble oldValue) {

        public static Export of(double newValue, double oldValue) {
            return new Export(OptionalDouble.of(newValue), OptionalDouble.of(oldValue));
        }
    }

    private final Map<Key, Export> exports = new EnumMap<>(Key.class);

    public void export(Key key, OptionalDouble newValue, OptionalDouble oldValue) {
        exports.put(key, new Export(newValue, oldValue));
    }

    public void export(Key key, double newValue, double oldValue) {
        exports.put(key, Export.of(newValue, oldValue));
    }

    public Optional<Export> lookup(Key key) {
        return Optional.ofNullable(exports.get(key));
    }

    public boolean contains(Key key) {
        return exports.containsKey(key);
    }

    @Override
    public String toString() {
        return "MetricContext" + exports;
    }
}
