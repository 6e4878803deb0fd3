package com.cobf.complexity.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Metric values of one unit, always iterated in the unit's declared display
 * order regardless of the order they were computed in.
 */
public class MetricResultSet {

    private final List<String> positions;
    private final Map<String, MetricValue> values = new HashMap<>();

    public MetricResultSet(List<String> positions) {
        this.positions = List.copyOf(positions);
    }

    /**
     * Records a value for a declared metric.
     *
     * @throws IllegalArgumentException if the name is not one of the declared positions
     */
    public MetricResultSet put(String name, MetricValue value) {
        if (!positions.contains(name)) {
            throw new IllegalArgumentException("Undeclared metric: " + name);
        }
        values.put(name, value);
        return this;
    }

    public Optional<MetricValue> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /** Value column of a metric, or null when it was not computed. */
    public String value(String name) {
        MetricValue value = values.get(name);
        return value == null ? null : value.value();
    }

    /** Delta column of a metric, or null when it was not computed or has no delta. */
    public String delta(String name) {
        MetricValue value = values.get(name);
        return value == null ? null : value.delta();
    }

    public Map<String, MetricValue> asMap() {
        Map<String, MetricValue> ordered = new LinkedHashMap<>();
        for (String name : positions) {
            MetricValue value = values.get(name);
            if (value != null) {
                ordered.put(name, value);
            }
        }
        return Collections.unmodifiableMap(ordered);
    }

    public List<String> names() {
        return List.copyOf(asMap().keySet());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
