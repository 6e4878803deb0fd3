package com.cobf.complexity.core;

import java.util.List;
import java.util.Optional;

/**
 * Results of one (old, new) analysis session, in the order the units ran.
 */
public record ComplexityReport(List<UnitResult> units, MetricContext context) {

    public record UnitResult(MetricUnit unit, MetricResultSet metrics) {
        public String name() {
            return unit.getName();
        }
    }

    public ComplexityReport {
        units = List.copyOf(units);
    }

    public Optional<MetricResultSet> find(Class<? extends MetricUnit> unitType) {
        return units.stream()
                .filter(u -> unitType.isInstance(u.unit()))
                .map(UnitResult::metrics)
                .findFirst();
    }
}
