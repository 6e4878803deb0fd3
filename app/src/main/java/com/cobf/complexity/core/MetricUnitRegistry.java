package com.cobf.complexity.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Registry of metric units.
 * Runs units so that declared predecessors come first and threads one fresh
 * {@link MetricContext} through each analysis session.
 */
public class MetricUnitRegistry {

    private final List<MetricUnit> units;

    public MetricUnitRegistry(List<MetricUnit> units) {
        this.units = orderByPredecessors(units);
    }

    private static List<MetricUnit> orderByPredecessors(List<MetricUnit> units) {
        List<MetricUnit> ordered = new ArrayList<>();
        Set<MetricUnit> visiting = new HashSet<>();
        for (MetricUnit unit : units) {
            place(unit, units, ordered, visiting);
        }
        return List.copyOf(ordered);
    }

    // Depth-first: registered predecessors are placed before the unit, otherwise registration order is kept
    private static void place(MetricUnit unit, List<MetricUnit> all, List<MetricUnit> ordered,
            Set<MetricUnit> visiting) {
        if (ordered.contains(unit)) {
            return;
        }
        if (!visiting.add(unit)) {
            throw new IllegalStateException("Metric units have cyclic predecessors: " + unit.getName());
        }
        for (Class<? extends MetricUnit> predecessor : unit.getPredecessors()) {
            for (MetricUnit candidate : all) {
                if (predecessor.isInstance(candidate)) {
                    place(candidate, all, ordered, visiting);
                }
            }
        }
        visiting.remove(unit);
        ordered.add(unit);
    }

    /**
     * Units in the order they run.
     */
    public List<MetricUnit> getUnits() {
        return units;
    }

    /**
     * Analyses one (old, new) pair with every registered unit.
     */
    public ComplexityReport analyze(ProgramSnapshot oldSource, ProgramSnapshot newSource) {
        MetricContext context = new MetricContext();
        List<ComplexityReport.UnitResult> results = new ArrayList<>();
        for (MetricUnit unit : units) {
            results.add(new ComplexityReport.UnitResult(unit, unit.calculateMetrics(oldSource, newSource, context)));
        }
        return new ComplexityReport(results, context);
    }

    /**
     * Print summary of registered units.
     */
    public void printSummary() {
        System.out.println("Metric units:");
        for (MetricUnit unit : units) {
            System.out.printf("  [%s] %d metrics%n", unit.getName(), unit.getPositions().size());
        }
    }
}
