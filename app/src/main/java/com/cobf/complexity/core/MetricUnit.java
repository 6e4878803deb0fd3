package com.cobf.complexity.core;

import java.util.List;
import java.util.Map;

/**
 * Plugin interface for one family of complexity metrics.
 * Implementations are stateless: every call analyses the given pair from
 * scratch, and anything shared with other units goes through the
 * {@link MetricContext} of the session.
 */
public interface MetricUnit {

    /**
     * Display name of the metric family (e.g., "Halstead Complexity Measures").
     */
    String getName();

    /**
     * Short description of what the family measures.
     */
    String getTooltip();

    /**
     * Metric names in display order.
     */
    List<String> getPositions();

    /**
     * Description of each metric, keyed by metric name.
     */
    default Map<String, String> getTooltips() {
        return Map.of();
    }

    /**
     * Units whose exports this unit reads from the context. They must have
     * run for the same pair first; the unit reports "N/A" when they have not.
     */
    default List<Class<? extends MetricUnit>> getPredecessors() {
        return List.of();
    }

    /**
     * Compares the original program with the transformed one.
     *
     * @param oldSource the program before transformation
     * @param newSource the program after transformation
     * @param context   exports of this session, read and written by units
     * @return the metric values in declared order
     */
    MetricResultSet calculateMetrics(ProgramSnapshot oldSource, ProgramSnapshot newSource, MetricContext context);

    /**
     * Result reported when nothing could be computed: every metric is "N/A".
     */
    default MetricResultSet unavailable() {
        MetricResultSet result = new MetricResultSet(getPositions());
        for (String name : getPositions()) {
            result.put(name, MetricValue.bare(MetricValue.NOT_AVAILABLE));
        }
        return result;
    }
}
