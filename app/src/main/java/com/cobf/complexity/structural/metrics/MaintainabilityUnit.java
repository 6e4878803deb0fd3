package com.cobf.complexity.structural.metrics;

import com.cobf.complexity.core.MetricContext;
import com.cobf.complexity.core.MetricContext.Export;
import com.cobf.complexity.core.MetricResultSet;
import com.cobf.complexity.core.MetricUnit;
import com.cobf.complexity.core.MetricValue;
import com.cobf.complexity.core.ProgramSnapshot;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static com.cobf.complexity.core.MetricFormat.decimal;
import static com.cobf.complexity.core.MetricFormat.floatDelta;

/**
 * Maintainability index combining Halstead volume, mean cyclomatic
 * complexity and line count, in its classic form and the bounded 0-100
 * variant used by Visual Studio. Comment ratio is left out of the formula.
 */
public class MaintainabilityUnit implements MetricUnit {

    public static final String NAME = "Maintainability Index";

    public static final String INDEX = "Maintainability Index";
    public static final String INDEX_RATING = "Index Rating";
    public static final String BOUNDED_INDEX = "VS Bounded Index";
    public static final String BOUNDED_RATING = "VS Index Rating";

    private static final List<String> POSITIONS = List.of(INDEX, INDEX_RATING, BOUNDED_INDEX, BOUNDED_RATING);

    private static final Map<String, String> TOOLTIPS = Map.of(
            INDEX, "MI = 171 - 5.2 x ln(V) - 0.23 x CC - 16.2 x ln(LOC)\n"
                    + "with V the Halstead volume, CC the mean cyclomatic number and LOC the line count.",
            INDEX_RATING, "Unmaintainable (65 or less), Moderate (below 85) or Maintainable.",
            BOUNDED_INDEX, "MI rescaled to 0-100: MAX(0, MI x 100 / 171)",
            BOUNDED_RATING, "Unmaintainable (below 10), Moderate (below 20) or Maintainable.");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getTooltip() {
        return "Composite of Halstead volume, cyclomatic complexity and lines of code estimating\n"
                + "how easy the program is to maintain.";
    }

    @Override
    public List<String> getPositions() {
        return POSITIONS;
    }

    @Override
    public Map<String, String> getTooltips() {
        return TOOLTIPS;
    }

    @Override
    public List<Class<? extends MetricUnit>> getPredecessors() {
        return List.of(AggregateUnit.class, CyclomaticUnit.class, HalsteadUnit.class);
    }

    public static double index(double volume, double cyclomatic, double lines) {
        return 171 - 5.2 * Math.log(volume) - 0.23 * cyclomatic - 16.2 * Math.log(lines);
    }

    public static double boundedIndex(double index) {
        return Math.max(0, index * 100 / 171);
    }

    public static String rating(double index) {
        if (index <= 65) {
            return "Unmaintainable";
        } else if (index < 85) {
            return "Moderate";
        }
        return "Maintainable";
    }

    public static String boundedRating(double boundedIndex) {
        if (boundedIndex < 10) {
            return "Unmaintainable";
        } else if (boundedIndex < 20) {
            return "Moderate";
        }
        return "Maintainable";
    }

    @Override
    public MetricResultSet calculateMetrics(ProgramSnapshot oldSource, ProgramSnapshot newSource,
            MetricContext context) {
        Optional<Export> lines = context.lookup(MetricContext.Key.LINES);
        Optional<Export> cyclomatic = context.lookup(MetricContext.Key.CYCLOMATIC_MEAN);
        Optional<Export> volume = context.lookup(MetricContext.Key.HALSTEAD_VOLUME);
        if (lines.isEmpty() || cyclomatic.isEmpty() || volume.isEmpty()) {
            return allUnavailable();
        }

        OptionalDouble newIndex = index(volume.get().newValue(), cyclomatic.get().newValue(),
                lines.get().newValue());
        if (newIndex.isEmpty()) {
            return allUnavailable();
        }
        OptionalDouble oldIndex = index(volume.get().oldValue(), cyclomatic.get().oldValue(),
                lines.get().oldValue());

        double index = newIndex.getAsDouble();
        double bounded = boundedIndex(index);
        OptionalDouble oldBounded = oldIndex.isPresent()
                ? OptionalDouble.of(boundedIndex(oldIndex.getAsDouble()))
                : OptionalDouble.empty();

        MetricResultSet result = new MetricResultSet(POSITIONS);
        result.put(INDEX, MetricValue.of(decimal(index), floatDelta(newIndex, oldIndex)));
        result.put(INDEX_RATING, MetricValue.bare(rating(index)));
        result.put(BOUNDED_INDEX, MetricValue.of(decimal(bounded), floatDelta(OptionalDouble.of(bounded), oldBounded)));
        result.put(BOUNDED_RATING, MetricValue.bare(boundedRating(bounded)));
        return result;
    }

    /**
     * Classic index of one program, empty when any input is missing or the volume is not positive.
     * A program without line breaks counts as one line.
     */
    private static OptionalDouble index(OptionalDouble volume, OptionalDouble cyclomatic, OptionalDouble lines) {
        if (volume.isEmpty() || cyclomatic.isEmpty() || lines.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (volume.getAsDouble() <= 0) {
            return OptionalDouble.empty();
        }
        double loc = Math.max(1, lines.getAsDouble());
        return OptionalDouble.of(index(volume.getAsDouble(), cyclomatic.getAsDouble(), loc));
    }

    private MetricResultSet allUnavailable() {
        MetricResultSet result = new MetricResultSet(POSITIONS);
        for (String name : POSITIONS) {
            result.put(name, MetricValue.unavailable());
        }
        return result;
    }
}
