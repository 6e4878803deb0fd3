package com.cobf.complexity.structural.metrics;

import com.cobf.complexity.core.MetricContext;
import com.cobf.complexity.core.MetricResultSet;
import com.cobf.complexity.core.ProgramSnapshot;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class MaintainabilityUnitTest {

    private static final ProgramSnapshot PROGRAM = ProgramSnapshot.parse("int main() {}");

    private static MetricResultSet calculate(MetricContext context) {
        return new MaintainabilityUnit().calculateMetrics(PROGRAM, PROGRAM, context);
    }

    private static MetricContext context(double lines, double cyclomatic, double volume) {
        MetricContext context = new MetricContext();
        context.export(MetricContext.Key.LINES, lines, lines);
        context.export(MetricContext.Key.CYCLOMATIC_MEAN, cyclomatic, cyclomatic);
        context.export(MetricContext.Key.HALSTEAD_VOLUME, volume, volume);
        return context;
    }

    @Test
    void testFormula() {
        assertEquals(171.0, MaintainabilityUnit.index(1, 0, 1), 1e-9);
        assertEquals(171 - 5.2 * Math.log(100) - 0.46 - 16.2 * Math.log(10),
                MaintainabilityUnit.index(100, 2, 10), 1e-9);
        assertEquals(100.0, MaintainabilityUnit.boundedIndex(171), 1e-9);
        assertEquals(0.0, MaintainabilityUnit.boundedIndex(-20), "Bounded index never goes negative");
    }

    @Test
    void testRatingBoundaries() {
        assertEquals("Unmaintainable", MaintainabilityUnit.rating(65));
        assertEquals("Moderate", MaintainabilityUnit.rating(65.1));
        assertEquals("Moderate", MaintainabilityUnit.rating(84.9));
        assertEquals("Maintainable", MaintainabilityUnit.rating(85));

        assertEquals("Unmaintainable", MaintainabilityUnit.boundedRating(9.9));
        assertEquals("Moderate", MaintainabilityUnit.boundedRating(10));
        assertEquals("Maintainable", MaintainabilityUnit.boundedRating(20));
    }

    @Test
    void testMissingExportsGiveNotAvailable() {
        MetricContext context = new MetricContext();
        context.export(MetricContext.Key.LINES, 10, 10);

        MetricResultSet result = calculate(context);

        for (String name : new MaintainabilityUnit().getPositions()) {
            assertEquals("N/A", result.value(name), name);
            assertEquals("N/A", result.delta(name), name);
        }
    }

    @Test
    void testIndexFromExports() {
        MetricResultSet result = calculate(context(10, 2, 100));

        assertEquals("109.3", result.value(MaintainabilityUnit.INDEX));
        assertEquals("+0.0", result.delta(MaintainabilityUnit.INDEX));
        assertEquals("Maintainable", result.value(MaintainabilityUnit.INDEX_RATING));
        assertEquals("63.9", result.value(MaintainabilityUnit.BOUNDED_INDEX));
        assertEquals("Maintainable", result.value(MaintainabilityUnit.BOUNDED_RATING));
        assertNull(result.delta(MaintainabilityUnit.BOUNDED_RATING));
    }

    @Test
    void testSingleLineOriginalCountsAsOneLine() {
        MetricContext context = context(10, 2, 100);
        context.export(MetricContext.Key.LINES, 10, 0);

        MetricResultSet result = calculate(context);

        assertEquals("109.3", result.value(MaintainabilityUnit.INDEX));
        assertEquals("-37.3", result.delta(MaintainabilityUnit.INDEX), "Zero line breaks is ln(1), not undefined");
        assertEquals("-21.8", result.delta(MaintainabilityUnit.BOUNDED_INDEX));
    }

    @Test
    void testZeroOriginalVolumeOnlyLosesDeltas() {
        MetricContext context = context(10, 2, 100);
        context.export(MetricContext.Key.HALSTEAD_VOLUME, 100, 0);

        MetricResultSet result = calculate(context);

        assertEquals("109.3", result.value(MaintainabilityUnit.INDEX));
        assertEquals("N/A", result.delta(MaintainabilityUnit.INDEX));
        assertEquals("N/A", result.delta(MaintainabilityUnit.BOUNDED_INDEX));
    }

    @Test
    void testEmptyTransformedProgramGivesNotAvailable() {
        MetricContext context = context(10, 2, 100);
        context.export(MetricContext.Key.HALSTEAD_VOLUME, OptionalDouble.empty(), OptionalDouble.of(100));

        assertEquals("N/A", calculate(context).value(MaintainabilityUnit.INDEX_RATING));
    }
}
