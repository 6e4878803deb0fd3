package com.cobf.complexity.structural.metrics;

import com.cobf.complexity.core.MetricContext;
import com.cobf.complexity.core.MetricResultSet;
import com.cobf.complexity.core.ProgramSnapshot;
import com.cobf.complexity.frontend.CParser;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class CyclomaticUnitTest {

    private static final String RECURSIVE = """
            int fib(int n)
            {
                if (n < 2) {
                    return n;
                } else {
                    return fib(n - 1) + fib(n - 2);
                }
            }

            int main()
            {
                return fib(10);
            }
            """;

    @Test
    void testRatingBands() {
        assertEquals("N/A", CyclomaticUnit.rating(OptionalDouble.empty()));
        assertEquals("Unknown", CyclomaticUnit.rating(OptionalDouble.of(0.5)));
        assertEquals("Simple", CyclomaticUnit.rating(OptionalDouble.of(1)));
        assertEquals("Simple", CyclomaticUnit.rating(OptionalDouble.of(10)));
        assertEquals("More Complex", CyclomaticUnit.rating(OptionalDouble.of(11)));
        assertEquals("More Complex", CyclomaticUnit.rating(OptionalDouble.of(20)));
        assertEquals("Complex", CyclomaticUnit.rating(OptionalDouble.of(21)));
        assertEquals("Complex", CyclomaticUnit.rating(OptionalDouble.of(50)));
        assertEquals("Untestable", CyclomaticUnit.rating(OptionalDouble.of(51)));
    }

    @Test
    void testSummary() {
        CyclomaticUnit.Summary summary = CyclomaticUnit.summarize(CParser.parse(RECURSIVE));

        assertEquals(2, summary.functions());
        assertEquals(3, summary.cyclomatic());
        assertEquals(3, summary.mccabe());
        assertEquals(3, summary.myers());
        assertEquals(5, summary.nodes());
        assertEquals(4, summary.edges());
        assertEquals(1.5, summary.mean(summary.cyclomatic()).getAsDouble());
    }

    @Test
    void testNoFunctionsHasNoMean() {
        CyclomaticUnit.Summary summary = CyclomaticUnit.summarize(CParser.parse("int x;"));
        assertEquals(0, summary.functions());
        assertTrue(summary.mean(summary.cyclomatic()).isEmpty());
    }

    @Test
    void testMetricValues() {
        MetricContext context = new MetricContext();
        MetricResultSet result = new CyclomaticUnit().calculateMetrics(
                ProgramSnapshot.parse("int x;"), ProgramSnapshot.parse(RECURSIVE), context);

        assertEquals("Simple", result.value(CyclomaticUnit.RATING));
        assertEquals("N/A", result.value(CyclomaticUnit.SOURCE_RATING), "Original has no functions");
        assertEquals("1.5", result.value(CyclomaticUnit.AVG_CYCLOMATIC));
        assertEquals("N/A", result.delta(CyclomaticUnit.AVG_CYCLOMATIC));
        assertEquals("3", result.value(CyclomaticUnit.TOTAL_ORIG));
        assertEquals("+3", result.delta(CyclomaticUnit.TOTAL_ORIG));
        assertEquals("2.5", result.value(CyclomaticUnit.AVG_NODES));
        assertEquals("2.0", result.value(CyclomaticUnit.AVG_EDGES));

        MetricContext.Export mean = context.lookup(MetricContext.Key.CYCLOMATIC_MEAN).orElseThrow();
        assertEquals(1.5, mean.newValue().getAsDouble());
        assertTrue(mean.oldValue().isEmpty());
    }
}
