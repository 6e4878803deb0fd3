package com.cobf.complexity.core;

import com.cobf.complexity.structural.metrics.AggregateUnit;
import com.cobf.complexity.structural.metrics.CognitiveUnit;
import com.cobf.complexity.structural.metrics.CyclomaticUnit;
import com.cobf.complexity.structural.metrics.HalsteadUnit;
import com.cobf.complexity.structural.metrics.MaintainabilityUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs every unit over an original program and a transformed one that adds a
 * recursive function.
 */
class ComplexityEndToEndTest {

    private static final String ORIGINAL = """
            int main()
            {
                return 0;
            }
            """;

    private static final String TRANSFORMED = """
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

    private ComplexityReport analyze() {
        MetricUnitRegistry registry = new MetricUnitRegistry(AnalyzerConfig.defaults().buildUnits());
        return registry.analyze(ProgramSnapshot.parse(ORIGINAL), ProgramSnapshot.parse(TRANSFORMED));
    }

    @Test
    void testAllUnitsReport() {
        ComplexityReport report = analyze();
        assertEquals(5, report.units().size());
        for (ComplexityReport.UnitResult unit : report.units()) {
            assertEquals(unit.unit().getPositions(), unit.metrics().names(),
                    "Every metric of " + unit.name() + " should be reported in declared order");
        }
    }

    @Test
    void testAggregates() {
        MetricResultSet aggregates = analyze().find(AggregateUnit.class).orElseThrow();
        assertEquals("2", aggregates.value(AggregateUnit.FUNCTIONS));
        assertEquals("+1", aggregates.delta(AggregateUnit.FUNCTIONS));
        assertEquals("13", aggregates.value(AggregateUnit.LINES));
        assertEquals("+9", aggregates.delta(AggregateUnit.LINES));
    }

    @Test
    void testCyclomatic() {
        MetricResultSet cyclomatic = analyze().find(CyclomaticUnit.class).orElseThrow();
        assertEquals("Simple", cyclomatic.value(CyclomaticUnit.RATING));
        assertNull(cyclomatic.delta(CyclomaticUnit.RATING), "Ratings carry no delta");
        assertEquals("1.5", cyclomatic.value(CyclomaticUnit.AVG_CYCLOMATIC));
        assertEquals("+0.5", cyclomatic.delta(CyclomaticUnit.AVG_CYCLOMATIC));
        assertEquals("3", cyclomatic.value(CyclomaticUnit.TOTAL_CYCLOMATIC));
        assertEquals("+2", cyclomatic.delta(CyclomaticUnit.TOTAL_CYCLOMATIC));
        assertEquals("5", cyclomatic.value(CyclomaticUnit.TOTAL_NODES));
        assertEquals("4", cyclomatic.value(CyclomaticUnit.TOTAL_EDGES));
    }

    @Test
    void testCognitiveCountsRecursion() {
        MetricResultSet cognitive = analyze().find(CognitiveUnit.class).orElseThrow();
        assertEquals("3", cognitive.value(CognitiveUnit.TOTAL_COGNITIVE));
        assertEquals("+3", cognitive.delta(CognitiveUnit.TOTAL_COGNITIVE));
        assertEquals("3", cognitive.value(CognitiveUnit.MAX_COGNITIVE));
        assertEquals("1.5", cognitive.value(CognitiveUnit.AVG_COGNITIVE));
        assertEquals("N/A", cognitive.delta(CognitiveUnit.COGNITIVE_SD), "One original function has no deviation");
    }

    @Test
    void testMaintainabilityUsesExports() {
        ComplexityReport report = analyze();
        MetricResultSet maintainability = report.find(MaintainabilityUnit.class).orElseThrow();

        assertTrue(maintainability.get(MaintainabilityUnit.INDEX).orElseThrow().isAvailable());
        assertNotEquals("N/A", maintainability.delta(MaintainabilityUnit.INDEX));
        assertNotNull(maintainability.value(MaintainabilityUnit.INDEX_RATING));
        assertTrue(report.context().contains(MetricContext.Key.HALSTEAD_VOLUME));
        assertTrue(report.find(HalsteadUnit.class).isPresent());
    }

    @Test
    void testEmptyMainAsOriginal() {
        MetricUnitRegistry registry = new MetricUnitRegistry(AnalyzerConfig.defaults().buildUnits());
        ComplexityReport report = registry.analyze(ProgramSnapshot.parse("int main() {}"),
                ProgramSnapshot.parse(TRANSFORMED));

        MetricResultSet aggregates = report.find(AggregateUnit.class).orElseThrow();
        assertEquals("2", aggregates.value(AggregateUnit.FUNCTIONS));
        assertEquals("+1", aggregates.delta(AggregateUnit.FUNCTIONS));

        MetricResultSet halstead = report.find(HalsteadUnit.class).orElseThrow();
        assertTrue(halstead.delta(HalsteadUnit.VOCABULARY).startsWith("+"));
        assertNotEquals("+0", halstead.delta(HalsteadUnit.VOCABULARY));
        assertNotEquals("+0", halstead.delta(HalsteadUnit.LENGTH));

        MetricResultSet maintainability = report.find(MaintainabilityUnit.class).orElseThrow();
        assertTrue(maintainability.get(MaintainabilityUnit.INDEX).orElseThrow().isAvailable());
        String delta = maintainability.delta(MaintainabilityUnit.INDEX);
        assertTrue(delta.matches("[+-]\\d+\\.\\d"), "A one-line original still has an index to compare with: " + delta);
        assertTrue(maintainability.delta(MaintainabilityUnit.BOUNDED_INDEX).matches("[+-]\\d+\\.\\d"));
    }
}
