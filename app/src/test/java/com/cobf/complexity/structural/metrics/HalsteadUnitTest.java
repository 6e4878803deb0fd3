package com.cobf.complexity.structural.metrics;

import com.cobf.complexity.core.MetricContext;
import com.cobf.complexity.core.MetricResultSet;
import com.cobf.complexity.core.ProgramSnapshot;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HalsteadUnitTest {

    @Test
    void testCountsOfDeclaration() {
        HalsteadUnit.Counts counts = HalsteadUnit.count(ProgramSnapshot.parse("int x = 1;"));

        // operators: int = ;   operands: x 1
        assertEquals(new HalsteadUnit.Counts(3, 2, 3, 2), counts);
        assertEquals(5, counts.vocabulary());
        assertEquals(5, counts.length());
        assertEquals(5 * Math.log(5) / Math.log(2), counts.volume().getAsDouble(), 1e-9);
        assertEquals(1.5, counts.difficulty().getAsDouble(), 1e-9);
    }

    @Test
    void testFunctionNamesAreOperators() {
        HalsteadUnit.Counts counts = HalsteadUnit.count(ProgramSnapshot.parse("int main() {}"));

        // int ( { main
        assertEquals(new HalsteadUnit.Counts(4, 0, 4, 0), counts);
        assertEquals(8.0, counts.volume().getAsDouble(), 1e-9);
        assertTrue(counts.difficulty().isEmpty(), "No operands means no difficulty");
        assertTrue(counts.effort().isEmpty());
        assertTrue(counts.bugs().isEmpty());
        assertEquals(8.0, counts.estimatedLength().getAsDouble(), 1e-9);
    }

    @Test
    void testCalleeIsOperatorAndArgumentsOperands() {
        HalsteadUnit.Counts counts = HalsteadUnit.count(ProgramSnapshot.parse("void f(int a) { g(a, a); }"));

        // operators: void ( int { ( , ; f g    operands: a a
        // the parameter name is lexed as an identifier outside the body and not counted
        assertEquals(9, counts.operators());
        assertEquals(2, counts.operands());
        assertEquals(8, counts.uniqueOperators());
        assertEquals(1, counts.uniqueOperands());
    }

    @Test
    void testEmptyProgramHasNoMeasures() {
        HalsteadUnit.Counts counts = HalsteadUnit.count(ProgramSnapshot.parse(""));
        assertEquals(0, counts.vocabulary());
        assertTrue(counts.volume().isEmpty());
        assertTrue(counts.estimatedLength().isEmpty());
        assertTrue(counts.time(HalsteadUnit.DEFAULT_STROUD_NUMBER).isEmpty());
    }

    @Test
    void testTimeIsWholeSeconds() {
        HalsteadUnit.Counts counts = new HalsteadUnit.Counts(10, 10, 4, 2);
        double effort = counts.effort().getAsDouble();
        assertEquals(Math.floor(effort / 18), counts.time(18).getAsDouble());
        assertEquals(Math.floor(effort / 5), counts.time(5).getAsDouble());
    }

    @Test
    void testNonPositiveStroudNumberIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HalsteadUnit(0));
    }

    @Test
    void testLongerProgramHasLargerVolume() {
        double small = HalsteadUnit.count(ProgramSnapshot.parse("int f(int a) { return a; }")).volume().getAsDouble();
        double large = HalsteadUnit.count(ProgramSnapshot.parse("int f(int a) { a = a * 3 + 1; return a; }"))
                .volume().getAsDouble();
        assertTrue(large > small);
    }

    @Test
    void testMetricValues() {
        MetricContext context = new MetricContext();
        MetricResultSet result = new HalsteadUnit().calculateMetrics(
                ProgramSnapshot.parse("int main() {}"), ProgramSnapshot.parse("int x = 1;"), context);

        assertEquals("5", result.value(HalsteadUnit.VOCABULARY));
        assertEquals("+1", result.delta(HalsteadUnit.VOCABULARY));
        assertEquals("6", result.value(HalsteadUnit.ESTIMATED_LENGTH));
        assertEquals("-1", result.delta(HalsteadUnit.ESTIMATED_LENGTH));
        assertEquals("11", result.value(HalsteadUnit.VOLUME));
        assertEquals("+3", result.delta(HalsteadUnit.VOLUME));
        assertEquals("1", result.value(HalsteadUnit.DIFFICULTY));
        assertEquals("N/A", result.delta(HalsteadUnit.DIFFICULTY), "Original has no operands");
        assertEquals("17", result.value(HalsteadUnit.EFFORT));
        assertEquals("0s", result.value(HalsteadUnit.ESTIMATED_TIME));
        assertNull(result.delta(HalsteadUnit.ESTIMATED_TIME));
        assertEquals("0.0", result.value(HalsteadUnit.DELIVERED_BUGS));

        MetricContext.Export volume = context.lookup(MetricContext.Key.HALSTEAD_VOLUME).orElseThrow();
        assertEquals(8.0, volume.oldValue().getAsDouble(), 1e-9);
    }
}
