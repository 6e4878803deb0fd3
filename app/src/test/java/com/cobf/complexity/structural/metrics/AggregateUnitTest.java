package com.cobf.complexity.structural.metrics;

import com.cobf.complexity.core.MetricContext;
import com.cobf.complexity.core.MetricResultSet;
import com.cobf.complexity.core.ProgramSnapshot;
import com.cobf.complexity.frontend.CParser;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AggregateUnitTest {

    private static final String PROGRAM = """
            int x;
            int main()
            {
                int y = 1;
                if (y)
                    y = 2;
                return y;
            }
            """;

    @Test
    void testTreeCounts() {
        AggregateUnit.TreeCounts counts = AggregateUnit.countTree(CParser.parse(PROGRAM));

        assertEquals(1, counts.functions());
        assertEquals(6, counts.statements(), "Two top-level items, three block items and the if branch");
        assertEquals(4.0, counts.statementsPerFunction().getAsDouble());
        assertEquals(2, counts.constants());
        assertEquals(Set.of("x", "main", "y"), counts.identifiers());
    }

    @Test
    void testNoFunctionsHasNoStatementsPerFunction() {
        assertTrue(AggregateUnit.countTree(CParser.parse("int x;")).statementsPerFunction().isEmpty());
    }

    @Test
    void testLineAndByteCounting() {
        assertEquals(0, AggregateUnit.countLines("int main() {}"));
        assertEquals(8, AggregateUnit.countLines(PROGRAM));
        assertEquals(3, AggregateUnit.byteSize("abc"));
    }

    @Test
    void testMetricValues() {
        MetricContext context = new MetricContext();
        ProgramSnapshot program = ProgramSnapshot.parse(PROGRAM);

        MetricResultSet result = new AggregateUnit().calculateMetrics(program, program, context);

        assertEquals("8", result.value(AggregateUnit.LINES));
        assertEquals("+0", result.delta(AggregateUnit.LINES));
        assertEquals("1", result.value(AggregateUnit.FUNCTIONS));
        assertEquals("6", result.value(AggregateUnit.STATEMENTS));
        assertEquals("4.0", result.value(AggregateUnit.STATEMENTS_PER_FUNCTION));
        assertEquals("+0.0", result.delta(AggregateUnit.STATEMENTS_PER_FUNCTION));
        assertEquals("3", result.value(AggregateUnit.IDENTIFIERS));
        assertEquals("0", result.value(AggregateUnit.NEW_IDENTIFIERS));
        assertNull(result.delta(AggregateUnit.NEW_IDENTIFIERS));
        assertTrue(result.value(AggregateUnit.FILE_SIZE).endsWith("B"));
        assertEquals("+0.0B", result.delta(AggregateUnit.FILE_SIZE));

        assertEquals(8.0, context.lookup(MetricContext.Key.LINES).orElseThrow().newValue().getAsDouble());
    }

    @Test
    void testNewIdentifiersAndBinarySize() {
        String longer = "int a;\nint b[] = {" + "1, ".repeat(600) + "2};\n";
        MetricResultSet result = new AggregateUnit(true).calculateMetrics(
                ProgramSnapshot.parse("int a;\n"), ProgramSnapshot.parse(longer), new MetricContext());

        assertEquals("1", result.value(AggregateUnit.NEW_IDENTIFIERS));
        assertTrue(result.value(AggregateUnit.FILE_SIZE).endsWith("KiB"), result.value(AggregateUnit.FILE_SIZE));
        assertEquals("+0", result.delta(AggregateUnit.FUNCTIONS));
    }
}
