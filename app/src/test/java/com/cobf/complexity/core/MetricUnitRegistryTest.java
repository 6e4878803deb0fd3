package com.cobf.complexity.core;

import com.cobf.complexity.structural.metrics.AggregateUnit;
import com.cobf.complexity.structural.metrics.CognitiveUnit;
import com.cobf.complexity.structural.metrics.CyclomaticUnit;
import com.cobf.complexity.structural.metrics.HalsteadUnit;
import com.cobf.complexity.structural.metrics.MaintainabilityUnit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricUnitRegistryTest {

    /** Minimal unit; subclasses only name themselves and their predecessors. */
    abstract static class StubUnit implements MetricUnit {
        @Override
        public String getTooltip() {
            return "";
        }

        @Override
        public List<String> getPositions() {
            return List.of("Value");
        }

        @Override
        public MetricResultSet calculateMetrics(ProgramSnapshot oldSource, ProgramSnapshot newSource,
                MetricContext context) {
            return unavailable();
        }
    }

    static class PingUnit extends StubUnit {
        @Override
        public String getName() {
            return "Ping";
        }

        @Override
        public List<Class<? extends MetricUnit>> getPredecessors() {
            return List.of(PongUnit.class);
        }
    }

    static class PongUnit extends StubUnit {
        @Override
        public String getName() {
            return "Pong";
        }

        @Override
        public List<Class<? extends MetricUnit>> getPredecessors() {
            return List.of(PingUnit.class);
        }
    }

    @Test
    void testPredecessorsRunFirst() {
        MetricUnitRegistry registry = new MetricUnitRegistry(List.of(new MaintainabilityUnit(), new HalsteadUnit(),
                new AggregateUnit(), new CyclomaticUnit(), new CognitiveUnit()));

        List<String> order = registry.getUnits().stream().map(MetricUnit::getName).toList();

        assertEquals(List.of(AggregateUnit.NAME, CyclomaticUnit.NAME, HalsteadUnit.NAME, MaintainabilityUnit.NAME,
                CognitiveUnit.NAME), order);
    }

    @Test
    void testRegistrationOrderKeptWithoutPredecessors() {
        MetricUnitRegistry registry = new MetricUnitRegistry(List.of(new CognitiveUnit(), new AggregateUnit()));

        assertEquals(List.of(CognitiveUnit.NAME, AggregateUnit.NAME),
                registry.getUnits().stream().map(MetricUnit::getName).toList());
    }

    @Test
    void testCyclicPredecessorsAreRejected() {
        assertThrows(IllegalStateException.class,
                () -> new MetricUnitRegistry(List.of(new PingUnit(), new PongUnit())));
    }

    @Test
    void testEverySessionGetsFreshContext() {
        MetricUnitRegistry registry = new MetricUnitRegistry(List.of(new AggregateUnit()));
        ProgramSnapshot program = ProgramSnapshot.parse("int main()\n{\n    return 0;\n}\n");

        ComplexityReport first = registry.analyze(program, program);
        ComplexityReport second = registry.analyze(program, program);

        assertNotSame(first.context(), second.context());
        assertTrue(first.context().contains(MetricContext.Key.LINES));
        assertFalse(first.context().contains(MetricContext.Key.HALSTEAD_VOLUME),
                "Only units that ran may export");
    }

    @Test
    void testMaintainabilityAloneIsNotAvailable() {
        MetricUnitRegistry registry = new MetricUnitRegistry(List.of(new MaintainabilityUnit()));
        ProgramSnapshot program = ProgramSnapshot.parse("int main()\n{\n    return 0;\n}\n");

        MetricResultSet result = registry.analyze(program, program).find(MaintainabilityUnit.class).orElseThrow();

        assertEquals("N/A", result.value(MaintainabilityUnit.INDEX));
        assertEquals("N/A", result.delta(MaintainabilityUnit.INDEX));
        assertEquals("N/A", result.value(MaintainabilityUnit.BOUNDED_RATING));
    }
}
