package com.cobf.complexity.report;

import com.cobf.complexity.core.ComplexityReport;
import com.cobf.complexity.core.MetricUnitRegistry;
import com.cobf.complexity.core.ProgramSnapshot;
import com.cobf.complexity.structural.metrics.CyclomaticUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReporterTest {

    @TempDir
    Path tempDir;

    private ComplexityReport report() {
        ProgramSnapshot program = ProgramSnapshot.parse("int f(int x) { if (x) return 1; return 0; }\n");
        return new MetricUnitRegistry(List.of(new CyclomaticUnit())).analyze(program, program);
    }

    @Test
    void testRenderHasOneRowPerMetric() {
        String csv = new CsvReporter().render(report());
        List<String> lines = csv.lines().toList();

        assertEquals("Unit,Metric,Value,Delta", lines.get(0));
        assertEquals(1 + 14, lines.size(), "Header plus every cyclomatic metric");
        assertTrue(lines.contains("McCabe's Cyclomatic Complexity,Rating,Simple,"), "Ratings have an empty delta");
        assertTrue(lines.contains("McCabe's Cyclomatic Complexity,Total Cyclomatic ΣM,2,+0"));
    }

    @Test
    void testGenerateCreatesParentDirectories() throws IOException {
        Path output = tempDir.resolve("out/nested/report.csv");

        new CsvReporter().generate(report(), output);

        assertTrue(Files.exists(output));
        assertTrue(Files.readString(output).startsWith("Unit,Metric,Value,Delta\n"));
    }

    @Test
    void testEscape() {
        assertEquals("", CsvReporter.escape(null));
        assertEquals("plain", CsvReporter.escape("plain"));
        assertEquals("\"a,b\"", CsvReporter.escape("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", CsvReporter.escape("say \"hi\""));
    }
}
