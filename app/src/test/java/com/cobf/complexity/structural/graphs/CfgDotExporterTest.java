package com.cobf.complexity.structural.graphs;

import com.cobf.complexity.frontend.CParser;
import com.cobf.complexity.structural.cfg.CfgBuilder;
import com.cobf.complexity.structural.cfg.FunctionFlow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CfgDotExporterTest {

    @TempDir
    Path tempDir;

    private static List<FunctionFlow> flows(String source) {
        return new CfgBuilder().build(CParser.parse(source));
    }

    @Test
    void testDotContainsBlocksAndEdges() {
        FunctionFlow flow = flows("int f(int x) { if (x) return 1; return 0; }").get(0);

        String dot = new CfgDotExporter().generateDot(flow);

        assertTrue(dot.startsWith("digraph \"f\" {\n"));
        assertTrue(dot.contains("label=\"f (M = 2)\";"));
        assertTrue(dot.contains("\"0\" [label=\"entry\", style=filled, color=lightgrey];"));
        assertTrue(dot.contains("\"1\" [label=\"exit\", style=filled, color=lightgrey];"));
        long edges = dot.lines().filter(line -> line.contains("->")).count();
        assertEquals(flow.graph().edgeCount(), edges);
        assertTrue(dot.endsWith("}\n"));
    }

    @Test
    void testCollapsedGraphHasSingleEntryExitNode() {
        String dot = new CfgDotExporter().generateDot(flows("int main() { return 0; }").get(0));

        assertTrue(dot.contains("\"0\" [label=\"entry/exit\", style=filled, color=lightgrey];"));
        assertFalse(dot.contains("->"));
    }

    @Test
    void testExportWritesNumberedFiles() throws IOException {
        Path output = tempDir.resolve("graphs");
        List<Path> written = new CfgDotExporter().export(
                flows("int first(void) { return 1; } int second(void) { return 2; }"), output);

        assertEquals(List.of(output.resolve("00_first.dot"), output.resolve("01_second.dot")), written);
        assertTrue(Files.readString(written.get(1)).startsWith("digraph \"second\""));
    }
}
