package com.cobf.complexity.structural.graphs;

import com.cobf.complexity.structural.cfg.ControlFlowGraph;
import com.cobf.complexity.structural.cfg.FunctionFlow;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders function control-flow graphs as Graphviz DOT digraphs.
 */
public class CfgDotExporter {

    public String generateDot(FunctionFlow flow) {
        ControlFlowGraph graph = flow.graph();
        StringBuilder dot = new StringBuilder();
        dot.append("digraph \"").append(escape(flow.name())).append("\" {\n");
        dot.append("  node [shape=box];\n");
        dot.append("  label=\"").append(escape(flow.name()))
                .append(" (M = ").append(graph.cyclomatic()).append(")\";\n");

        for (int node : graph.nodes()) {
            dot.append("  \"").append(node).append("\"");
            if (node == graph.entry() && node == graph.exit()) {
                dot.append(" [label=\"entry/exit\", style=filled, color=lightgrey]");
            } else if (node == graph.entry()) {
                dot.append(" [label=\"entry\", style=filled, color=lightgrey]");
            } else if (node == graph.exit()) {
                dot.append(" [label=\"exit\", style=filled, color=lightgrey]");
            }
            dot.append(";\n");
        }

        for (int node : graph.nodes()) {
            for (int target : graph.successors(node)) {
                dot.append("  \"").append(node).append("\" -> \"").append(target).append("\";\n");
            }
        }

        dot.append("}\n");
        return dot.toString();
    }

    /**
     * Writes one {@code <function>.dot} file per flow into the directory.
     *
     * @return the files written, in flow order
     */
    public List<Path> export(List<FunctionFlow> flows, Path directory) throws IOException {
        Files.createDirectories(directory);
        List<Path> written = new ArrayList<>();
        for (FunctionFlow flow : flows) {
            Path file = directory.resolve(fileName(flow.name(), written.size()));
            Files.writeString(file, generateDot(flow));
            written.add(file);
        }
        return written;
    }

    // Redefinitions share a name, so every file is numbered
    private String fileName(String function, int index) {
        String safe = function.replaceAll("[^A-Za-z0-9_]", "_");
        return "%02d_%s.dot".formatted(index, safe);
    }

    private String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
