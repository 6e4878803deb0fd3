package com.cobf.complexity;

import com.cobf.complexity.core.AnalyzerConfig;
import com.cobf.complexity.core.ComplexityReport;
import com.cobf.complexity.core.MetricUnitRegistry;
import com.cobf.complexity.core.MetricValue;
import com.cobf.complexity.core.ProgramSnapshot;
import com.cobf.complexity.report.CsvReporter;
import com.cobf.complexity.structural.cfg.CfgBuilder;
import com.cobf.complexity.structural.graphs.CfgDotExporter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * C Complexity Metrics - compares an original C program with its transformed
 * version.
 *
 * Usage: java -jar app.jar <old.c> <new.c> [--config <file>] [--csv <file>] [--graphs <dir>]
 */
public class App {

    public static void main(String[] args) {
        System.out.println("=== C Complexity Metrics ===");

        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage();
            System.exit(1);
        }

        try {
            new App().run(cliArgs);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: java -jar app.jar <old.c> <new.c> [--config <file>] [--csv <file>] [--graphs <dir>]

                Arguments:
                  <old.c>            Original C program (required)
                  <new.c>            Transformed C program (required)
                  --config <file>    YAML configuration (default: ./complexity.yaml if present)
                  --csv <file>       Write all metrics to a CSV report
                  --graphs <dir>     Write a Graphviz DOT file per function of the new program
                """);
    }

    record CliArgs(
            Path oldFile,
            Path newFile,
            Path configFile,
            Path csvFile,
            Path graphsDir) {
    }

    static CliArgs parseArgs(String[] args) {
        Path oldFile = null;
        Path newFile = null;
        Path configFile = null;
        Path csvFile = null;
        Path graphsDir = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> {
                    if (i + 1 < args.length)
                        configFile = Path.of(args[++i]);
                }
                case "--csv" -> {
                    if (i + 1 < args.length)
                        csvFile = Path.of(args[++i]);
                }
                case "--graphs" -> {
                    if (i + 1 < args.length)
                        graphsDir = Path.of(args[++i]);
                }
                default -> {
                    if (args[i].startsWith("--")) {
                        System.err.println("Warning: Ignoring unknown option: " + args[i]);
                    } else if (oldFile == null) {
                        oldFile = Path.of(args[i]);
                    } else if (newFile == null) {
                        newFile = Path.of(args[i]);
                    } else {
                        System.err.println("Warning: Ignoring extra argument: " + args[i]);
                    }
                }
            }
        }

        if (oldFile == null || newFile == null) {
            return null;
        }
        return new CliArgs(oldFile, newFile, configFile, csvFile, graphsDir);
    }

    private void run(CliArgs args) throws Exception {
        AnalyzerConfig config = args.configFile() != null
                ? AnalyzerConfig.loadFile(args.configFile())
                : AnalyzerConfig.load(Path.of("."));
        if (args.csvFile() != null) {
            config = config.withCsvReport(args.csvFile());
        }
        if (args.graphsDir() != null) {
            config = config.withGraphsDirectory(args.graphsDir());
        }

        System.out.println("\n>>> INITIALIZING METRIC UNITS <<<");
        MetricUnitRegistry registry = new MetricUnitRegistry(config.buildUnits());
        registry.printSummary();

        // Phase 1: Parsing
        System.out.println("\n>>> PHASE 1: PARSING PROGRAMS <<<");
        ProgramSnapshot oldSource = read(args.oldFile());
        ProgramSnapshot newSource = read(args.newFile());

        // Phase 2: Metrics
        System.out.println("\n>>> PHASE 2: COMPUTING METRICS <<<");
        ComplexityReport report = registry.analyze(oldSource, newSource);
        printReport(report);

        // Phase 3: Reports
        if (config.getCsvReport() != null || config.getGraphsDirectory() != null) {
            System.out.println("\n>>> PHASE 3: GENERATING REPORTS <<<");
        }
        if (config.getCsvReport() != null) {
            new CsvReporter().generate(report, config.getCsvReport());
        }
        if (config.getGraphsDirectory() != null) {
            List<Path> written = new CfgDotExporter()
                    .export(new CfgBuilder().build(newSource.tree()), config.getGraphsDirectory());
            System.out.printf("Wrote %d control-flow graphs to: %s%n", written.size(),
                    config.getGraphsDirectory().toAbsolutePath());
        }
    }

    private ProgramSnapshot read(Path file) throws Exception {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Not a readable file: " + file);
        }
        ProgramSnapshot snapshot = ProgramSnapshot.read(file);
        System.out.printf("  %-40s %6d lines%n", file, snapshot.source().lines().count());
        return snapshot;
    }

    private void printReport(ComplexityReport report) {
        for (ComplexityReport.UnitResult unit : report.units()) {
            System.out.println("\n=== " + unit.name().toUpperCase() + " ===");
            System.out.println("| %-32s | %-18s | %-10s |".formatted("Metric", "Value", "Delta"));
            System.out.println("|" + "-".repeat(34) + "|" + "-".repeat(20) + "|" + "-".repeat(12) + "|");
            for (Map.Entry<String, MetricValue> entry : unit.metrics().asMap().entrySet()) {
                MetricValue value = entry.getValue();
                System.out.println("| %-32s | %-18s | %-10s |".formatted(
                        entry.getKey(),
                        value.value(),
                        value.hasDelta() ? value.delta() : ""));
            }
        }
    }
}
