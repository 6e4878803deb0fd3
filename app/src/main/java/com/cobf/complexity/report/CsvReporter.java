package com.cobf.complexity.report;

import com.cobf.complexity.core.ComplexityReport;
import com.cobf.complexity.core.MetricValue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes every metric of a report as one CSV row: unit, metric, value, delta.
 */
public class CsvReporter {

    public String render(ComplexityReport report) {
        StringBuilder csv = new StringBuilder();
        // Header
        csv.append("Unit,Metric,Value,Delta\n");

        // Rows
        for (ComplexityReport.UnitResult unit : report.units()) {
            for (Map.Entry<String, MetricValue> entry : unit.metrics().asMap().entrySet()) {
                MetricValue value = entry.getValue();
                csv.append(String.format("%s,%s,%s,%s\n",
                        escape(unit.name()),
                        escape(entry.getKey()),
                        escape(value.value()),
                        escape(value.delta())));
            }
        }
        return csv.toString();
    }

    public void generate(ComplexityReport report, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, render(report));
        System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
    }

    static String escape(String s) {
        if (s == null)
            return "";
        // Quote fields holding separators, quotes or line breaks
        if (s.contains(",") || s.contains("\"") || s.contains("\n")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
