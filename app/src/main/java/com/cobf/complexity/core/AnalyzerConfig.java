package com.cobf.complexity.core;

import com.cobf.complexity.structural.metrics.AggregateUnit;
import com.cobf.complexity.structural.metrics.CognitiveUnit;
import com.cobf.complexity.structural.metrics.CyclomaticUnit;
import com.cobf.complexity.structural.metrics.HalsteadUnit;
import com.cobf.complexity.structural.metrics.MaintainabilityUnit;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Configuration for a complexity analysis.
 * Loaded from complexity.yaml or uses sensible defaults.
 */
public class AnalyzerConfig {

    public static final String FILE_NAME = "complexity.yaml";

    public static final List<String> ALL_UNITS = List.of(
            "aggregates", "cyclomatic", "cognitive", "halstead", "maintainability");

    // Enabled metric units, in display order
    private List<String> units = ALL_UNITS;

    // Formatting
    private boolean binarySuffix = false;
    private double stroudNumber = HalsteadUnit.DEFAULT_STROUD_NUMBER;

    // Report outputs, disabled when null
    private Path csvReport = null;
    private Path graphsDirectory = null;

    /**
     * Load configuration from complexity.yaml in the given directory or return defaults.
     */
    public static AnalyzerConfig load(Path directory) {
        Path configFile = directory.resolve(FILE_NAME);
        if (Files.exists(configFile)) {
            return loadFile(configFile);
        }
        return new AnalyzerConfig();
    }

    /**
     * Load configuration from an explicit YAML file, falling back to defaults
     * when it cannot be read.
     */
    public static AnalyzerConfig loadFile(Path configFile) {
        AnalyzerConfig config = new AnalyzerConfig();
        try (InputStream is = Files.newInputStream(configFile)) {
            Yaml yaml = new Yaml();
            Map<String, Object> data = yaml.load(is);
            if (data != null) {
                config.parseYaml(data);
            }
            System.out.println("Loaded configuration from: " + configFile);
        } catch (IOException e) {
            System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
        }
        return config;
    }

    /**
     * Default configuration.
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig();
    }

    @SuppressWarnings("unchecked")
    private void parseYaml(Map<String, Object> data) {
        if (data.containsKey("units")) {
            List<Object> unitList = (List<Object>) data.get("units");
            if (unitList != null) {
                List<String> enabled = new ArrayList<>();
                for (Object entry : unitList) {
                    String name = String.valueOf(entry).toLowerCase(Locale.ROOT);
                    if (!ALL_UNITS.contains(name)) {
                        System.err.println("Warning: Ignoring unknown metric unit: " + entry);
                    } else if (!enabled.contains(name)) {
                        enabled.add(name);
                    }
                }
                units = List.copyOf(enabled);
            }
        }

        if (data.containsKey("file_size")) {
            Map<String, Object> fs = (Map<String, Object>) data.get("file_size");
            if (fs != null) {
                binarySuffix = getBool(fs, "binary_suffix", binarySuffix);
            }
        }

        if (data.containsKey("halstead")) {
            Map<String, Object> hs = (Map<String, Object>) data.get("halstead");
            if (hs != null) {
                double stroud = getDouble(hs, "stroud_number", stroudNumber);
                if (stroud > 0) {
                    stroudNumber = stroud;
                } else {
                    System.err.println("Warning: Ignoring non-positive stroud_number: " + stroud);
                }
            }
        }

        if (data.containsKey("report")) {
            Map<String, Object> report = (Map<String, Object>) data.get("report");
            if (report != null) {
                csvReport = getPath(report, "csv", csvReport);
                graphsDirectory = getPath(report, "graphs", graphsDirectory);
            }
        }
    }

    private double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).doubleValue();
        return defaultVal;
    }

    private boolean getBool(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean)
            return (Boolean) val;
        return defaultVal;
    }

    private Path getPath(Map<String, Object> map, String key, Path defaultVal) {
        Object val = map.get(key);
        if (val instanceof String && !((String) val).isBlank())
            return Path.of((String) val);
        return defaultVal;
    }

    /**
     * Instantiates the enabled metric units.
     */
    public List<MetricUnit> buildUnits() {
        List<MetricUnit> result = new ArrayList<>();
        for (String name : units) {
            switch (name) {
                case "aggregates" -> result.add(new AggregateUnit(binarySuffix));
                case "cyclomatic" -> result.add(new CyclomaticUnit());
                case "cognitive" -> result.add(new CognitiveUnit());
                case "halstead" -> result.add(new HalsteadUnit(stroudNumber));
                case "maintainability" -> result.add(new MaintainabilityUnit());
                default -> throw new IllegalStateException("Unknown metric unit: " + name);
            }
        }
        return result;
    }

    // === Getters ===

    public List<String> getUnits() {
        return units;
    }

    public boolean isBinarySuffix() {
        return binarySuffix;
    }

    public double getStroudNumber() {
        return stroudNumber;
    }

    public Path getCsvReport() {
        return csvReport;
    }

    public Path getGraphsDirectory() {
        return graphsDirectory;
    }

    public AnalyzerConfig withCsvReport(Path path) {
        this.csvReport = path;
        return this;
    }

    public AnalyzerConfig withGraphsDirectory(Path path) {
        this.graphsDirectory = path;
        return this;
    }
}
