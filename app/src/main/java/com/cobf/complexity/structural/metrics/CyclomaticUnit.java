package com.cobf.complexity.structural.metrics;

import com.cobf.complexity.core.MetricContext;
import com.cobf.complexity.core.MetricResultSet;
import com.cobf.complexity.core.MetricUnit;
import com.cobf.complexity.core.MetricValue;
import com.cobf.complexity.core.ProgramSnapshot;
import com.cobf.complexity.frontend.ast.CNode.FileAst;
import com.cobf.complexity.structural.cfg.CfgBuilder;
import com.cobf.complexity.structural.cfg.FunctionFlow;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static com.cobf.complexity.core.MetricFormat.decimal;
import static com.cobf.complexity.core.MetricFormat.floatDelta;
import static com.cobf.complexity.core.MetricFormat.intDelta;

/**
 * McCabe's cyclomatic complexity in three flavours: the structural number
 * E - N + 2 of each function's control-flow graph, the original decision
 * count + 1, and Myers' interval which also counts logical operators in
 * conditions.
 */
public class CyclomaticUnit implements MetricUnit {

    public static final String NAME = "McCabe's Cyclomatic Complexity";

    public static final String RATING = "Rating";
    public static final String ORIG_RATING = "Orig. Rating";
    public static final String SOURCE_RATING = "Source Rating";
    public static final String ORIG_SOURCE_RATING = "Orig. Source Rating";
    public static final String AVG_CYCLOMATIC = "Avg. Cyclomatic M̅";
    public static final String AVG_ORIG = "Avg. Orig. M̅";
    public static final String AVG_MYERS = "Avg. Myers' Interval";
    public static final String TOTAL_CYCLOMATIC = "Total Cyclomatic ΣM";
    public static final String TOTAL_ORIG = "Total Orig. ΣM";
    public static final String TOTAL_MYERS = "Total Myers' Interval";
    public static final String AVG_NODES = "Avg. Nodes (N̅)";
    public static final String AVG_EDGES = "Avg. Edges (E̅)";
    public static final String TOTAL_NODES = "Total Nodes (ΣN)";
    public static final String TOTAL_EDGES = "Total Edges (ΣE)";

    private static final List<String> POSITIONS = List.of(RATING, ORIG_RATING, SOURCE_RATING, ORIG_SOURCE_RATING,
            AVG_CYCLOMATIC, AVG_ORIG, AVG_MYERS, TOTAL_CYCLOMATIC, TOTAL_ORIG, TOTAL_MYERS,
            AVG_NODES, AVG_EDGES, TOTAL_NODES, TOTAL_EDGES);

    private static final String BANDS = "\nBands: Simple (1-10), More Complex (11-20), Complex (21-50), Untestable (51+).";

    private static final Map<String, String> TOOLTIPS = Map.ofEntries(
            Map.entry(RATING, "Band of the mean structural cyclomatic number." + BANDS),
            Map.entry(ORIG_RATING, "Band of the mean original (decision count) cyclomatic number." + BANDS),
            Map.entry(SOURCE_RATING, "Band of the mean structural cyclomatic number of the original program." + BANDS),
            Map.entry(ORIG_SOURCE_RATING, "Band of the mean original cyclomatic number of the original program."
                    + BANDS),
            Map.entry(AVG_CYCLOMATIC, "Mean of E - N + 2 over the control-flow graphs of all functions.\n"
                    + "Multiple returns, gotos and unreachable code all affect the graph."),
            Map.entry(AVG_ORIG, "Mean of decisions + 1 over all functions, counting conditions and case labels."),
            Map.entry(AVG_MYERS, "Mean Myers' interval: decisions + 1 plus each logical operator in a condition."),
            Map.entry(TOTAL_CYCLOMATIC, "Sum of E - N + 2 over all functions."),
            Map.entry(TOTAL_ORIG, "Sum of decisions + 1 over all functions."),
            Map.entry(TOTAL_MYERS, "Sum of Myers' intervals over all functions."),
            Map.entry(AVG_NODES, "Mean number of basic blocks per function."),
            Map.entry(AVG_EDGES, "Mean number of jumps between basic blocks per function."),
            Map.entry(TOTAL_NODES, "Total number of basic blocks."),
            Map.entry(TOTAL_EDGES, "Total number of jumps between basic blocks."));

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getTooltip() {
        return "Number of independent paths through each function, with McCabe's original\n"
                + "structured definition and Myers' extension for compound conditions.";
    }

    @Override
    public List<String> getPositions() {
        return POSITIONS;
    }

    @Override
    public Map<String, String> getTooltips() {
        return TOOLTIPS;
    }

    /**
     * Band of a cyclomatic value; "N/A" when there are no functions to rate.
     */
    public static String rating(OptionalDouble value) {
        if (value.isEmpty()) {
            return MetricValue.NOT_AVAILABLE;
        }
        double m = value.getAsDouble();
        if (m < 1) {
            return "Unknown";
        } else if (m <= 10) {
            return "Simple";
        } else if (m <= 20) {
            return "More Complex";
        } else if (m <= 50) {
            return "Complex";
        }
        return "Untestable";
    }

    /**
     * Per-program sums over all analysed functions.
     */
    public record Summary(int functions, long cyclomatic, long mccabe, long myers, long nodes, long edges) {

        public static Summary of(List<FunctionFlow> flows) {
            long cyclomatic = 0;
            long mccabe = 0;
            long myers = 0;
            long nodes = 0;
            long edges = 0;
            for (FunctionFlow flow : flows) {
                cyclomatic += flow.graph().cyclomatic();
                mccabe += flow.mccabe();
                myers += flow.myers();
                nodes += flow.graph().nodeCount();
                edges += flow.graph().edgeCount();
            }
            return new Summary(flows.size(), cyclomatic, mccabe, myers, nodes, edges);
        }

        public OptionalDouble mean(long total) {
            return functions == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) total / functions);
        }
    }

    public static Summary summarize(FileAst tree) {
        return Summary.of(new CfgBuilder().build(tree));
    }

    @Override
    public MetricResultSet calculateMetrics(ProgramSnapshot oldSource, ProgramSnapshot newSource,
            MetricContext context) {
        Summary now = summarize(newSource.tree());
        Summary before = summarize(oldSource.tree());
        MetricResultSet result = new MetricResultSet(POSITIONS);

        OptionalDouble newMean = now.mean(now.cyclomatic());
        OptionalDouble oldMean = before.mean(before.cyclomatic());
        result.put(RATING, MetricValue.bare(rating(newMean)));
        result.put(ORIG_RATING, MetricValue.bare(rating(now.mean(now.mccabe()))));
        result.put(SOURCE_RATING, MetricValue.bare(rating(oldMean)));
        result.put(ORIG_SOURCE_RATING, MetricValue.bare(rating(before.mean(before.mccabe()))));

        putMean(result, AVG_CYCLOMATIC, newMean, oldMean);
        putMean(result, AVG_ORIG, now.mean(now.mccabe()), before.mean(before.mccabe()));
        putMean(result, AVG_MYERS, now.mean(now.myers()), before.mean(before.myers()));
        putTotal(result, TOTAL_CYCLOMATIC, now.cyclomatic(), before.cyclomatic());
        putTotal(result, TOTAL_ORIG, now.mccabe(), before.mccabe());
        putTotal(result, TOTAL_MYERS, now.myers(), before.myers());
        putMean(result, AVG_NODES, now.mean(now.nodes()), before.mean(before.nodes()));
        putMean(result, AVG_EDGES, now.mean(now.edges()), before.mean(before.edges()));
        putTotal(result, TOTAL_NODES, now.nodes(), before.nodes());
        putTotal(result, TOTAL_EDGES, now.edges(), before.edges());

        context.export(MetricContext.Key.CYCLOMATIC_MEAN, newMean, oldMean);
        return result;
    }

    private static void putMean(MetricResultSet result, String name, OptionalDouble newValue,
            OptionalDouble oldValue) {
        result.put(name, MetricValue.of(decimal(newValue), floatDelta(newValue, oldValue)));
    }

    private static void putTotal(MetricResultSet result, String name, long newValue, long oldValue) {
        result.put(name, MetricValue.of(Long.toString(newValue), intDelta(newValue, oldValue)));
    }
}
