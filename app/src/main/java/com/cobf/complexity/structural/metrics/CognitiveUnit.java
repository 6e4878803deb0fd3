package com.cobf.complexity.structural.metrics;

import com.cobf.complexity.core.MetricContext;
import com.cobf.complexity.core.MetricResultSet;
import com.cobf.complexity.core.MetricUnit;
import com.cobf.complexity.core.MetricValue;
import com.cobf.complexity.core.ProgramSnapshot;
import com.cobf.complexity.frontend.ast.CNode;
import com.cobf.complexity.frontend.ast.CNode.*;
import com.cobf.complexity.frontend.ast.CNodeWalker;
import com.cobf.complexity.structural.graphs.SimpleCycles;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import static com.cobf.complexity.core.MetricFormat.decimal;
import static com.cobf.complexity.core.MetricFormat.floatDelta;
import static com.cobf.complexity.core.MetricFormat.intDelta;

/**
 * Cognitive complexity of each function, adapted to C: a compound block
 * nested directly in another compound counts as a nesting structure, and
 * every function on a recursion cycle (direct or indirect) gets +1.
 */
public class CognitiveUnit implements MetricUnit {

    public static final String NAME = "Cognitive Complexity";

    public static final String AVG_COGNITIVE = "Avg. Cognitive Num";
    public static final String MAX_COGNITIVE = "Max Cognitive Num";
    public static final String TOTAL_COGNITIVE = "Total Cognitive Num";
    public static final String COGNITIVE_SD = "Cognitive SD";
    public static final String AVG_NESTING = "Avg. Nesting Depth";
    public static final String MAX_NESTING = "Max Nesting Depth";
    public static final String NESTING_SD = "Nesting SD";

    private static final List<String> POSITIONS = List.of(AVG_COGNITIVE, MAX_COGNITIVE, TOTAL_COGNITIVE,
            COGNITIVE_SD, AVG_NESTING, MAX_NESTING, NESTING_SD);

    private static final Map<String, String> TOOLTIPS = Map.of(
            AVG_COGNITIVE, "Mean cognitive complexity of the functions in the program.",
            MAX_COGNITIVE, "Cognitive complexity of the hardest function to follow.",
            TOTAL_COGNITIVE, "Cognitive complexity summed over all functions.",
            COGNITIVE_SD, "Sample standard deviation of per-function cognitive complexity.\n"
                    + "Needs at least two functions.",
            AVG_NESTING, "Mean of the deepest nesting level reached in each function.",
            MAX_NESTING, "Deepest nesting level reached anywhere in the program.",
            NESTING_SD, "Sample standard deviation of per-function nesting depth.\n"
                    + "Needs at least two functions.");

    private static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||", "^");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getTooltip() {
        return "How hard each function is to understand: control structures weighted by their nesting,\n"
                + "jumps, chains of mixed logical operators and recursion.";
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
     * Score of one function definition.
     *
     * @param cognitive  cognitive complexity, recursion surcharge included
     * @param maxNesting deepest nesting level reached in the body
     */
    public record FunctionScore(String name, int cognitive, int maxNesting) {
    }

    /**
     * Scores every function definition of a translation unit, in source order.
     */
    public static List<FunctionScore> analyze(FileAst tree) {
        List<FunctionWalk> walks = new ArrayList<>();
        Map<String, Set<String>> callGraph = new LinkedHashMap<>();
        for (CNode ext : tree.ext()) {
            if (ext instanceof FuncDef function && function.name() != null && function.body() != null) {
                FunctionWalk walk = new FunctionWalk(function.name());
                walk.walk(function.body());
                walks.add(walk);
                callGraph.computeIfAbsent(function.name(), name -> new LinkedHashSet<>()).addAll(walk.calls);
            }
        }
        // Only calls between functions defined in this file form the call graph
        callGraph.values().forEach(callees -> callees.retainAll(callGraph.keySet()));
        Set<String> recursive = SimpleCycles.verticesOnCycles(callGraph);

        List<FunctionScore> scores = new ArrayList<>();
        for (FunctionWalk walk : walks) {
            int surcharge = recursive.contains(walk.name) ? 1 : 0;
            scores.add(new FunctionScore(walk.name, walk.cognitive + surcharge, walk.maxNesting));
        }
        return scores;
    }

    @Override
    public MetricResultSet calculateMetrics(ProgramSnapshot oldSource, ProgramSnapshot newSource,
            MetricContext context) {
        List<FunctionScore> now = analyze(newSource.tree());
        List<FunctionScore> before = analyze(oldSource.tree());
        List<Integer> newCognitive = now.stream().map(FunctionScore::cognitive).toList();
        List<Integer> oldCognitive = before.stream().map(FunctionScore::cognitive).toList();
        List<Integer> newNesting = now.stream().map(FunctionScore::maxNesting).toList();
        List<Integer> oldNesting = before.stream().map(FunctionScore::maxNesting).toList();

        MetricResultSet result = new MetricResultSet(POSITIONS);
        putDecimal(result, AVG_COGNITIVE, mean(newCognitive), mean(oldCognitive));
        putInteger(result, MAX_COGNITIVE, max(newCognitive), max(oldCognitive));
        putInteger(result, TOTAL_COGNITIVE, sum(newCognitive), sum(oldCognitive));
        putDecimal(result, COGNITIVE_SD, sampleDeviation(newCognitive), sampleDeviation(oldCognitive));
        putDecimal(result, AVG_NESTING, mean(newNesting), mean(oldNesting));
        putInteger(result, MAX_NESTING, max(newNesting), max(oldNesting));
        putDecimal(result, NESTING_SD, sampleDeviation(newNesting), sampleDeviation(oldNesting));
        return result;
    }

    private static void putDecimal(MetricResultSet result, String name, OptionalDouble newValue,
            OptionalDouble oldValue) {
        result.put(name, MetricValue.of(decimal(newValue), floatDelta(newValue, oldValue)));
    }

    private static void putInteger(MetricResultSet result, String name, int newValue, int oldValue) {
        result.put(name, MetricValue.of(Integer.toString(newValue), intDelta(newValue, oldValue)));
    }

    static int sum(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).sum();
    }

    static int max(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    static OptionalDouble mean(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).average();
    }

    /** Sample standard deviation; empty for fewer than two values. */
    static OptionalDouble sampleDeviation(List<Integer> values) {
        if (values.size() < 2) {
            return OptionalDouble.empty();
        }
        double mean = mean(values).orElseThrow();
        double squares = 0.0;
        for (int value : values) {
            squares += (value - mean) * (value - mean);
        }
        return OptionalDouble.of(Math.sqrt(squares / (values.size() - 1)));
    }

    private static boolean isLogical(CNode node) {
        return node instanceof BinaryOp op && LOGICAL_OPERATORS.contains(op.op());
    }

    /**
     * Walks one function body, keeping the nesting level, the running score,
     * the current run of identical logical operators and the names called.
     */
    private static final class FunctionWalk extends CNodeWalker {
        private final String name;
        private final Set<String> calls = new LinkedHashSet<>();
        private int cognitive;
        private int nesting;
        private int maxNesting;
        private String runOperator;
        private int runLength;

        FunctionWalk(String name) {
            this.name = name;
        }

        private void nested(CNode body) {
            nesting++;
            maxNesting = Math.max(maxNesting, nesting);
            walk(body);
            nesting--;
        }

        private Void structure(CNode node) {
            cognitive += 1 + nesting;
            nesting++;
            maxNesting = Math.max(maxNesting, nesting);
            visitChildren(node);
            nesting--;
            return null;
        }

        @Override
        public Void visit(Compound node) {
            for (CNode item : node.blockItems()) {
                if (item instanceof Compound) {
                    cognitive += 1 + nesting;
                    nested(item);
                } else {
                    walk(item);
                }
            }
            return null;
        }

        @Override
        public Void visit(If node) {
            // "else if" is charged by the inner if itself
            if (node.iffalse() != null && !(node.iffalse() instanceof If)) {
                cognitive += 1 + nesting;
            }
            return structure(node);
        }

        @Override
        public Void visit(For node) {
            return structure(node);
        }

        @Override
        public Void visit(While node) {
            return structure(node);
        }

        @Override
        public Void visit(DoWhile node) {
            return structure(node);
        }

        @Override
        public Void visit(Switch node) {
            return structure(node);
        }

        @Override
        public Void visit(TernaryOp node) {
            return structure(node);
        }

        @Override
        public Void visit(Goto node) {
            cognitive++;
            return null;
        }

        @Override
        public Void visit(Break node) {
            cognitive++;
            return null;
        }

        @Override
        public Void visit(Continue node) {
            cognitive++;
            return null;
        }

        @Override
        public Void visit(FuncCall node) {
            if (node.name() instanceof Id callee) {
                calls.add(callee.name());
            }
            return defaultVisit(node);
        }

        @Override
        public Void visit(BinaryOp node) {
            if (!LOGICAL_OPERATORS.contains(node.op())) {
                return defaultVisit(node);
            }
            if (runLength == 0) {
                runOperator = node.op();
                runLength = 1;
            } else if (node.op().equals(runOperator)) {
                runLength++;
            } else {
                // a different operator closes the previous run
                cognitive++;
                runOperator = node.op();
                runLength = 1;
            }
            if (!isLogical(node.left()) && !isLogical(node.right())) {
                cognitive++;
                runOperator = null;
                runLength = 0;
            }
            return defaultVisit(node);
        }
    }
}
