package com.cobf.complexity.structural.metrics;

import com.cobf.complexity.core.MetricContext;
import com.cobf.complexity.core.MetricResultSet;
import com.cobf.complexity.core.MetricUnit;
import com.cobf.complexity.core.MetricValue;
import com.cobf.complexity.core.ProgramSnapshot;
import com.cobf.complexity.frontend.CLexer;
import com.cobf.complexity.frontend.CToken;
import com.cobf.complexity.frontend.CTokenType;
import com.cobf.complexity.frontend.ast.CNode;
import com.cobf.complexity.frontend.ast.CNode.*;
import com.cobf.complexity.frontend.ast.CNodeWalker;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import static com.cobf.complexity.core.MetricFormat.decimal;
import static com.cobf.complexity.core.MetricFormat.duration;
import static com.cobf.complexity.core.MetricFormat.floatDelta;
import static com.cobf.complexity.core.MetricFormat.intDelta;
import static com.cobf.complexity.core.MetricFormat.integer;

/**
 * Halstead's complexity measures over the regenerated program text.
 *
 * Literals are operands and keywords and punctuators are operators. Closing
 * delimiters are skipped since their opening partner is already counted.
 * Identifier tokens are ambiguous, so they are classified from the syntax
 * tree instead: function names at definitions and call sites are operators,
 * every other name is an operand.
 */
public class HalsteadUnit implements MetricUnit {

    public static final String NAME = "Halstead Complexity Measures";

    public static final String VOCABULARY = "Vocabulary (η)";
    public static final String LENGTH = "Length (N)";
    public static final String ESTIMATED_LENGTH = "Estimated Length (N̂)";
    public static final String VOLUME = "Volume (V)";
    public static final String DIFFICULTY = "Difficulty (D)";
    public static final String EFFORT = "Effort (E)";
    public static final String ESTIMATED_TIME = "Estimated Time (T)";
    public static final String DELIVERED_BUGS = "Delivered Bugs (B)";

    public static final double DEFAULT_STROUD_NUMBER = 18.0;

    private static final List<String> POSITIONS = List.of(VOCABULARY, LENGTH, ESTIMATED_LENGTH, VOLUME,
            DIFFICULTY, EFFORT, ESTIMATED_TIME, DELIVERED_BUGS);

    private static final Map<String, String> TOOLTIPS = Map.of(
            VOCABULARY, "Number of distinct operators and operands: η = η1 + η2",
            LENGTH, "Total number of operators and operands: N = N1 + N2",
            ESTIMATED_LENGTH, "Program length predicted from the vocabulary: N̂ = η1 log2(η1) + η2 log2(η2)",
            VOLUME, "Size of the program in bits: V = N log2(η)",
            DIFFICULTY, "Error proneness of writing the program: D = (η1 / 2) x (N2 / η2)",
            EFFORT, "Mental effort to write the program: E = D x V",
            ESTIMATED_TIME, "Time to write the program: T = E / S, with S the Stroud number",
            DELIVERED_BUGS, "Estimated number of bugs in the program: B = E^(2/3) / 3000");

    private static final Set<String> CLOSING_PUNCTUATORS = Set.of(")", "]", "}", ":");

    private final double stroudNumber;

    public HalsteadUnit() {
        this(DEFAULT_STROUD_NUMBER);
    }

    /**
     * @param stroudNumber elementary mental discriminations per second used for the time estimate
     */
    public HalsteadUnit(double stroudNumber) {
        if (stroudNumber <= 0) {
            throw new IllegalArgumentException("Stroud number must be positive: " + stroudNumber);
        }
        this.stroudNumber = stroudNumber;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getTooltip() {
        return "Measures derived from the number of distinct and total operators and operands,\n"
                + "estimating the size, difficulty and effort of writing the program.";
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
     * Operator and operand counts of one program, with the measures derived
     * from them. A measure is empty when its formula is undefined.
     */
    public record Counts(int operators, int operands, int uniqueOperators, int uniqueOperands) {

        public int vocabulary() {
            return uniqueOperators + uniqueOperands;
        }

        public int length() {
            return operators + operands;
        }

        public OptionalDouble estimatedLength() {
            if (uniqueOperators == 0) {
                return OptionalDouble.empty();
            }
            double operandTerm = uniqueOperands == 0 ? 0.0 : uniqueOperands * log2(uniqueOperands);
            return OptionalDouble.of(uniqueOperators * log2(uniqueOperators) + operandTerm);
        }

        public OptionalDouble volume() {
            if (vocabulary() == 0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(length() * log2(vocabulary()));
        }

        public OptionalDouble difficulty() {
            if (uniqueOperands == 0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of((uniqueOperators / 2.0) * ((double) operands / uniqueOperands));
        }

        public OptionalDouble effort() {
            OptionalDouble difficulty = difficulty();
            OptionalDouble volume = volume();
            if (difficulty.isEmpty() || volume.isEmpty()) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(difficulty.getAsDouble() * volume.getAsDouble());
        }

        /** Whole seconds needed to write the program. */
        public OptionalDouble time(double stroudNumber) {
            OptionalDouble effort = effort();
            return effort.isPresent() ? OptionalDouble.of(Math.floor(effort.getAsDouble() / stroudNumber))
                    : OptionalDouble.empty();
        }

        public OptionalDouble bugs() {
            OptionalDouble effort = effort();
            return effort.isPresent() ? OptionalDouble.of(Math.pow(effort.getAsDouble(), 2.0 / 3.0) / 3000.0)
                    : OptionalDouble.empty();
        }

        private static double log2(double value) {
            return Math.log(value) / Math.log(2);
        }
    }

    /**
     * Counts operators and operands of a program from its regenerated text
     * and its syntax tree.
     */
    public static Counts count(ProgramSnapshot program) {
        OperatorCounter counter = new OperatorCounter();
        for (CToken token : CLexer.lex(program.regenerated())) {
            if (token.type().isLiteral()) {
                counter.operand(token.value());
            } else if (token.type() != CTokenType.IDENTIFIER && token.type() != CTokenType.PREPROCESSOR
                    && !CLOSING_PUNCTUATORS.contains(token.value())) {
                counter.operator(token.value());
            }
        }
        counter.walk(program.tree());
        return new Counts(counter.operators, counter.operands, counter.uniqueOperators.size(),
                counter.uniqueOperands.size());
    }

    @Override
    public MetricResultSet calculateMetrics(ProgramSnapshot oldSource, ProgramSnapshot newSource,
            MetricContext context) {
        Counts now = count(newSource);
        Counts before = count(oldSource);
        MetricResultSet result = new MetricResultSet(POSITIONS);

        result.put(VOCABULARY, MetricValue.of(Integer.toString(now.vocabulary()),
                intDelta(now.vocabulary(), before.vocabulary())));
        result.put(LENGTH, MetricValue.of(Integer.toString(now.length()), intDelta(now.length(), before.length())));
        putTruncated(result, ESTIMATED_LENGTH, now.estimatedLength(), before.estimatedLength());
        putTruncated(result, VOLUME, now.volume(), before.volume());
        putTruncated(result, DIFFICULTY, now.difficulty(), before.difficulty());
        putTruncated(result, EFFORT, now.effort(), before.effort());
        result.put(ESTIMATED_TIME, MetricValue.bare(duration(now.time(stroudNumber))));
        result.put(DELIVERED_BUGS, MetricValue.of(decimal(now.bugs()), floatDelta(now.bugs(), before.bugs())));

        context.export(MetricContext.Key.HALSTEAD_VOLUME, now.volume(), before.volume());
        return result;
    }

    private static void putTruncated(MetricResultSet result, String name, OptionalDouble newValue,
            OptionalDouble oldValue) {
        result.put(name, MetricValue.of(integer(newValue), intDelta(newValue, oldValue)));
    }

    /**
     * Accumulates lexical counts, then classifies identifiers by walking the tree.
     */
    private static final class OperatorCounter extends CNodeWalker {
        private int operators;
        private int operands;
        private final Set<String> uniqueOperators = new HashSet<>();
        private final Set<String> uniqueOperands = new HashSet<>();

        void operator(String lexeme) {
            if (lexeme != null) {
                operators++;
                uniqueOperators.add(lexeme);
            }
        }

        void operand(String lexeme) {
            if (lexeme != null) {
                operands++;
                uniqueOperands.add(lexeme);
            }
        }

        @Override
        public Void visit(FuncDef node) {
            operator(node.name());
            walk(node.body());
            return null;
        }

        @Override
        public Void visit(FuncCall node) {
            if (node.name() instanceof Id callee) {
                operator(callee.name());
                walk(node.args());
                return null;
            }
            return defaultVisit(node);
        }

        @Override
        public Void visit(Decl node) {
            operand(node.name());
            return defaultVisit(node);
        }

        @Override
        public Void visit(Typedef node) {
            operand(node.name());
            return defaultVisit(node);
        }

        @Override
        public Void visit(Struct node) {
            operand(node.name());
            return defaultVisit(node);
        }

        @Override
        public Void visit(Union node) {
            operand(node.name());
            return defaultVisit(node);
        }

        @Override
        public Void visit(CNode.Enum node) {
            operand(node.name());
            return defaultVisit(node);
        }

        @Override
        public Void visit(Enumerator node) {
            operand(node.name());
            return defaultVisit(node);
        }

        @Override
        public Void visit(Id node) {
            operand(node.name());
            return null;
        }
    }
}
