package com.cobf.complexity.structural.metrics;

import com.cobf.complexity.core.MetricContext;
import com.cobf.complexity.core.MetricResultSet;
import com.cobf.complexity.core.MetricUnit;
import com.cobf.complexity.core.MetricValue;
import com.cobf.complexity.core.ProgramSnapshot;
import com.cobf.complexity.frontend.CLexer;
import com.cobf.complexity.frontend.ast.CNode;
import com.cobf.complexity.frontend.ast.CNode.*;
import com.cobf.complexity.frontend.ast.CNodeWalker;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import static com.cobf.complexity.core.MetricFormat.decimal;
import static com.cobf.complexity.core.MetricFormat.fileSize;
import static com.cobf.complexity.core.MetricFormat.floatDelta;
import static com.cobf.complexity.core.MetricFormat.intDelta;

/**
 * Size and count metrics: lines, tokens, statements, identifiers and the like.
 * Exports line and function counts for the maintainability index.
 */
public class AggregateUnit implements MetricUnit {

    public static final String NAME = "Aggregates";

    public static final String FILE_SIZE = "File Size";
    public static final String LINES = "Lines";
    public static final String TOKENS = "Tokens";
    public static final String CHARACTERS = "Characters";
    public static final String FUNCTIONS = "Functions";
    public static final String STATEMENTS = "Statements";
    public static final String STATEMENTS_PER_FUNCTION = "Stmts/Function";
    public static final String AST_NODES = "AST Nodes";
    public static final String CONSTANTS = "Constants";
    public static final String IDENTIFIERS = "Identifiers";
    public static final String NEW_IDENTIFIERS = "New Identifiers";

    private static final List<String> POSITIONS = List.of(FILE_SIZE, LINES, TOKENS, CHARACTERS, FUNCTIONS,
            STATEMENTS, STATEMENTS_PER_FUNCTION, AST_NODES, CONSTANTS, IDENTIFIERS, NEW_IDENTIFIERS);

    private static final Map<String, String> TOOLTIPS = Map.ofEntries(
            Map.entry(FILE_SIZE, "Estimated size of the program text, one byte per character."),
            Map.entry(LINES, "Number of newline characters in the source."),
            Map.entry(TOKENS, "Number of lexical tokens in the regenerated source."),
            Map.entry(CHARACTERS, "Number of characters in the regenerated source."),
            Map.entry(FUNCTIONS, "Number of function definitions, not counting prototypes."),
            Map.entry(STATEMENTS, "Number of statements, top-level declarations and function definitions included.\n"
                    + "Compound blocks are not statements themselves; their contents are."),
            Map.entry(STATEMENTS_PER_FUNCTION, "Mean number of statements inside each function body."),
            Map.entry(AST_NODES, "Number of nodes in the syntax tree."),
            Map.entry(CONSTANTS, "Number of numeric, character and string literals."),
            Map.entry(IDENTIFIERS, "Number of distinct identifier names in the whole program."),
            Map.entry(NEW_IDENTIFIERS, "Identifiers of the transformed program absent from the original."));

    private final boolean binarySuffix;

    public AggregateUnit() {
        this(false);
    }

    /**
     * @param binarySuffix report file sizes in KiB/MiB/... instead of KB/MB/...
     */
    public AggregateUnit(boolean binarySuffix) {
        this.binarySuffix = binarySuffix;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getTooltip() {
        return "Simple counts describing the size, density and identifier diversity of the program.";
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
     * Counts gathered in one pass over a syntax tree.
     */
    public record TreeCounts(int constants, int astNodes, int functions, Set<String> identifiers, int statements,
            int functionStatements) {

        public OptionalDouble statementsPerFunction() {
            return functions == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) functionStatements / functions);
        }
    }

    public static TreeCounts countTree(FileAst tree) {
        CountingWalker walker = new CountingWalker();
        walker.walk(tree);
        return new TreeCounts(walker.constants, countNodes(tree), walker.functions, Set.copyOf(walker.identifiers),
                walker.statements, walker.functionStatements);
    }

    static int countNodes(CNode node) {
        int count = 1;
        for (CNode child : node.children()) {
            count += countNodes(child);
        }
        return count;
    }

    static int countLines(String source) {
        return (int) source.chars().filter(c -> c == '\n').count();
    }

    static int byteSize(String text) {
        return text.getBytes(StandardCharsets.ISO_8859_1).length;
    }

    @Override
    public MetricResultSet calculateMetrics(ProgramSnapshot oldSource, ProgramSnapshot newSource,
            MetricContext context) {
        MetricResultSet result = new MetricResultSet(POSITIONS);

        int newSize = byteSize(newSource.regenerated());
        int oldSize = byteSize(oldSource.regenerated());
        result.put(FILE_SIZE, MetricValue.of(fileSize(newSize, binarySuffix, false),
                fileSize((long) newSize - oldSize, binarySuffix, true)));

        int newLines = countLines(newSource.source());
        int oldLines = countLines(oldSource.source());
        putCount(result, LINES, newLines, oldLines);

        putCount(result, TOKENS, CLexer.lex(newSource.regenerated()).size(),
                CLexer.lex(oldSource.regenerated()).size());
        putCount(result, CHARACTERS, newSource.regenerated().length(), oldSource.regenerated().length());

        TreeCounts newCounts = countTree(newSource.tree());
        TreeCounts oldCounts = countTree(oldSource.tree());
        putCount(result, FUNCTIONS, newCounts.functions(), oldCounts.functions());
        putCount(result, STATEMENTS, newCounts.statements(), oldCounts.statements());
        OptionalDouble newPerFunction = newCounts.statementsPerFunction();
        result.put(STATEMENTS_PER_FUNCTION, MetricValue.of(decimal(newPerFunction),
                floatDelta(newPerFunction, oldCounts.statementsPerFunction())));
        putCount(result, AST_NODES, newCounts.astNodes(), oldCounts.astNodes());
        putCount(result, CONSTANTS, newCounts.constants(), oldCounts.constants());
        putCount(result, IDENTIFIERS, newCounts.identifiers().size(), oldCounts.identifiers().size());

        Set<String> introduced = new HashSet<>(newCounts.identifiers());
        introduced.removeAll(oldCounts.identifiers());
        result.put(NEW_IDENTIFIERS, MetricValue.bare(Integer.toString(introduced.size())));

        context.export(MetricContext.Key.LINES, newLines, oldLines);
        context.export(MetricContext.Key.FUNCTIONS, newCounts.functions(), oldCounts.functions());
        return result;
    }

    private static void putCount(MetricResultSet result, String name, int newValue, int oldValue) {
        result.put(name, MetricValue.of(Integer.toString(newValue), intDelta(newValue, oldValue)));
    }

    private static final class CountingWalker extends CNodeWalker {
        private int constants;
        private int functions;
        private int statements;
        private int functionStatements;
        private boolean inFunction;
        private final Set<String> identifiers = new HashSet<>();

        private void statement(CNode node) {
            if (node != null && !(node instanceof Compound)) {
                statements++;
                if (inFunction) {
                    functionStatements++;
                }
            }
        }

        private void identifier(String name) {
            if (name != null) {
                identifiers.add(name);
            }
        }

        @Override
        public Void visit(FileAst node) {
            node.ext().forEach(this::statement);
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(FuncDef node) {
            functions++;
            inFunction = true;
            visitChildren(node);
            inFunction = false;
            return null;
        }

        @Override
        public Void visit(Compound node) {
            node.blockItems().forEach(this::statement);
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(If node) {
            statement(node.iftrue());
            statement(node.iffalse());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(While node) {
            statement(node.stmt());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(DoWhile node) {
            statement(node.stmt());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(For node) {
            statement(node.stmt());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(Switch node) {
            statement(node.stmt());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(Label node) {
            identifier(node.name());
            statement(node.stmt());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(Case node) {
            node.stmts().forEach(this::statement);
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(Default node) {
            node.stmts().forEach(this::statement);
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(Constant node) {
            constants++;
            return null;
        }

        @Override
        public Void visit(Decl node) {
            identifier(node.name());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(TypeDecl node) {
            identifier(node.declname());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(Typedef node) {
            identifier(node.name());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(Struct node) {
            identifier(node.name());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(Union node) {
            identifier(node.name());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(CNode.Enum node) {
            identifier(node.name());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(Enumerator node) {
            identifier(node.name());
            visitChildren(node);
            return null;
        }

        @Override
        public Void visit(Goto node) {
            identifier(node.name());
            return null;
        }

        @Override
        public Void visit(Id node) {
            identifier(node.name());
            return null;
        }
    }
}
