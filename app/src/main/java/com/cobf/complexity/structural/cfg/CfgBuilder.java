package com.cobf.complexity.structural.cfg;

import com.cobf.complexity.frontend.ast.CNode;
import com.cobf.complexity.frontend.ast.CNode.*;
import com.cobf.complexity.frontend.ast.CNodeWalker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds one control-flow graph per function definition.
 *
 * Interprocedural flow is ignored, as are the extra blocks implied by lazy
 * evaluation of boolean operators; those operators only raise the Myers count
 * when they appear in a decision condition. Switch statements use an
 * approximate model: every case block is entered from one shared condition
 * block and falls through to the case declared after it.
 */
public class CfgBuilder {

    private static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||", "^");

    /**
     * Builds the flows of all function definitions in the file, in source
     * order. Definitions without a declaration or a body are skipped.
     */
    public List<FunctionFlow> build(FileAst tree) {
        List<FunctionFlow> flows = new ArrayList<>();
        for (CNode ext : tree.ext()) {
            if (ext instanceof FuncDef function && function.decl() != null && function.body() != null) {
                flows.add(new FunctionWalk(function).run());
            }
        }
        return flows;
    }

    private static boolean isStructured(CNode node) {
        return node instanceof Compound || node instanceof If || node instanceof Switch
                || node instanceof While || node instanceof DoWhile || node instanceof For;
    }

    private static CNode stripLabels(CNode node) {
        CNode current = node;
        while (current instanceof Label label && label.stmt() != null) {
            current = label.stmt();
        }
        return current;
    }

    /**
     * Splits block items into chained segments: every structured statement
     * (after its labels) is a segment of its own, and runs of simple
     * statements between them form one segment each.
     */
    static List<List<CNode>> segments(List<CNode> items) {
        List<List<CNode>> segments = new ArrayList<>();
        List<CNode> run = new ArrayList<>();
        for (CNode item : items) {
            if (isStructured(stripLabels(item))) {
                if (!run.isEmpty()) {
                    segments.add(run);
                    run = new ArrayList<>();
                }
                segments.add(List.of(item));
            } else {
                run.add(item);
            }
        }
        if (!run.isEmpty()) {
            segments.add(run);
        }
        return segments;
    }

    /**
     * Where control currently is. {@code escaped} means it has already been
     * sent elsewhere (return, break, continue, goto); {@code routed} means a
     * structured statement has wired its own way to {@code exit}. Either one
     * suppresses the fallthrough edge from {@code entry} to {@code exit}.
     */
    private static final class Frame {
        int entry;
        int exit;
        boolean escaped;
        boolean routed;

        Frame(int entry, int exit) {
            this.entry = entry;
            this.exit = exit;
        }
    }

    private static final class FunctionWalk extends CNodeWalker {

        private final FuncDef function;
        private final Map<Integer, Set<Integer>> graph = new TreeMap<>();
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final Deque<Integer> breakTargets = new ArrayDeque<>();
        private final Deque<Integer> continueTargets = new ArrayDeque<>();
        private final Map<String, Integer> labelBlocks = new HashMap<>();
        private final Map<String, Set<Integer>> pendingGotos = new LinkedHashMap<>();
        private int nextBlock;
        private int functionExit;
        private int decisions;
        private int logicalOperators;

        FunctionWalk(FuncDef function) {
            this.function = function;
        }

        FunctionFlow run() {
            int entry = newBlock();
            functionExit = newBlock();
            visitInFrame(function.body(), entry, functionExit);
            resolveGotos();
            pruneUnreachableBlocks(entry);

            Set<Integer> first = graph.get(entry);
            ControlFlowGraph cfg;
            if (first.isEmpty() || (first.size() == 1 && first.contains(functionExit))) {
                cfg = ControlFlowGraph.singleNode(entry);
            } else {
                cfg = new ControlFlowGraph(graph, entry, functionExit);
            }
            return new FunctionFlow(function.name(), function, cfg, decisions + 1,
                    decisions + 1 + logicalOperators);
        }

        private int newBlock() {
            int block = nextBlock++;
            graph.put(block, new LinkedHashSet<>());
            return block;
        }

        private void edge(int from, int to) {
            graph.get(from).add(to);
        }

        private Frame frame() {
            return frames.peek();
        }

        /** Visits a statement in a new frame and adds the fallthrough edge if control still falls through. */
        private void visitInFrame(CNode stmt, int entry, int exit) {
            Frame frame = new Frame(entry, exit);
            frames.push(frame);
            walk(stmt);
            frames.pop();
            if (!frame.escaped && !frame.routed) {
                edge(frame.entry, frame.exit);
            }
        }

        private void countCondition(CNode cond) {
            decisions++;
            if (cond != null) {
                logicalOperators += countLogicalOperators(cond);
            }
        }

        private static int countLogicalOperators(CNode expr) {
            int count = expr instanceof BinaryOp binary && LOGICAL_OPERATORS.contains(binary.op()) ? 1 : 0;
            for (CNode child : expr.children()) {
                count += countLogicalOperators(child);
            }
            return count;
        }

        /** Two-phase goto handling: pending edges recorded during the walk are attached to labels now. */
        private void resolveGotos() {
            pendingGotos.forEach((label, sources) -> {
                Integer target = labelBlocks.get(label);
                if (target != null) {
                    sources.forEach(source -> edge(source, target));
                }
            });
        }

        // Blocks allocated for code after an unconditional jump end up with no edges at all
        private void pruneUnreachableBlocks(int entry) {
            Set<Integer> targets = new HashSet<>();
            graph.values().forEach(targets::addAll);
            graph.keySet().removeIf(block -> block != entry && block != functionExit
                    && graph.get(block).isEmpty() && !targets.contains(block));
        }

        // === Statements that shape the graph ===

        @Override
        protected Void defaultVisit(CNode node) {
            // Declarations and expressions do not branch
            return null;
        }

        @Override
        public Void visit(Compound node) {
            visitItems(node.blockItems());
            return null;
        }

        @Override
        public Void visit(Case node) {
            visitItems(node.stmts());
            return null;
        }

        @Override
        public Void visit(Default node) {
            visitItems(node.stmts());
            return null;
        }

        /**
         * Chains the segments of a block inside the current frame: each segment
         * but the last gets a fresh exit block, which becomes the next entry.
         */
        private void visitItems(List<CNode> items) {
            Frame frame = frame();
            int exit = frame.exit;
            List<List<CNode>> segments = segments(items);
            for (int i = 0; i < segments.size(); i++) {
                boolean last = i == segments.size() - 1;
                int segmentExit = last ? exit : newBlock();
                frame.exit = segmentExit;
                frame.routed = false;
                for (CNode stmt : segments.get(i)) {
                    walk(stmt);
                }
                if (!last) {
                    if (!frame.escaped && !frame.routed) {
                        edge(frame.entry, segmentExit);
                    }
                    frame.entry = segmentExit;
                    frame.routed = false;
                }
            }
        }

        @Override
        public Void visit(If node) {
            Frame frame = frame();
            if (frame.escaped || node.iftrue() == null) {
                return null;
            }
            countCondition(node.cond());
            int thenBlock = newBlock();
            edge(frame.entry, thenBlock);
            visitInFrame(node.iftrue(), thenBlock, frame.exit);
            if (node.iffalse() != null) {
                int elseBlock = newBlock();
                edge(frame.entry, elseBlock);
                visitInFrame(node.iffalse(), elseBlock, frame.exit);
            } else {
                edge(frame.entry, frame.exit);
            }
            frame.routed = true;
            return null;
        }

        @Override
        public Void visit(Switch node) {
            Frame frame = frame();
            if (frame.escaped || node.stmt() == null) {
                return null;
            }
            int condBlock = newBlock();
            edge(frame.entry, condBlock);

            List<CNode> items = node.stmt() instanceof Compound body ? body.blockItems() : List.of(node.stmt());
            breakTargets.push(frame.exit);
            int following = frame.exit;
            boolean hasDefault = false;
            // Reverse order so that each case knows the block of the case after it
            for (int i = items.size() - 1; i >= 0; i--) {
                CNode item = items.get(i);
                CNode caseLabel = stripLabels(item);
                if (!(caseLabel instanceof Case) && !(caseLabel instanceof Default)) {
                    continue; // never reached without a case label
                }
                int caseBlock = newBlock();
                edge(condBlock, caseBlock);
                CNode wrapper = item;
                while (wrapper instanceof Label named) {
                    labelBlocks.put(named.name(), caseBlock);
                    wrapper = named.stmt();
                }
                visitInFrame(caseLabel, caseBlock, following);
                // default is a branch of the switch like any case label
                countCase();
                hasDefault |= caseLabel instanceof Default;
                following = caseBlock;
            }
            breakTargets.pop();
            if (!hasDefault) {
                edge(condBlock, frame.exit);
            }
            frame.routed = true;
            return null;
        }

        private void countCase() {
            decisions++;
        }

        @Override
        public Void visit(While node) {
            Frame frame = frame();
            if (frame.escaped || node.stmt() == null) {
                return null;
            }
            countCondition(node.cond());
            int condBlock = newBlock();
            edge(frame.entry, condBlock);
            int bodyBlock = newBlock();
            edge(condBlock, bodyBlock);

            breakTargets.push(frame.exit);
            continueTargets.push(condBlock);
            visitInFrame(node.stmt(), bodyBlock, condBlock);
            continueTargets.pop();
            breakTargets.pop();

            edge(condBlock, frame.exit);
            frame.routed = true;
            return null;
        }

        @Override
        public Void visit(DoWhile node) {
            Frame frame = frame();
            if (frame.escaped || node.stmt() == null) {
                return null;
            }
            countCondition(node.cond());
            int testBlock = newBlock();
            int bodyBlock = newBlock();
            edge(frame.entry, bodyBlock);
            edge(testBlock, bodyBlock);
            edge(testBlock, frame.exit);

            breakTargets.push(frame.exit);
            continueTargets.push(testBlock);
            visitInFrame(node.stmt(), bodyBlock, testBlock);
            continueTargets.pop();
            breakTargets.pop();

            frame.routed = true;
            return null;
        }

        @Override
        public Void visit(For node) {
            Frame frame = frame();
            if (frame.escaped || node.stmt() == null) {
                return null;
            }
            if (node.cond() != null) {
                countCondition(node.cond());
            }
            int testBlock = newBlock();
            edge(frame.entry, testBlock);
            int stepBlock = newBlock();
            int bodyBlock = newBlock();
            edge(testBlock, bodyBlock);
            if (node.cond() != null) {
                edge(testBlock, frame.exit);
            }
            edge(stepBlock, testBlock);

            breakTargets.push(frame.exit);
            continueTargets.push(stepBlock);
            visitInFrame(node.stmt(), bodyBlock, stepBlock);
            continueTargets.pop();
            breakTargets.pop();

            frame.routed = true;
            return null;
        }

        // === Jumps ===

        @Override
        public Void visit(Break node) {
            jump(breakTargets.peek());
            return null;
        }

        @Override
        public Void visit(Continue node) {
            jump(continueTargets.peek());
            return null;
        }

        @Override
        public Void visit(Return node) {
            jump(functionExit);
            return null;
        }

        private void jump(Integer target) {
            Frame frame = frame();
            if (frame.escaped || target == null) {
                return;
            }
            edge(frame.entry, target);
            frame.escaped = true;
        }

        @Override
        public Void visit(Goto node) {
            Frame frame = frame();
            if (frame.escaped) {
                return null;
            }
            pendingGotos.computeIfAbsent(node.name(), name -> new LinkedHashSet<>()).add(frame.entry);
            frame.escaped = true;
            return null;
        }

        @Override
        public Void visit(Label node) {
            Frame frame = frame();
            int block = newBlock();
            if (frame.escaped) {
                // reachable again through the label
                frame.escaped = false;
            } else {
                edge(frame.entry, block);
            }
            labelBlocks.put(node.name(), block);
            frame.entry = block;
            walk(node.stmt());
            return null;
        }
    }
}
