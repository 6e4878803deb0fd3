package com.cobf.complexity.structural.cfg;

import com.cobf.complexity.frontend.ast.CNode.FuncDef;

/**
 * Control flow of one function definition with its decision counts.
 *
 * @param mccabe decisions + 1
 * @param myers  decisions + 1 + logical operators inside decision conditions
 */
public record FunctionFlow(String name, FuncDef function, ControlFlowGraph graph, int mccabe, int myers) {
}
